package com.questrail.meshlink.codec;

import com.questrail.meshlink.api.PacketId;

import java.util.Objects;

/**
 * Routing response correlated with a previously sent packet.
 *
 * @param requestId       id of the packet being answered
 * @param errorReason     0 for a positive acknowledgment, otherwise the mesh routing error
 * @param fromDestination {@code true} when the answer comes from the packet's destination node itself
 */
public record AckFrame(PacketId requestId, int errorReason, boolean fromDestination)
{
    public static final int NO_ERROR = 0;

    public AckFrame {
        Objects.requireNonNull(requestId, "requestId");
    }

    public boolean isAck() {
        return errorReason == NO_ERROR;
    }
}
