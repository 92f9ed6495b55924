package com.questrail.meshlink.api;

import java.util.Objects;

/**
 * Final outcome of a submitted packet.
 *
 * <p>Returned through the future of {@link MeshLinkClient#submitPacket}. The future
 * completes normally with a result whose status is {@link MessageStatus#SENT}
 * (untracked packets), {@link MessageStatus#DELIVERED} or
 * {@link MessageStatus#RECEIVED}; every other outcome completes it exceptionally.</p>
 *
 * @param packetId      id assigned by the delivery queue
 * @param correlationId caller-supplied tag, echoed back unchanged (may be {@code null})
 * @param status        final status
 */
public record DeliveryResult(PacketId packetId, String correlationId, MessageStatus status)
{
    public DeliveryResult {
        Objects.requireNonNull(packetId, "packetId");
        Objects.requireNonNull(status, "status");
    }
}
