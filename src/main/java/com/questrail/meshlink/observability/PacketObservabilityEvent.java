package com.questrail.meshlink.observability;

import com.questrail.meshlink.api.MessageStatus;
import com.questrail.meshlink.api.PacketId;

import java.time.Instant;

/**
 * Record describing a delivery-queue event for one packet.
 *
 * @param packetId   packet concerned; {@code null} for queue-wide events
 * @param fromStatus status before the event, or {@code null}
 * @param toStatus   status after (or refused by) the event, or {@code null}
 * @param detail     free-form detail for logs
 */
public record PacketObservabilityEvent(
    Instant timestamp,
    Kind kind,
    PacketId packetId,
    MessageStatus fromStatus,
    MessageStatus toStatus,
    String detail
) {
    public enum Kind {
        SUBMITTED,
        STATUS_CHANGED,
        TRANSITION_REJECTED,
        ACK_RETRY,
        REPLAY_SCHEDULED,
        UNKNOWN_PACKET,
        QUEUE_FULL
    }
}
