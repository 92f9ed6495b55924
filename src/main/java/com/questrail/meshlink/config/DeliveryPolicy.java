package com.questrail.meshlink.config;

import java.time.Duration;
import java.util.Objects;

/**
 * DeliveryPolicy
 * -----------------------------------------------------------------------------
 * Settings of the packet delivery queue.
 *
 * <ul>
 *   <li><b>drainTimeout</b>: how long the queue waits for the radio write of one
 *       packet. Kept close to the operation timeout and well below
 *       {@code ackTimeout}.</li>
 *   <li><b>ackTimeout</b>: how long a tracked packet waits for a mesh
 *       acknowledgment.</li>
 *   <li><b>maxAckRetries</b>: re-sends of an unacknowledged packet before it is
 *       declared failed. Independent of the operation queue's attempts.</li>
 *   <li><b>maxPacketSize</b>: largest framed packet accepted for sending.</li>
 *   <li><b>reliableWrite</b>: send packets with reliable writes instead of plain
 *       writes.</li>
 * </ul>
 */
public record DeliveryPolicy(
        Duration drainTimeout,
        Duration ackTimeout,
        int maxAckRetries,
        int maxPacketSize,
        boolean reliableWrite
) {
    public DeliveryPolicy {
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(ackTimeout, "ackTimeout");

        if (drainTimeout.isNegative() || drainTimeout.isZero()) {
            throw new IllegalArgumentException("drainTimeout must be positive");
        }
        if (ackTimeout.compareTo(drainTimeout) <= 0) {
            throw new IllegalArgumentException("ackTimeout must be longer than drainTimeout");
        }
        if (maxAckRetries < 0) {
            throw new IllegalArgumentException("maxAckRetries must be >= 0");
        }
        if (maxPacketSize < 1) {
            throw new IllegalArgumentException("maxPacketSize must be >= 1");
        }
    }

    /**
     * 5 s drain timeout, 2 min ack timeout, 1 ack retry, 252 byte packets,
     * reliable writes.
     */
    public static DeliveryPolicy defaults() {
        return new DeliveryPolicy(Duration.ofSeconds(5), Duration.ofMinutes(2), 1, 252, true);
    }
}
