package com.questrail.meshlink.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the connect sequence.
 *
 * @param requestedTransferUnit transfer unit asked for during parameter negotiation
 * @param drainInterval         pause between backlog reads and between empty reads while the handshake runs
 * @param handshakeTimeout      time allowed from sending the configuration request to its completion marker
 */
public record HandshakePolicy(int requestedTransferUnit, Duration drainInterval, Duration handshakeTimeout)
{
    public HandshakePolicy {
        Objects.requireNonNull(drainInterval, "drainInterval");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");

        if (requestedTransferUnit < 23) {
            throw new IllegalArgumentException("requestedTransferUnit must be >= 23");
        }
        if (drainInterval.isNegative()) {
            throw new IllegalArgumentException("drainInterval must be non-negative");
        }
        if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
            throw new IllegalArgumentException("handshakeTimeout must be positive");
        }
    }

    public static HandshakePolicy defaults() {
        return new HandshakePolicy(512, Duration.ofMillis(100), Duration.ofSeconds(30));
    }
}
