package com.questrail.meshlink.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Linear reconnect backoff: attempt {@code n} waits {@code min(n * baseDelay, maxDelay)}.
 * After {@code maxAttempts} failed reconnects the link gives up.
 */
public record ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts)
{
    public ReconnectPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 5);
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        Duration linear = baseDelay.multipliedBy(attempt);
        return linear.compareTo(maxDelay) > 0 ? maxDelay : linear;
    }
}
