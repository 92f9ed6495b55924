package com.questrail.meshlink.config;

import java.time.Duration;
import java.util.Objects;

/**
 * OperationTimingPolicy
 * -----------------------------------------------------------------------------
 * Timing and retry settings of the operation queue.
 *
 * <ul>
 *   <li><b>operationTimeout</b>: time a single transport operation may occupy the
 *       in-flight slot before it is failed with a timeout.</li>
 *   <li><b>maxAttempts</b>: attempts granted to reads and reliable writes. The
 *       first attempt is attempt 1; a failure of attempt {@code maxAttempts}
 *       escalates instead of retrying.</li>
 *   <li><b>reliableWriteBackoff</b>: pause before a failed reliable write is
 *       queued again.</li>
 * </ul>
 */
public record OperationTimingPolicy(
        Duration operationTimeout,
        int maxAttempts,
        Duration reliableWriteBackoff
) {
    public OperationTimingPolicy {
        Objects.requireNonNull(operationTimeout, "operationTimeout");
        Objects.requireNonNull(reliableWriteBackoff, "reliableWriteBackoff");

        if (operationTimeout.isNegative() || operationTimeout.isZero()) {
            throw new IllegalArgumentException("operationTimeout must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (reliableWriteBackoff.isNegative()) {
            throw new IllegalArgumentException("reliableWriteBackoff must be non-negative");
        }
    }

    /**
     * 4 s timeout, 3 attempts, 200 ms reliable-write backoff.
     */
    public static OperationTimingPolicy defaults() {
        return new OperationTimingPolicy(Duration.ofSeconds(4), 3, Duration.ofMillis(200));
    }
}
