package com.questrail.meshlink.observability;

import java.time.Instant;

/**
 * Record describing what happened to one transport operation.
 *
 * @param operation operation variant, e.g. {@code "Read"}
 * @param target    characteristic name
 * @param attempt   1-based attempt number
 * @param cause     failure cause, or {@code null}
 */
public record OperationObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String operation,
    String target,
    int attempt,
    Throwable cause
) {
    public enum Kind {
        DISPATCHED,
        COMPLETED,
        TIMED_OUT,
        RETRY_SCHEDULED,
        FAILED,
        ESCALATED,
        UNAVAILABLE,
        RESET,
        CANCELLED
    }
}
