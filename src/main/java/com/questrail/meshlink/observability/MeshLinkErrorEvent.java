package com.questrail.meshlink.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the link stack.
 */
public record MeshLinkErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
