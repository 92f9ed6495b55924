package com.questrail.meshlink.observability;

import com.questrail.meshlink.internal.lifecycle.RecoveryAction;

import java.time.Instant;

/**
 * Record representing the recovery chosen after a link failure.
 *
 * @param attempt reconnect attempt the action belongs to (1-based)
 * @param device  address of the device being recovered, or {@code null}
 */
public record RecoveryObservabilityEvent(
    Instant timestamp,
    RecoveryAction action,
    int attempt,
    String device
) {
}
