package com.questrail.meshlink.internal.queue;

/**
 * Told when an operation failure means the link itself is suspect.
 */
@FunctionalInterface
public interface OperationEscalationListener
{
    OperationEscalationListener NONE = (operation, cause) -> { };

    void onEscalation(TransportOperation<?> operation, Throwable cause);
}
