package com.questrail.meshlink.api;

/**
 * Handle returned by listener and handler registrations.
 * Cancelling is idempotent.
 */
@FunctionalInterface
public interface Registration
{
    void cancel();
}
