package com.questrail.meshlink.internal.lifecycle;

/**
 * Recovery chosen after a link failure.
 */
public enum RecoveryAction
{
    /** Reconnect with backoff. */
    RECONNECT,

    /** Reconnect with backoff and drop the service cache after link-up. */
    RECONNECT_WITH_CACHE_REFRESH,

    /** Restart the radio adapter, then reconnect with backoff. */
    RESTART_STACK,

    /** Reconnect budget exhausted; the link is failed. */
    GIVE_UP
}
