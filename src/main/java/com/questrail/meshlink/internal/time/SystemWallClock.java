package com.questrail.meshlink.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for timeouts or backoff.</strong> Observability
 * timestamps and packet creation stamps only.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
