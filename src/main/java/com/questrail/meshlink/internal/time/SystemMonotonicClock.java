package com.questrail.meshlink.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 * Unaffected by NTP or manual wall-clock changes. Thread-safe.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
