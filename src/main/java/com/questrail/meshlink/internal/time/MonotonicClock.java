package com.questrail.meshlink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational correctness.
 *
 * <h2>Binding invariant</h2>
 * Operation timeouts, acknowledgment timeouts, drain delays and reconnect
 * backoff MUST use a monotonic time source. Wall-clock time is permitted only
 * for observability and packet creation stamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
