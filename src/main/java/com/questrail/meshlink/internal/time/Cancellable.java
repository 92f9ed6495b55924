package com.questrail.meshlink.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled task: an operation timeout, a packet acknowledgment
 * timeout, a reconnect timer or a drain delay.
 *
 * <p>
 * Every component that arms a timer keeps the handle and cancels it as soon as
 * the guarded work resolves, so a late timer never resolves work twice.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();

    /**
     * A handle that refers to nothing. Useful as an initial field value.
     */
    Cancellable NONE = () -> false;
}
