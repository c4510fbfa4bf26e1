package com.questrail.helixd.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled tasks.
 *
 * <p>Wait timeouts are armed through this handle and disarmed as soon as the
 * awaited job resolves, so the timer never fires for an already released
 * waiter.</p>
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
}
