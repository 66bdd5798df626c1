package com.questrail.central.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled deadline.
 *
 * <p>Coordinators cancel a request's deadline when the request resolves. A
 * deadline may still fire after cancellation was attempted (the task may
 * already be queued for the event loop); the request token check makes that
 * firing a no-op.</p>
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
