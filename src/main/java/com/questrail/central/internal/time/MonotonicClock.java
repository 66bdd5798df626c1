package com.questrail.central.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for request deadlines.
 *
 * <p>All deadline computations use a monotonic source. Wall-clock time is
 * only used to timestamp observability and broadcast events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
