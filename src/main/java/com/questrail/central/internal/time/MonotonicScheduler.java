package com.questrail.central.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used to arm request deadlines.
 *
 * <p>Tasks run on a scheduler-owned thread. Coordinators never touch their
 * state from a scheduled task directly; they hand the firing back to the
 * central event loop.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Convenience method: schedule after a duration using a provided monotonic clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(deadlineAfter(clock.nowNanos(), delay), task);
    }

    /**
     * {@code nowNanos + delay}, saturating at {@link Long#MAX_VALUE} for
     * delays too long to represent.
     */
    static long deadlineAfter(long nowNanos, Duration delay)
    {
        long delayNanos;
        try {
            delayNanos = delay.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
        long deadline = nowNanos + delayNanos;
        if (nowNanos > 0 && delayNanos > 0 && deadline < 0) {
            return Long.MAX_VALUE;
        }
        return deadline;
    }

    /**
     * Nanoseconds from {@code nowNanos} until {@code deadlineNanos}, never
     * negative, saturating at {@link Long#MAX_VALUE}.
     */
    static long remainingNanos(long deadlineNanos, long nowNanos)
    {
        try {
            return Math.max(0L, Math.subtractExact(deadlineNanos, nowNanos));
        } catch (ArithmeticException e) {
            return deadlineNanos > nowNanos ? Long.MAX_VALUE : 0L;
        }
    }
}
