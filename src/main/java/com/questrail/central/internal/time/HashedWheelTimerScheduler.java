package com.questrail.central.internal.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <p>A timer wheel trades deadline precision (one tick) for O(1) arming and
 * cancellation, which suits a central that arms one deadline per request and
 * cancels almost all of them when the radio answers.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@link Timer}, {@link Timeout}) MUST NOT escape this class.
 *
 * <h2>Lifecycle</h2>
 * The scheduler owns its timer; {@link #stop()} releases the worker thread and
 * drops every pending deadline.
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler
{
    private final Timer timer;
    private final MonotonicClock clock;

    /**
     * @param tickMillis wheel tick duration; deadlines fire up to one tick late
     * @param clock      clock used to convert absolute deadlines into delays
     */
    public HashedWheelTimerScheduler(long tickMillis, MonotonicClock clock)
    {
        if (tickMillis <= 0) {
            throw new IllegalArgumentException("tickMillis must be > 0");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timer = new HashedWheelTimer(
                runnable -> {
                    Thread t = new Thread(runnable, "central-deadline-wheel");
                    t.setDaemon(true);
                    return t;
                },
                tickMillis,
                TimeUnit.MILLISECONDS);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = MonotonicScheduler.remainingNanos(deadlineNanos, clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    /**
     * Stops the wheel. Pending deadlines never fire.
     */
    public void stop()
    {
        timer.stop();
    }
}
