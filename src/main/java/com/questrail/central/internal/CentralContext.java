package com.questrail.central.internal;

import com.questrail.central.api.PeripheralId;
import com.questrail.central.internal.time.Cancellable;
import com.questrail.central.internal.time.MonotonicClock;
import com.questrail.central.internal.time.MonotonicScheduler;
import com.questrail.central.internal.time.WallClock;
import com.questrail.central.observability.CentralErrorEvent;
import com.questrail.central.observability.CentralObservabilitySink;
import com.questrail.central.observability.CentralOperationEvent;
import com.questrail.central.radio.RadioManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * CentralContext
 * =============================================================================
 * Collaborators shared by the gate, the coordinators and the dispatcher.
 *
 * <h2>Threading</h2>
 * <p>{@code eventLoop} is the single serialization point for all coordinator
 * state. Deadline tasks fire on a scheduler thread and are handed back to it
 * by {@link #armDeadline(Duration, Runnable)}; coordinator code therefore only
 * ever runs on the event loop.</p>
 */
public record CentralContext(
        RadioManager radio,
        MonotonicClock clock,
        MonotonicScheduler scheduler,
        Executor eventLoop,
        WallClock wallClock,
        CentralObservabilitySink sink
) {
    public CentralContext {
        Objects.requireNonNull(radio, "radio");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(eventLoop, "eventLoop");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(sink, "sink");
    }

    /**
     * Arms a deadline whose task runs on the event loop.
     */
    public Cancellable armDeadline(Duration timeout, Runnable onDeadline) {
        Objects.requireNonNull(onDeadline, "onDeadline");
        return scheduler.scheduleAfter(timeout, clock, () -> eventLoop.execute(onDeadline));
    }

    /**
     * Runs a caller-supplied callback. A callback that throws is reported to
     * the sink and does not prevent the remaining callbacks of a fan-out.
     */
    public void invokeSafely(String what, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            sink.onError(new CentralErrorEvent(now(), "Callback failed during " + what, e));
        }
    }

    public void emit(CentralOperationEvent.Kind kind, String operation, PeripheralId peripheral, String detail) {
        sink.onOperationEvent(new CentralOperationEvent(now(), kind, operation, Optional.ofNullable(peripheral), detail));
    }

    public Instant now() {
        return wallClock.now();
    }
}
