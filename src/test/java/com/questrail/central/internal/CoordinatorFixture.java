package com.questrail.central.internal;

import com.questrail.central.api.ReadinessState;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.observability.RecordingObservabilitySink;
import com.questrail.central.radio.RecordingRadioManager;
import com.questrail.central.time.DeterministicScheduler;
import com.questrail.central.time.ManualMonotonicClock;

import java.time.Duration;
import java.time.Instant;

/**
 * Deterministic wiring for gate and coordinator tests.
 *
 * <p>The event loop is a direct executor: deadline tasks run inline when
 * {@link #advance(Duration)} reaches them. No threads, no sleeps.</p>
 */
public final class CoordinatorFixture {

    public final ManualMonotonicClock clock = new ManualMonotonicClock();
    public final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    public final RecordingRadioManager radio = new RecordingRadioManager();
    public final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    public final CentralContext context =
            new CentralContext(radio, clock, scheduler, Runnable::run, () -> Instant.EPOCH, sink);
    public final ReadinessGate gate;

    public CoordinatorFixture(ReadinessState initialState) {
        this.gate = new ReadinessGate(context, initialState);
    }

    public static CoordinatorFixture poweredOn() {
        return new CoordinatorFixture(ReadinessState.POWERED_ON);
    }

    public void advance(Duration duration) {
        clock.advance(duration);
        scheduler.runDueTasks();
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
