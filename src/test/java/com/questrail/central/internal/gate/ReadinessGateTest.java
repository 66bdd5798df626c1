package com.questrail.central.internal.gate;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.internal.CoordinatorFixture;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReadinessGateTest
 * -----------------------------------------------------------------------------
 * Readiness observation, queueing during transitional states, and the
 * state-to-error mapping used by every operation.
 */
class ReadinessGateTest {

    @Test
    void terminalStateAnswersImmediately() {
        CoordinatorFixture fx = new CoordinatorFixture(ReadinessState.POWERED_OFF);
        List<ReadinessState> seen = new ArrayList<>();

        fx.gate.observeState(seen::add);

        assertEquals(List.of(ReadinessState.POWERED_OFF), seen);
        assertEquals(0, fx.gate.pendingCount());
    }

    @Test
    void unknownToPoweredOnReleasesQueuedCallbacksInOrderOnce() {
        CoordinatorFixture fx = new CoordinatorFixture(ReadinessState.UNKNOWN);
        List<String> seen = new ArrayList<>();

        fx.gate.observeState(s -> seen.add("a:" + s));
        fx.gate.observeState(s -> seen.add("b:" + s));
        fx.gate.observeState(s -> seen.add("c:" + s));
        assertTrue(seen.isEmpty());
        assertEquals(3, fx.gate.pendingCount());

        assertEquals(3, fx.gate.onStateChanged(ReadinessState.POWERED_ON));
        assertEquals(List.of("a:POWERED_ON", "b:POWERED_ON", "c:POWERED_ON"), seen);

        // A later change must not re-invoke released callbacks.
        fx.gate.onStateChanged(ReadinessState.POWERED_OFF);
        assertEquals(3, seen.size());
    }

    @Test
    void resettingKeepsCallbacksQueued() {
        CoordinatorFixture fx = new CoordinatorFixture(ReadinessState.UNKNOWN);
        List<ReadinessState> seen = new ArrayList<>();
        fx.gate.observeState(seen::add);

        assertEquals(0, fx.gate.onStateChanged(ReadinessState.RESETTING));
        assertTrue(seen.isEmpty());
        assertEquals(ReadinessState.RESETTING, fx.gate.state());

        fx.gate.onStateChanged(ReadinessState.UNAUTHORIZED);
        assertEquals(List.of(ReadinessState.UNAUTHORIZED), seen);
    }

    @Test
    void poweredOnToResettingQueuesNewObservers() {
        CoordinatorFixture fx = CoordinatorFixture.poweredOn();
        fx.gate.onStateChanged(ReadinessState.RESETTING);

        List<ReadinessState> seen = new ArrayList<>();
        fx.gate.observeState(seen::add);
        assertTrue(seen.isEmpty());

        fx.gate.onStateChanged(ReadinessState.POWERED_ON);
        assertEquals(List.of(ReadinessState.POWERED_ON), seen);
    }

    @Test
    void ensureReadyMapsTerminalStates() {
        assertInstanceOf(CentralException.BluetoothUnsupported.class,
                ensureReadyIn(ReadinessState.UNSUPPORTED).orElseThrow());
        assertInstanceOf(CentralException.BluetoothUnauthorized.class,
                ensureReadyIn(ReadinessState.UNAUTHORIZED).orElseThrow());
        assertInstanceOf(CentralException.BluetoothPoweredOff.class,
                ensureReadyIn(ReadinessState.POWERED_OFF).orElseThrow());
        assertTrue(ensureReadyIn(ReadinessState.POWERED_ON).isEmpty());
    }

    @Test
    void ensureReadyWhilePoweredOffIssuesNoRadioCommand() {
        CoordinatorFixture fx = new CoordinatorFixture(ReadinessState.POWERED_OFF);
        List<Optional<CentralException>> results = new ArrayList<>();

        fx.gate.ensureReady(results::add);

        assertEquals(1, results.size());
        assertInstanceOf(CentralException.BluetoothPoweredOff.class, results.get(0).orElseThrow());
        assertTrue(fx.radio.commands().isEmpty());
    }

    @Test
    void failingCallbackDoesNotStarveTheOthers() {
        CoordinatorFixture fx = new CoordinatorFixture(ReadinessState.UNKNOWN);
        List<ReadinessState> seen = new ArrayList<>();

        fx.gate.observeState(s -> { throw new IllegalStateException("boom"); });
        fx.gate.observeState(seen::add);

        fx.gate.onStateChanged(ReadinessState.POWERED_ON);

        assertEquals(List.of(ReadinessState.POWERED_ON), seen);
        assertEquals(1, fx.sink.errors().size());
        assertEquals("boom", fx.sink.errors().get(0).cause().getMessage());
    }

    @Test
    void gateErrorRejectsTransitionalStates() {
        assertThrows(IllegalStateException.class, () -> ReadinessGate.gateError(ReadinessState.UNKNOWN));
        assertThrows(IllegalStateException.class, () -> ReadinessGate.gateError(ReadinessState.RESETTING));
    }

    private static Optional<CentralException> ensureReadyIn(ReadinessState state) {
        CoordinatorFixture fx = new CoordinatorFixture(state);
        List<Optional<CentralException>> results = new ArrayList<>();
        fx.gate.ensureReady(results::add);
        assertEquals(1, results.size());
        return results.get(0);
    }
}
