package com.questrail.central.internal.peripheral;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.internal.CoordinatorFixture;
import com.questrail.central.radio.PeripheralConnectionState;
import com.questrail.central.radio.RecordingRadioManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DisconnectCoordinatorTest {

    private static final PeripheralId P1 = PeripheralId.of("00000000-0000-0000-0000-000000000001");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private CoordinatorFixture fx;
    private DisconnectCoordinator disconnects;

    @BeforeEach
    void setUp() {
        fx = CoordinatorFixture.poweredOn();
        disconnects = new DisconnectCoordinator(fx.context, fx.gate);
    }

    @Test
    void disconnectedOrDisconnectingPeripheralIsSatisfiedImmediately() {
        List<Optional<CentralException>> outcomes = new ArrayList<>();

        fx.radio.setKnownState(P1, PeripheralConnectionState.DISCONNECTED);
        disconnects.submit(P1, TIMEOUT, outcomes::add);
        fx.radio.setKnownState(P1, PeripheralConnectionState.DISCONNECTING);
        disconnects.submit(P1, TIMEOUT, outcomes::add);

        assertEquals(List.of(Optional.empty(), Optional.empty()), outcomes);
        assertTrue(fx.radio.commands().isEmpty());
    }

    @Test
    void unknownPeripheralStillIssuesCancelConnection() {
        disconnects.submit(P1, TIMEOUT, outcome -> { });

        assertEquals(List.of(new RecordingRadioManager.CancelConnection(P1)), fx.radio.commands());
        assertTrue(disconnects.isPending(P1));
    }

    @Test
    void connectedPeripheralDisconnectsOnNotification() {
        fx.radio.setKnownState(P1, PeripheralConnectionState.CONNECTED);
        List<Optional<CentralException>> outcomes = new ArrayList<>();
        disconnects.submit(P1, TIMEOUT, outcomes::add);
        disconnects.submit(P1, TIMEOUT, outcomes::add);

        assertEquals(1, fx.radio.commands().size());
        assertTrue(disconnects.onDisconnected(P1, Optional.empty()));

        assertEquals(List.of(Optional.empty(), Optional.empty()), outcomes);
        assertEquals(0, fx.scheduler.armedCount());
    }

    @Test
    void disconnectWithErrorBecomesResourceError() {
        fx.radio.setKnownState(P1, PeripheralConnectionState.CONNECTED);
        List<Optional<CentralException>> outcomes = new ArrayList<>();
        disconnects.submit(P1, TIMEOUT, outcomes::add);

        disconnects.onDisconnected(P1, Optional.of(new IOException("supervision timeout")));

        CentralException.ResourceError error =
                assertInstanceOf(CentralException.ResourceError.class, outcomes.get(0).orElseThrow());
        assertEquals(DisconnectCoordinator.OPERATION, error.operationName());
    }

    @Test
    void deadlineTimesOut() {
        fx.radio.setKnownState(P1, PeripheralConnectionState.CONNECTED);
        List<Optional<CentralException>> outcomes = new ArrayList<>();
        disconnects.submit(P1, Duration.ofSeconds(3), outcomes::add);

        fx.advanceMillis(3_000);

        CentralException.OperationTimeout timeout =
                assertInstanceOf(CentralException.OperationTimeout.class, outcomes.get(0).orElseThrow());
        assertEquals("Timed out during \"disconnect peripheral\" operation", timeout.getMessage());
        assertFalse(disconnects.isPending(P1));
    }

    @Test
    void joinedWaitersShareOneCommandAndTimeoutInOrder() {
        fx.radio.setKnownState(P1, PeripheralConnectionState.CONNECTED);
        List<String> log = new ArrayList<>();
        disconnects.submit(P1, Duration.ofSeconds(4), outcome -> log.add("a:" + describe(outcome)));
        fx.advanceMillis(1_000);
        disconnects.submit(P1, Duration.ofSeconds(30), outcome -> log.add("b:" + describe(outcome)));
        disconnects.submit(P1, Duration.ofSeconds(30), outcome -> log.add("c:" + describe(outcome)));

        assertEquals(List.of(new RecordingRadioManager.CancelConnection(P1)), fx.radio.commands());
        assertEquals(3, disconnects.waiterCount(P1));
        assertEquals(1, fx.scheduler.armedCount());

        fx.advanceMillis(3_000);

        assertEquals(List.of("a:OperationTimeout", "b:OperationTimeout", "c:OperationTimeout"), log);
        assertFalse(disconnects.isPending(P1));
    }

    @Test
    void staleDeadlineDoesNotFailNewerRequest() {
        fx.radio.setKnownState(P1, PeripheralConnectionState.CONNECTED);
        List<String> log = new ArrayList<>();
        disconnects.submit(P1, Duration.ofSeconds(2), outcome -> log.add("first:" + describe(outcome)));
        disconnects.onDisconnected(P1, Optional.empty());

        disconnects.submit(P1, Duration.ofSeconds(10), outcome -> log.add("second:" + describe(outcome)));
        fx.advanceMillis(5_000);

        assertEquals(List.of("first:ok"), log);
        assertTrue(disconnects.isPending(P1));
        assertEquals(2, fx.radio.commandsOfType(RecordingRadioManager.CancelConnection.class).size());

        fx.advanceMillis(5_000);
        assertEquals(List.of("first:ok", "second:OperationTimeout"), log);
    }

    @Test
    void unsolicitedDisconnectIsDropped() {
        assertFalse(disconnects.onDisconnected(P1, Optional.empty()));
        assertEquals(0, disconnects.pendingCount());
    }

    private static String describe(Optional<CentralException> outcome) {
        return outcome.map(e -> e.getClass().getSimpleName()).orElse("ok");
    }
}
