package com.questrail.central.observability;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ReadinessState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The SLF4J sink must accept every event shape without throwing; output goes
 * to slf4j-simple during tests.
 */
class Slf4jCentralObservabilitySinkTest {

    private final Slf4jCentralObservabilitySink sink = new Slf4jCentralObservabilitySink();

    @Test
    void logsEveryOperationKind() {
        PeripheralId peripheral = PeripheralId.of("00000000-0000-0000-0000-000000000001");

        for (CentralOperationEvent.Kind kind : CentralOperationEvent.Kind.values()) {
            assertDoesNotThrow(() -> sink.onOperationEvent(new CentralOperationEvent(
                    Instant.EPOCH, kind, "connect peripheral", Optional.of(peripheral), "detail")));
            assertDoesNotThrow(() -> sink.onOperationEvent(new CentralOperationEvent(
                    Instant.EPOCH, kind, "scan peripherals", Optional.empty(), "")));
        }
    }

    @Test
    void logsReadinessTransitionsAndErrors() {
        ReadinessTransitionEvent degradation = new ReadinessTransitionEvent(
                Instant.EPOCH, ReadinessState.POWERED_ON, ReadinessState.POWERED_OFF, 0);
        ReadinessTransitionEvent recovery = new ReadinessTransitionEvent(
                Instant.EPOCH, ReadinessState.UNKNOWN, ReadinessState.POWERED_ON, 2);

        assertTrue(degradation.isDegradation());
        assertFalse(recovery.isDegradation());
        assertDoesNotThrow(() -> sink.onReadinessTransition(degradation));
        assertDoesNotThrow(() -> sink.onReadinessTransition(recovery));
        assertDoesNotThrow(() -> sink.onError(new CentralErrorEvent(Instant.EPOCH, "Callback failed",
                new CentralException.ResourceError("connect peripheral", new IOException("gatt")))));
    }
}
