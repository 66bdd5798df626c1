package com.questrail.central.internal.scan;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ScanEvent;
import com.questrail.central.api.ScanFilter;
import com.questrail.central.internal.CentralContext;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.internal.time.Cancellable;
import com.questrail.central.observability.CentralErrorEvent;
import com.questrail.central.observability.CentralOperationEvent;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * ScanCoordinator
 * =============================================================================
 * Owns the single scan slot.
 *
 * <h2>State machine</h2>
 * <pre>
 *   Idle --scan()--> Active --stop() | deadline | readiness loss--> Idle
 * </pre>
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>A new scan replaces the active one. The replaced caller receives
 *       {@link ScanEvent.Stopped} with no error before the new caller receives
 *       {@link ScanEvent.Started}.</li>
 *   <li>Discovery results reach only the active caller.</li>
 *   <li>The deadline ends the scan normally. A deadline armed for a scan that
 *       was since stopped or replaced does nothing (token guard).</li>
 * </ul>
 *
 * <p>Not thread-safe: confined to the central event loop.</p>
 */
public final class ScanCoordinator
{
    public static final String OPERATION = "scan peripherals";

    private final CentralContext context;
    private final ReadinessGate gate;

    private ActiveScan active;
    private long lastToken = 0L;

    public ScanCoordinator(CentralContext context, ReadinessGate gate)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.gate = Objects.requireNonNull(gate, "gate");
    }

    public boolean isActive()
    {
        return active != null;
    }

    public void scan(Duration timeout, ScanFilter filter, Consumer<ScanEvent> callback)
    {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(callback, "callback");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }

        gate.ensureReady(error -> {
            if (error.isPresent()) {
                deliver(callback, ScanEvent.Stopped.withError(error.get()));
                return;
            }
            start(timeout, filter, callback);
        });
    }

    private void start(Duration timeout, ScanFilter filter, Consumer<ScanEvent> callback)
    {
        if (active != null) {
            stop(Optional.empty());
        }

        ActiveScan scan = new ActiveScan(++lastToken, callback);
        active = scan;

        deliver(callback, new ScanEvent.Started());
        if (active != scan) {
            // The caller stopped or replaced the scan from inside its callback.
            return;
        }

        long token = scan.token;
        try {
            scan.deadline = context.armDeadline(timeout, () -> onDeadline(token));
            context.radio().startScan(filter);
            context.emit(CentralOperationEvent.Kind.COMMAND_ISSUED, OPERATION, null, "startScan " + filter.serviceUuids());
        } catch (RuntimeException e) {
            stop(Optional.of(new CentralException.ResourceError(OPERATION, e)));
        }
    }

    /**
     * Stops the active scan, if any, delivering {@code error} to its caller.
     * The radio manager is told to halt discovery in every case; if it
     * rejects that, the failure is reported to the sink and the caller still
     * receives {@link ScanEvent.Stopped}.
     */
    public void stop(Optional<CentralException> error)
    {
        Objects.requireNonNull(error, "error");

        ActiveScan scan = active;
        if (scan != null) {
            active = null;
            scan.cancelDeadline();
        }

        try {
            context.radio().stopScan();
            context.emit(CentralOperationEvent.Kind.COMMAND_ISSUED, OPERATION, null, "stopScan");
        } catch (RuntimeException e) {
            context.sink().onError(new CentralErrorEvent(context.now(), "Radio manager rejected stopScan", e));
        }

        if (scan != null) {
            context.emit(CentralOperationEvent.Kind.REQUEST_RESOLVED, OPERATION, null,
                    error.map(Throwable::getMessage).orElse("stopped"));
            deliver(scan.callback, new ScanEvent.Stopped(error));
        }
    }

    public void onDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi)
    {
        ActiveScan scan = active;
        if (scan == null) {
            return;
        }
        deliver(scan.callback, new ScanEvent.Discovered(peripheral, advertisement, rssi));
    }

    private void onDeadline(long token)
    {
        ActiveScan scan = active;
        if (scan == null || scan.token != token) {
            return;
        }
        context.emit(CentralOperationEvent.Kind.DEADLINE_ELAPSED, OPERATION, null, "");
        stop(Optional.empty());
    }

    private void deliver(Consumer<ScanEvent> callback, ScanEvent event)
    {
        context.invokeSafely(OPERATION, () -> callback.accept(event));
    }

    private static final class ActiveScan
    {
        private final long token;
        private final Consumer<ScanEvent> callback;
        private Cancellable deadline;

        private ActiveScan(long token, Consumer<ScanEvent> callback)
        {
            this.token = token;
            this.callback = callback;
        }

        private void cancelDeadline()
        {
            if (deadline != null) {
                deadline.cancel();
                deadline = null;
            }
        }
    }
}
