package com.questrail.central.runtime;

import com.questrail.central.api.CentralController;
import com.questrail.central.api.CentralEventListener;
import com.questrail.central.api.CentralException;
import com.questrail.central.api.OperationCallback;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.api.ScanEvent;
import com.questrail.central.api.ScanFilter;
import com.questrail.central.config.CentralTimingPolicy;
import com.questrail.central.internal.dispatch.CentralEventDispatcher;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.internal.peripheral.ConnectCoordinator;
import com.questrail.central.internal.peripheral.DisconnectCoordinator;
import com.questrail.central.internal.scan.ScanCoordinator;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * {@link CentralController} that validates arguments on the calling thread and
 * runs every operation on the central event loop.
 */
final class EventLoopCentralController implements CentralController
{
    private final Executor eventLoop;
    private final ReadinessGate gate;
    private final ScanCoordinator scans;
    private final ConnectCoordinator connects;
    private final DisconnectCoordinator disconnects;
    private final CentralEventDispatcher dispatcher;
    private final CentralTimingPolicy timingPolicy;

    EventLoopCentralController(Executor eventLoop,
                               ReadinessGate gate,
                               ScanCoordinator scans,
                               ConnectCoordinator connects,
                               DisconnectCoordinator disconnects,
                               CentralEventDispatcher dispatcher,
                               CentralTimingPolicy timingPolicy)
    {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.scans = Objects.requireNonNull(scans, "scans");
        this.connects = Objects.requireNonNull(connects, "connects");
        this.disconnects = Objects.requireNonNull(disconnects, "disconnects");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
    }

    @Override
    public void observeReadiness(Consumer<ReadinessState> callback)
    {
        Objects.requireNonNull(callback, "callback");
        eventLoop.execute(() -> gate.observeState(callback));
    }

    @Override
    public void ensureReady(OperationCallback callback)
    {
        Objects.requireNonNull(callback, "callback");
        eventLoop.execute(() -> gate.ensureReady(callback));
    }

    @Override
    public void scan(Duration timeout, ScanFilter filter, Consumer<ScanEvent> callback)
    {
        requireTimeout(timeout);
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(callback, "callback");
        eventLoop.execute(() -> scans.scan(timeout, filter, callback));
    }

    @Override
    public void scan(ScanFilter filter, Consumer<ScanEvent> callback)
    {
        scan(timingPolicy.scanTimeout(), filter, callback);
    }

    @Override
    public void stopScan(Optional<CentralException> error)
    {
        Objects.requireNonNull(error, "error");
        eventLoop.execute(() -> scans.stop(error));
    }

    @Override
    public void connect(PeripheralId peripheral, Duration timeout, OperationCallback callback)
    {
        Objects.requireNonNull(peripheral, "peripheral");
        requireTimeout(timeout);
        Objects.requireNonNull(callback, "callback");
        eventLoop.execute(() -> connects.submit(peripheral, timeout, callback));
    }

    @Override
    public void connect(PeripheralId peripheral, OperationCallback callback)
    {
        connect(peripheral, timingPolicy.connectTimeout(), callback);
    }

    @Override
    public void disconnect(PeripheralId peripheral, Duration timeout, OperationCallback callback)
    {
        Objects.requireNonNull(peripheral, "peripheral");
        requireTimeout(timeout);
        Objects.requireNonNull(callback, "callback");
        eventLoop.execute(() -> disconnects.submit(peripheral, timeout, callback));
    }

    @Override
    public void disconnect(PeripheralId peripheral, OperationCallback callback)
    {
        disconnect(peripheral, timingPolicy.disconnectTimeout(), callback);
    }

    @Override
    public void addEventListener(CentralEventListener listener)
    {
        dispatcher.addListener(listener);
    }

    @Override
    public void removeEventListener(CentralEventListener listener)
    {
        dispatcher.removeListener(listener);
    }

    private static void requireTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
    }
}
