package com.questrail.central.internal.dispatch;

import com.questrail.central.api.CentralEvent;
import com.questrail.central.api.CentralEventListener;
import com.questrail.central.api.CentralException;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.config.PendingRequestPolicy;
import com.questrail.central.internal.CentralContext;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.internal.peripheral.ConnectCoordinator;
import com.questrail.central.internal.peripheral.DisconnectCoordinator;
import com.questrail.central.internal.scan.ScanCoordinator;
import com.questrail.central.observability.ReadinessTransitionEvent;
import com.questrail.central.radio.RadioManagerListener;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CentralEventDispatcher
 * =============================================================================
 * Consumes every radio manager notification and routes it.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>{@code connected} / {@code failedToConnect} → {@link ConnectCoordinator}</li>
 *   <li>{@code disconnected} → {@link DisconnectCoordinator}</li>
 *   <li>{@code discovered} → {@link ScanCoordinator} (active scan only)</li>
 *   <li>{@code stateChanged} → broadcast, {@link ReadinessGate}, then the
 *       readiness-loss side effects</li>
 *   <li>{@code willRestoreState} → broadcast only</li>
 * </ul>
 *
 * <p>A per-peripheral notification with no pending request is dropped; it
 * usually means the request already resolved through its deadline.</p>
 *
 * <h2>Threading</h2>
 * Must be invoked on the central event loop. The runtime wraps it so that
 * notifications arriving on radio threads are re-submitted there first.
 */
public final class CentralEventDispatcher implements RadioManagerListener
{
    private final CentralContext context;
    private final ReadinessGate gate;
    private final ScanCoordinator scans;
    private final ConnectCoordinator connects;
    private final DisconnectCoordinator disconnects;
    private final PendingRequestPolicy pendingRequestPolicy;

    private final List<CentralEventListener> listeners = new CopyOnWriteArrayList<>();

    public CentralEventDispatcher(CentralContext context,
                                  ReadinessGate gate,
                                  ScanCoordinator scans,
                                  ConnectCoordinator connects,
                                  DisconnectCoordinator disconnects,
                                  PendingRequestPolicy pendingRequestPolicy)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.scans = Objects.requireNonNull(scans, "scans");
        this.connects = Objects.requireNonNull(connects, "connects");
        this.disconnects = Objects.requireNonNull(disconnects, "disconnects");
        this.pendingRequestPolicy = Objects.requireNonNull(pendingRequestPolicy, "pendingRequestPolicy");
    }

    public void addListener(CentralEventListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(CentralEventListener listener)
    {
        listeners.remove(listener);
    }

    @Override
    public void onStateChanged(ReadinessState newState)
    {
        Objects.requireNonNull(newState, "newState");
        ReadinessState oldState = gate.state();

        publish(new CentralEvent.ReadinessChanged(context.now(), newState));

        int released = gate.onStateChanged(newState);
        context.sink().onReadinessTransition(
                new ReadinessTransitionEvent(context.now(), oldState, newState, released));

        if (newState == ReadinessState.POWERED_ON) {
            return;
        }

        scans.stop(Optional.of(new CentralException.ScanTerminatedUnexpectedly(newState.rawValue())));

        if (pendingRequestPolicy == PendingRequestPolicy.FAIL_FAST) {
            connects.failAll(() -> new CentralException.ReadinessLost(newState.rawValue()));
            disconnects.failAll(() -> new CentralException.ReadinessLost(newState.rawValue()));
        }
    }

    @Override
    public void onConnected(PeripheralId peripheral)
    {
        connects.onConnected(Objects.requireNonNull(peripheral, "peripheral"));
    }

    @Override
    public void onFailedToConnect(PeripheralId peripheral, Optional<Throwable> error)
    {
        connects.onFailedToConnect(Objects.requireNonNull(peripheral, "peripheral"),
                Objects.requireNonNull(error, "error"));
    }

    @Override
    public void onDisconnected(PeripheralId peripheral, Optional<Throwable> error)
    {
        disconnects.onDisconnected(Objects.requireNonNull(peripheral, "peripheral"),
                Objects.requireNonNull(error, "error"));
    }

    @Override
    public void onDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi)
    {
        scans.onDiscovered(peripheral, advertisement, rssi);
    }

    @Override
    public void onWillRestoreState(Map<String, Object> payload)
    {
        publish(new CentralEvent.WillRestoreState(context.now(), payload));
    }

    private void publish(CentralEvent event)
    {
        for (CentralEventListener listener : listeners) {
            context.invokeSafely("event broadcast", () -> listener.onCentralEvent(event));
        }
    }
}
