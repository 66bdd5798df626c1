package com.questrail.central.runtime;

import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.radio.RadioManagerListener;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Hands radio notifications, which may arrive on any thread, to the central
 * event loop before they reach the dispatcher.
 */
final class EventLoopRadioListener implements RadioManagerListener
{
    private final Executor eventLoop;
    private final RadioManagerListener delegate;

    EventLoopRadioListener(Executor eventLoop, RadioManagerListener delegate)
    {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void onStateChanged(ReadinessState newState)
    {
        eventLoop.execute(() -> delegate.onStateChanged(newState));
    }

    @Override
    public void onConnected(PeripheralId peripheral)
    {
        eventLoop.execute(() -> delegate.onConnected(peripheral));
    }

    @Override
    public void onFailedToConnect(PeripheralId peripheral, Optional<Throwable> error)
    {
        eventLoop.execute(() -> delegate.onFailedToConnect(peripheral, error));
    }

    @Override
    public void onDisconnected(PeripheralId peripheral, Optional<Throwable> error)
    {
        eventLoop.execute(() -> delegate.onDisconnected(peripheral, error));
    }

    @Override
    public void onDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi)
    {
        eventLoop.execute(() -> delegate.onDiscovered(peripheral, advertisement, rssi));
    }

    @Override
    public void onWillRestoreState(Map<String, Object> payload)
    {
        eventLoop.execute(() -> delegate.onWillRestoreState(payload));
    }
}
