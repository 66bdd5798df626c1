package com.questrail.central.internal.peripheral;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.internal.CentralContext;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.radio.PeripheralConnectionState;

import java.util.Optional;

/**
 * Deduplicates disconnect requests per peripheral.
 *
 * <p>Mirror of {@link ConnectCoordinator}: a peripheral already disconnected
 * or disconnecting is satisfied immediately; otherwise one
 * {@code cancelConnection} is issued and callers resolve on
 * {@code disconnected} or the deadline.</p>
 */
public final class DisconnectCoordinator extends PeripheralRequestCoordinator
{
    public static final String OPERATION = "disconnect peripheral";

    public DisconnectCoordinator(CentralContext context, ReadinessGate gate)
    {
        super(context, gate, OPERATION);
    }

    @Override
    protected boolean isAlreadySatisfied(PeripheralConnectionState state)
    {
        return state == PeripheralConnectionState.DISCONNECTED
                || state == PeripheralConnectionState.DISCONNECTING;
    }

    @Override
    protected void issueCommand(PeripheralId peripheral)
    {
        context().radio().cancelConnection(peripheral);
    }

    public boolean onDisconnected(PeripheralId peripheral, Optional<Throwable> error)
    {
        Optional<CentralException> outcome = error
                .<CentralException>map(cause -> new CentralException.ResourceError(OPERATION, cause));
        return resolve(peripheral, outcome);
    }
}
