package com.questrail.central.internal.peripheral;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.internal.CentralContext;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.radio.PeripheralConnectionState;

import java.util.Optional;

/**
 * Deduplicates connect requests per peripheral.
 *
 * <p>A peripheral the radio manager already reports as connected is satisfied
 * immediately. Otherwise one {@code connect} command is issued per pending
 * request and its callers resolve on {@code connected}, {@code failedToConnect}
 * or the deadline.</p>
 */
public final class ConnectCoordinator extends PeripheralRequestCoordinator
{
    public static final String OPERATION = "connect peripheral";

    public ConnectCoordinator(CentralContext context, ReadinessGate gate)
    {
        super(context, gate, OPERATION);
    }

    @Override
    protected boolean isAlreadySatisfied(PeripheralConnectionState state)
    {
        return state == PeripheralConnectionState.CONNECTED;
    }

    @Override
    protected void issueCommand(PeripheralId peripheral)
    {
        context().radio().connect(peripheral);
    }

    public boolean onConnected(PeripheralId peripheral)
    {
        return resolve(peripheral, Optional.empty());
    }

    /**
     * Fails the pending request with the radio's error, or with
     * {@link CentralException.ConnectFailedUnknownReason} when it gave none.
     */
    public boolean onFailedToConnect(PeripheralId peripheral, Optional<Throwable> error)
    {
        CentralException failure = error
                .<CentralException>map(cause -> new CentralException.ResourceError(OPERATION, cause))
                .orElseGet(CentralException.ConnectFailedUnknownReason::new);
        return resolve(peripheral, Optional.of(failure));
    }
}
