package com.questrail.central.internal.peripheral;

import com.questrail.central.api.OperationCallback;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.internal.time.Cancellable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One in-flight connect or disconnect for a peripheral, shared by every caller
 * that asked for it before it resolved.
 */
final class PeripheralRequest
{
    private final PeripheralId peripheral;
    private final long token;
    private final List<OperationCallback> waiters = new ArrayList<>();
    private Cancellable deadline;

    PeripheralRequest(PeripheralId peripheral, long token, OperationCallback first)
    {
        this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
        this.token = token;
        this.waiters.add(Objects.requireNonNull(first, "first"));
    }

    PeripheralId peripheral()
    {
        return peripheral;
    }

    /**
     * Generation token; a deadline only acts on the request carrying the token it captured.
     */
    long token()
    {
        return token;
    }

    void join(OperationCallback waiter)
    {
        waiters.add(Objects.requireNonNull(waiter, "waiter"));
    }

    /**
     * Waiters in registration order.
     */
    List<OperationCallback> waiters()
    {
        return List.copyOf(waiters);
    }

    int waiterCount()
    {
        return waiters.size();
    }

    void armDeadline(Cancellable deadline)
    {
        this.deadline = deadline;
    }

    void cancelDeadline()
    {
        if (deadline != null) {
            deadline.cancel();
            deadline = null;
        }
    }
}
