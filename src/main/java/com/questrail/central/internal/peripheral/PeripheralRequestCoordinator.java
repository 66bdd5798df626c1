package com.questrail.central.internal.peripheral;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.OperationCallback;
import com.questrail.central.api.PeripheralId;
import com.questrail.central.internal.CentralContext;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.observability.CentralOperationEvent;
import com.questrail.central.radio.KnownPeripheral;
import com.questrail.central.radio.PeripheralConnectionState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * PeripheralRequestCoordinator
 * =============================================================================
 * Per-peripheral request bookkeeping shared by the connect and disconnect
 * coordinators.
 *
 * <h2>Admission</h2>
 * <ol>
 *   <li>Readiness gate; a gate error goes straight to the caller.</li>
 *   <li>Already satisfied (per {@link #isAlreadySatisfied}) → success, no request.</li>
 *   <li>Request pending for the peripheral → the caller joins it. No new
 *       deadline, no new command.</li>
 *   <li>Otherwise a request is created, stored, its deadline armed, and the
 *       command issued.</li>
 * </ol>
 * A radio manager or scheduler call that throws during admission resolves the
 * caller with {@link CentralException.ResourceError}.
 *
 * <h2>Resolution</h2>
 * <p>Every outcome (notification, deadline, rejected command, readiness loss)
 * goes through {@link #resolve}: the entry is removed from the map first, then
 * every waiter is invoked once in registration order. A caller arriving during
 * fan-out therefore creates a fresh request instead of joining one that is
 * going away.</p>
 *
 * <p>Not thread-safe: confined to the central event loop.</p>
 */
public abstract class PeripheralRequestCoordinator
{
    private final CentralContext context;
    private final ReadinessGate gate;
    private final String operationName;

    private final Map<PeripheralId, PeripheralRequest> requests = new LinkedHashMap<>();
    private long lastToken = 0L;

    protected PeripheralRequestCoordinator(CentralContext context, ReadinessGate gate, String operationName)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.operationName = Objects.requireNonNull(operationName, "operationName");
    }

    /**
     * Whether a peripheral in {@code state} needs no command at all.
     */
    protected abstract boolean isAlreadySatisfied(PeripheralConnectionState state);

    /**
     * Issues the radio command that starts the operation.
     */
    protected abstract void issueCommand(PeripheralId peripheral);

    protected final CentralContext context()
    {
        return context;
    }

    public final String operationName()
    {
        return operationName;
    }

    public final void submit(PeripheralId peripheral, Duration timeout, OperationCallback callback)
    {
        Objects.requireNonNull(peripheral, "peripheral");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(callback, "callback");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }

        gate.ensureReady(error -> {
            if (error.isPresent()) {
                deliver(callback, error);
                return;
            }
            admit(peripheral, timeout, callback);
        });
    }

    private void admit(PeripheralId peripheral, Duration timeout, OperationCallback callback)
    {
        Optional<PeripheralConnectionState> known;
        try {
            known = knownState(peripheral);
        } catch (RuntimeException e) {
            deliver(callback, Optional.of(new CentralException.ResourceError(operationName, e)));
            return;
        }
        if (known.isPresent() && isAlreadySatisfied(known.get())) {
            context.emit(CentralOperationEvent.Kind.ALREADY_SATISFIED, operationName, peripheral, known.get().name());
            deliver(callback, Optional.empty());
            return;
        }

        PeripheralRequest existing = requests.get(peripheral);
        if (existing != null) {
            existing.join(callback);
            context.emit(CentralOperationEvent.Kind.REQUEST_JOINED, operationName, peripheral,
                    "waiters=" + existing.waiterCount());
            return;
        }

        PeripheralRequest request = new PeripheralRequest(peripheral, ++lastToken, callback);
        requests.put(peripheral, request);
        context.emit(CentralOperationEvent.Kind.REQUEST_CREATED, operationName, peripheral, "timeout=" + timeout);

        long token = request.token();
        try {
            request.armDeadline(context.armDeadline(timeout, () -> onDeadline(peripheral, token)));
            issueCommand(peripheral);
            context.emit(CentralOperationEvent.Kind.COMMAND_ISSUED, operationName, peripheral, "");
        } catch (RuntimeException e) {
            resolve(peripheral, Optional.of(new CentralException.ResourceError(operationName, e)));
        }
    }

    private Optional<PeripheralConnectionState> knownState(PeripheralId peripheral)
    {
        List<KnownPeripheral> known = context.radio().retrieveKnownPeripherals(Set.of(peripheral));
        if (known == null) {
            return Optional.empty();
        }
        return known.stream()
                .filter(k -> k.id().equals(peripheral))
                .map(KnownPeripheral::state)
                .findFirst();
    }

    private void onDeadline(PeripheralId peripheral, long token)
    {
        PeripheralRequest request = requests.get(peripheral);
        if (request == null || request.token() != token) {
            return;
        }
        context.emit(CentralOperationEvent.Kind.DEADLINE_ELAPSED, operationName, peripheral, "");
        resolve(peripheral, Optional.of(new CentralException.OperationTimeout(operationName)));
    }

    /**
     * Removes the pending request for {@code peripheral} and invokes all its
     * waiters with {@code outcome}. A notification for a peripheral nobody is
     * waiting on is dropped.
     *
     * @return {@code true} if a request was resolved
     */
    protected final boolean resolve(PeripheralId peripheral, Optional<CentralException> outcome)
    {
        PeripheralRequest request = requests.remove(peripheral);
        if (request == null) {
            context.emit(CentralOperationEvent.Kind.NOTIFICATION_DROPPED, operationName, peripheral, "");
            return false;
        }
        request.cancelDeadline();

        List<OperationCallback> waiters = request.waiters();
        context.emit(CentralOperationEvent.Kind.REQUEST_RESOLVED, operationName, peripheral,
                outcome.map(Throwable::getMessage).orElse("success") + ", waiters=" + waiters.size());

        for (OperationCallback waiter : waiters) {
            deliver(waiter, outcome);
        }
        return true;
    }

    /**
     * Resolves every pending request, each with a fresh error from {@code failure}.
     *
     * @return the number of requests resolved
     */
    public final int failAll(Supplier<? extends CentralException> failure)
    {
        Objects.requireNonNull(failure, "failure");
        List<PeripheralId> pending = new ArrayList<>(requests.keySet());
        int resolved = 0;
        for (PeripheralId peripheral : pending) {
            CentralException error = failure.get();
            if (resolve(peripheral, Optional.of(error))) {
                resolved++;
            }
        }
        return resolved;
    }

    public final boolean isPending(PeripheralId peripheral)
    {
        return requests.containsKey(peripheral);
    }

    public final int pendingCount()
    {
        return requests.size();
    }

    public final int waiterCount(PeripheralId peripheral)
    {
        PeripheralRequest request = requests.get(peripheral);
        return request == null ? 0 : request.waiterCount();
    }

    private void deliver(OperationCallback callback, Optional<CentralException> outcome)
    {
        context.invokeSafely(operationName, () -> callback.onComplete(outcome));
    }
}
