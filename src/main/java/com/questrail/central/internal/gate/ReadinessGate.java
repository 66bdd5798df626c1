package com.questrail.central.internal.gate;

import com.questrail.central.api.CentralException;
import com.questrail.central.api.OperationCallback;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.internal.CentralContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * ReadinessGate
 * =============================================================================
 * Tracks the radio manager's readiness and releases one-shot callbacks once the
 * state leaves its transitional phase.
 *
 * <p>Every scan, connect and disconnect passes {@link #ensureReady} first. A
 * gate failure is delivered straight to the caller and never reaches a
 * coordinator's deadline or request map.</p>
 *
 * <p>Not thread-safe: confined to the central event loop.</p>
 */
public final class ReadinessGate
{
    private final CentralContext context;
    private final List<Consumer<ReadinessState>> pending = new ArrayList<>();

    private ReadinessState state;

    public ReadinessGate(CentralContext context, ReadinessState initialState)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.state = Objects.requireNonNull(initialState, "initialState");
    }

    public ReadinessState state()
    {
        return state;
    }

    public int pendingCount()
    {
        return pending.size();
    }

    /**
     * Invokes {@code callback} now if the state is terminal, otherwise once it
     * becomes terminal.
     */
    public void observeState(Consumer<ReadinessState> callback)
    {
        Objects.requireNonNull(callback, "callback");

        if (state.isTransitional()) {
            pending.add(callback);
            return;
        }

        ReadinessState resolved = state;
        context.invokeSafely("readiness observation", () -> callback.accept(resolved));
    }

    public void ensureReady(OperationCallback callback)
    {
        Objects.requireNonNull(callback, "callback");
        observeState(resolved -> callback.onComplete(gateError(resolved)));
    }

    /**
     * Records a new state. A terminal state releases every queued callback in
     * registration order. The state is stored first, so a callback that
     * observes again while being released is answered at once.
     *
     * @return the number of callbacks released
     */
    public int onStateChanged(ReadinessState newState)
    {
        Objects.requireNonNull(newState, "newState");
        state = newState;

        if (newState.isTransitional() || pending.isEmpty()) {
            return 0;
        }

        List<Consumer<ReadinessState>> released = List.copyOf(pending);
        pending.clear();

        for (Consumer<ReadinessState> callback : released) {
            context.invokeSafely("readiness observation", () -> callback.accept(newState));
        }
        return released.size();
    }

    /**
     * Maps a terminal state onto the error an operation fails with, if any.
     *
     * @throws IllegalStateException for a transitional state
     */
    public static Optional<CentralException> gateError(ReadinessState state)
    {
        return switch (state) {
            case POWERED_ON -> Optional.empty();
            case POWERED_OFF -> Optional.of(new CentralException.BluetoothPoweredOff());
            case UNAUTHORIZED -> Optional.of(new CentralException.BluetoothUnauthorized());
            case UNSUPPORTED -> Optional.of(new CentralException.BluetoothUnsupported());
            case UNKNOWN, RESETTING -> throw new IllegalStateException("Readiness not resolved: " + state);
        };
    }
}
