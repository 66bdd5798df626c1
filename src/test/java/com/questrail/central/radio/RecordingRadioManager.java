package com.questrail.central.radio;

import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.api.ScanFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * RecordingRadioManager
 * -----------------------------------------------------------------------------
 * Test-only {@link RadioManager} implementation.
 *
 * <p>Records every command, answers {@code retrieveKnownPeripherals} from a
 * table the test controls, and lets tests inject notifications. It contains
 * no coordination logic of its own.</p>
 */
public final class RecordingRadioManager implements RadioManager {

    public sealed interface Command permits StartScan, StopScan, Connect, CancelConnection {}

    public record StartScan(ScanFilter filter) implements Command {}

    public record StopScan() implements Command {}

    public record Connect(PeripheralId peripheral) implements Command {}

    public record CancelConnection(PeripheralId peripheral) implements Command {}

    private final List<Command> commands = new ArrayList<>();
    private final Map<PeripheralId, PeripheralConnectionState> known = new ConcurrentHashMap<>();

    private volatile RadioManagerListener listener;
    private volatile RuntimeException failure;
    private volatile RuntimeException stopScanFailure;
    private volatile RuntimeException lookupFailure;
    private volatile Consumer<Command> onCommand = command -> { };

    @Override
    public void setListener(RadioManagerListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void startScan(ScanFilter filter) {
        record(new StartScan(filter));
    }

    @Override
    public void stopScan() {
        record(new StopScan());
    }

    @Override
    public void connect(PeripheralId peripheral) {
        record(new Connect(peripheral));
    }

    @Override
    public void cancelConnection(PeripheralId peripheral) {
        record(new CancelConnection(peripheral));
    }

    @Override
    public List<KnownPeripheral> retrieveKnownPeripherals(Set<PeripheralId> identifiers) {
        RuntimeException f = lookupFailure;
        if (f != null) {
            throw f;
        }
        return identifiers.stream()
                .filter(known::containsKey)
                .map(id -> new KnownPeripheral(id, known.get(id)))
                .collect(Collectors.toList());
    }

    private void record(Command command) {
        synchronized (commands) {
            commands.add(command);
        }
        RuntimeException f = failure;
        if (f != null && !(command instanceof StopScan)) {
            throw f;
        }
        RuntimeException s = stopScanFailure;
        if (s != null && command instanceof StopScan) {
            throw s;
        }
        onCommand.accept(command);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void setKnownState(PeripheralId peripheral, PeripheralConnectionState state) {
        known.put(peripheral, state);
    }

    /**
     * Makes every command except {@code stopScan} throw {@code failure}.
     */
    public void failCommandsWith(RuntimeException failure) {
        this.failure = failure;
    }

    /**
     * Makes {@code stopScan} throw {@code failure} (after being recorded).
     */
    public void failStopScanWith(RuntimeException failure) {
        this.stopScanFailure = failure;
    }

    /**
     * Makes {@code retrieveKnownPeripherals} throw {@code failure}.
     */
    public void failKnownPeripheralLookupWith(RuntimeException failure) {
        this.lookupFailure = failure;
    }

    /**
     * Hook run after each command is recorded, e.g. to answer it.
     */
    public void onCommand(Consumer<Command> hook) {
        this.onCommand = Objects.requireNonNull(hook, "hook");
    }

    public RadioManagerListener listener() {
        RadioManagerListener l = listener;
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        return l;
    }

    public void injectStateChanged(ReadinessState state) {
        listener().onStateChanged(state);
    }

    public void injectConnected(PeripheralId peripheral) {
        listener().onConnected(peripheral);
    }

    public void injectFailedToConnect(PeripheralId peripheral, Throwable error) {
        listener().onFailedToConnect(peripheral, Optional.ofNullable(error));
    }

    public void injectDisconnected(PeripheralId peripheral, Throwable error) {
        listener().onDisconnected(peripheral, Optional.ofNullable(error));
    }

    public void injectDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi) {
        listener().onDiscovered(peripheral, advertisement, rssi);
    }

    public List<Command> commands() {
        synchronized (commands) {
            return List.copyOf(commands);
        }
    }

    public <T extends Command> List<T> commandsOfType(Class<T> type) {
        return commands().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public void clear() {
        synchronized (commands) {
            commands.clear();
        }
    }
}
