package com.questrail.central.api;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * CentralController
 * -----------------------------------------------------------------------------
 * Primary façade for issuing scan, connect and disconnect requests against the
 * single shared radio manager.
 *
 * <h2>Request coordination</h2>
 * <ul>
 *   <li>Every operation first passes the readiness gate. If the radio is not
 *       usable the callback receives the corresponding gate error and no
 *       command reaches the radio manager.</li>
 *   <li>At most one scan is active. Starting a scan while another is active
 *       stops the previous one first; its caller receives
 *       {@link ScanEvent.Stopped} before the new caller receives
 *       {@link ScanEvent.Started}.</li>
 *   <li>Concurrent connect (or disconnect) requests for the same
 *       {@link PeripheralId} share one in-flight request: one command is
 *       issued and every caller receives the same outcome, in registration
 *       order, exactly once.</li>
 *   <li>Every request carries a deadline. A connect or disconnect that
 *       outlives it fails with {@link CentralException.OperationTimeout}; a scan
 *       that outlives it simply stops.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All methods are non-blocking and may be called from any thread. Callbacks
 * are invoked on the central event loop thread and must not block.
 */
public interface CentralController
{
    /**
     * Delivers the readiness state once it is no longer transitional.
     */
    void observeReadiness(Consumer<ReadinessState> callback);

    /**
     * Delivers an empty error once the radio is powered on, or the gate error
     * describing why it cannot be used.
     */
    void ensureReady(OperationCallback callback);

    void scan(Duration timeout, ScanFilter filter, Consumer<ScanEvent> callback);

    /**
     * Scans with the configured default timeout.
     */
    void scan(ScanFilter filter, Consumer<ScanEvent> callback);

    /**
     * Stops the active scan, if any. Its caller receives {@link ScanEvent.Stopped}
     * carrying {@code error}. The radio manager is told to stop discovery in
     * every case.
     */
    void stopScan(Optional<CentralException> error);

    default void stopScan() {
        stopScan(Optional.empty());
    }

    void connect(PeripheralId peripheral, Duration timeout, OperationCallback callback);

    void connect(PeripheralId peripheral, OperationCallback callback);

    void disconnect(PeripheralId peripheral, Duration timeout, OperationCallback callback);

    void disconnect(PeripheralId peripheral, OperationCallback callback);

    void addEventListener(CentralEventListener listener);

    void removeEventListener(CentralEventListener listener);

    // ---------------------------------------------------------------------
    // Future-returning conveniences
    // ---------------------------------------------------------------------

    default CompletableFuture<Void> ensureReadyAsync() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        ensureReady(error -> complete(future, error));
        return future;
    }

    default CompletableFuture<Void> connectAsync(PeripheralId peripheral, Duration timeout) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        connect(peripheral, timeout, error -> complete(future, error));
        return future;
    }

    default CompletableFuture<Void> disconnectAsync(PeripheralId peripheral, Duration timeout) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        disconnect(peripheral, timeout, error -> complete(future, error));
        return future;
    }

    private static void complete(CompletableFuture<Void> future, Optional<CentralException> error) {
        if (error.isPresent()) {
            future.completeExceptionally(error.get());
        } else {
            future.complete(null);
        }
    }
}
