package com.questrail.central.radio;

import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ScanFilter;

import java.util.List;
import java.util.Set;

/**
 * RadioManager
 * -----------------------------------------------------------------------------
 * Port to the platform radio manager.
 *
 * <p>The radio manager is treated as a single-writer device: only the central
 * coordinators issue these commands, and only the central event dispatcher
 * consumes the notifications delivered to the {@link RadioManagerListener}.</p>
 *
 * <p>Commands are fire-and-forget. Their outcome, if any, arrives later
 * through the listener; it may also never arrive. Implementations may be
 * backed by a platform binding, a simulator or a test fake.</p>
 */
public interface RadioManager
{
    /**
     * Register the listener that receives every radio notification.
     *
     * <p>This must be called before any command is issued.</p>
     */
    void setListener(RadioManagerListener listener);

    void startScan(ScanFilter filter);

    /**
     * Halt discovery. Must be harmless when no discovery is running.
     */
    void stopScan();

    void connect(PeripheralId peripheral);

    void cancelConnection(PeripheralId peripheral);

    /**
     * Looks up peripherals the radio manager already knows, with their
     * current connection state. Unknown identifiers are omitted.
     *
     * <p>This is the only synchronous query; the coordinators use it solely
     * for the "already satisfied" check when admitting a request.</p>
     */
    List<KnownPeripheral> retrieveKnownPeripherals(Set<PeripheralId> identifiers);
}
