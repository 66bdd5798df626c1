package com.questrail.central.radio;

import com.questrail.central.api.PeripheralId;
import com.questrail.central.api.ReadinessState;

import java.util.Map;
import java.util.Optional;

/**
 * RadioManagerListener
 * -----------------------------------------------------------------------------
 * Callback sink for notifications of a {@link RadioManager}.
 *
 * <p>Notifications may arrive on any thread and on any schedule. A
 * notification for which nobody is waiting (because the request already
 * resolved through its deadline, or was never made) is legal and is
 * dropped.</p>
 */
public interface RadioManagerListener
{
    void onStateChanged(ReadinessState newState);

    void onConnected(PeripheralId peripheral);

    /**
     * @param error the failure reported by the radio manager, if it gave one
     */
    void onFailedToConnect(PeripheralId peripheral, Optional<Throwable> error);

    /**
     * @param error the failure reported by the radio manager, if it gave one
     */
    void onDisconnected(PeripheralId peripheral, Optional<Throwable> error);

    void onDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi);

    /**
     * Restore-state payload. Passed through to broadcast listeners only.
     */
    void onWillRestoreState(Map<String, Object> payload);
}
