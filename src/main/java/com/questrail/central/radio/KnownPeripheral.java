package com.questrail.central.radio;

import com.questrail.central.api.PeripheralId;

import java.util.Objects;

/**
 * A peripheral the radio manager already knows about, with its current
 * connection state.
 */
public record KnownPeripheral(PeripheralId id, PeripheralConnectionState state)
{
    public KnownPeripheral {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
    }
}
