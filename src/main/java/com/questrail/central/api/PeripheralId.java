package com.questrail.central.api;

import java.util.Objects;
import java.util.UUID;

/**
 * PeripheralId
 * -----------------------------------------------------------------------------
 * Stable identity of one controllable peripheral.
 *
 * <p>Connect and disconnect requests are deduplicated by this value: two
 * callers asking for the same {@code PeripheralId} share one in-flight
 * request.</p>
 */
public record PeripheralId(UUID uuid)
{
    public PeripheralId {
        Objects.requireNonNull(uuid, "uuid");
    }

    public static PeripheralId of(UUID uuid) {
        return new PeripheralId(uuid);
    }

    /**
     * Parses the canonical textual UUID form.
     */
    public static PeripheralId of(String uuid) {
        Objects.requireNonNull(uuid, "uuid");
        return new PeripheralId(UUID.fromString(uuid));
    }

    @Override
    public String toString() {
        return uuid.toString();
    }
}
