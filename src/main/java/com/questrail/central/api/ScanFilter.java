package com.questrail.central.api;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Service filter handed to the radio manager when a scan starts.
 *
 * <p>An empty set means "report every peripheral".</p>
 */
public record ScanFilter(Set<UUID> serviceUuids)
{
    private static final ScanFilter ANY = new ScanFilter(Set.of());

    public ScanFilter {
        Objects.requireNonNull(serviceUuids, "serviceUuids");
        serviceUuids = Set.copyOf(serviceUuids);
    }

    public static ScanFilter any() {
        return ANY;
    }

    public static ScanFilter forServices(UUID... serviceUuids) {
        Objects.requireNonNull(serviceUuids, "serviceUuids");
        return new ScanFilter(Set.copyOf(Arrays.asList(serviceUuids)));
    }

    public boolean matchesAny() {
        return serviceUuids.isEmpty();
    }
}
