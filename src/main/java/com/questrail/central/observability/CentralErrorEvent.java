package com.questrail.central.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly inside the central coordination layer.
 */
public record CentralErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
