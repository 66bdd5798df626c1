package com.questrail.central.config;

import java.time.Duration;
import java.util.Objects;

/**
 * CentralTimingPolicy
 * -----------------------------------------------------------------------------
 * Default deadlines applied when a caller does not pass an explicit timeout.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>scanTimeout</b>: how long a scan runs before it is stopped. Expiry
 *       ends the scan normally; it is not a failure.</li>
 *   <li><b>connectTimeout</b>: how long a connect may stay pending before its
 *       callers receive an {@code OperationTimeout}.</li>
 *   <li><b>disconnectTimeout</b>: same for disconnect.</li>
 * </ul>
 */
public record CentralTimingPolicy(
        Duration scanTimeout,
        Duration connectTimeout,
        Duration disconnectTimeout
) {
    public CentralTimingPolicy {
        Objects.requireNonNull(scanTimeout, "scanTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(disconnectTimeout, "disconnectTimeout");

        if (scanTimeout.isNegative()) {
            throw new IllegalArgumentException("scanTimeout must be non-negative");
        }
        if (connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be non-negative");
        }
        if (disconnectTimeout.isNegative()) {
            throw new IllegalArgumentException("disconnectTimeout must be non-negative");
        }
    }

    /**
     * Ten seconds for every operation.
     */
    public static CentralTimingPolicy defaults() {
        return uniform(Duration.ofSeconds(10));
    }

    public static CentralTimingPolicy uniform(Duration timeout) {
        return new CentralTimingPolicy(timeout, timeout, timeout);
    }
}
