package com.questrail.central.observability;

import com.questrail.central.api.ReadinessState;

import java.time.Instant;

/**
 * Record representing a readiness change reported by the radio manager.
 */
public record ReadinessTransitionEvent(
    Instant timestamp,
    ReadinessState oldState,
    ReadinessState newState,
    int releasedCallbacks
) {
    public boolean isDegradation() {
        return oldState == ReadinessState.POWERED_ON && newState != ReadinessState.POWERED_ON;
    }
}
