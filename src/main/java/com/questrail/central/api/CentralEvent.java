package com.questrail.central.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CentralEvent
 * -----------------------------------------------------------------------------
 * Broadcast events published to every registered {@link CentralEventListener}.
 *
 * <p>These are not tied to any request: they report changes of the radio
 * manager itself.</p>
 */
public sealed interface CentralEvent
        permits CentralEvent.ReadinessChanged, CentralEvent.WillRestoreState
{
    Instant timestamp();

    /** The radio manager reported a new readiness state. */
    record ReadinessChanged(Instant timestamp, ReadinessState state) implements CentralEvent {
        public ReadinessChanged {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(state, "state");
        }
    }

    /** The radio manager is about to restore previously saved state; payload is passed through untouched. */
    record WillRestoreState(Instant timestamp, Map<String, Object> payload) implements CentralEvent {
        public WillRestoreState {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(payload, "payload");
            // Opaque: null values pass through.
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
    }
}
