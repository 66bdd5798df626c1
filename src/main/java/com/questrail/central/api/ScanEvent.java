package com.questrail.central.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ScanEvent
 * -----------------------------------------------------------------------------
 * Events delivered to the callback of a scan.
 *
 * <p>A scan callback observes, in order: at most one {@link Started}, any
 * number of {@link Discovered}, and exactly one {@link Stopped}. A scan that
 * fails the readiness gate observes only {@link Stopped} carrying the gate
 * error.</p>
 */
public sealed interface ScanEvent
        permits ScanEvent.Started, ScanEvent.Discovered, ScanEvent.Stopped
{
    /** The radio manager has been asked to start discovery for this caller. */
    record Started() implements ScanEvent {
    }

    /**
     * One discovery result.
     *
     * @param peripheral       the advertising peripheral
     * @param advertisement    opaque advertisement payload as reported by the radio manager
     * @param rssi             received signal strength in dBm
     */
    record Discovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi) implements ScanEvent {
        public Discovered {
            Objects.requireNonNull(peripheral, "peripheral");
            Objects.requireNonNull(advertisement, "advertisement");
            // Opaque: null values pass through.
            advertisement = Collections.unmodifiableMap(new LinkedHashMap<>(advertisement));
        }
    }

    /**
     * The scan ended. An empty error means it ended normally (explicit stop,
     * deadline, or replacement by a newer scan).
     */
    record Stopped(Optional<CentralException> error) implements ScanEvent {
        public Stopped {
            Objects.requireNonNull(error, "error");
        }

        public static Stopped normally() {
            return new Stopped(Optional.empty());
        }

        public static Stopped withError(CentralException error) {
            return new Stopped(Optional.of(error));
        }
    }
}
