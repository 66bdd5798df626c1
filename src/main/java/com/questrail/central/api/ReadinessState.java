package com.questrail.central.api;

/**
 * ReadinessState
 * -----------------------------------------------------------------------------
 * Readiness of the underlying radio manager, as last reported by it.
 *
 * <p>{@link #UNKNOWN} and {@link #RESETTING} are <em>transitional</em>: callers
 * that need a usable radio wait until the state leaves them. Every other value
 * is terminal until the radio manager reports a new state.</p>
 *
 * <p>The raw value is the integer the radio manager uses for the state; it is
 * carried by {@link CentralException.ScanTerminatedUnexpectedly}.</p>
 */
public enum ReadinessState
{
    UNKNOWN(0),
    RESETTING(1),
    UNSUPPORTED(2),
    UNAUTHORIZED(3),
    POWERED_OFF(4),
    POWERED_ON(5);

    private final int rawValue;

    ReadinessState(int rawValue) {
        this.rawValue = rawValue;
    }

    public int rawValue() {
        return rawValue;
    }

    public boolean isTransitional() {
        return this == UNKNOWN || this == RESETTING;
    }

    public boolean isTerminal() {
        return !isTransitional();
    }

    /**
     * Resolves a raw radio manager value.
     *
     * @throws IllegalArgumentException if the value is not a known state
     */
    public static ReadinessState fromRawValue(int rawValue) {
        for (ReadinessState state : values()) {
            if (state.rawValue == rawValue) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown readiness state value: " + rawValue);
    }
}
