package com.questrail.central.api;

import java.util.Objects;

/**
 * CentralException
 * -----------------------------------------------------------------------------
 * Failure delivered to a caller of {@link CentralController}.
 *
 * <p>Failures are never thrown across the asynchronous boundary; they are
 * handed to the caller's callback (or used to complete its future
 * exceptionally). Each kind carries a stable numeric {@link #code()} so that
 * callers can classify a failure without inspecting its message.</p>
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>Gate failures ({@link BluetoothUnsupported}, {@link BluetoothUnauthorized},
 *       {@link BluetoothPoweredOff}): the operation never started.</li>
 *   <li>{@link OperationTimeout}: the deadline elapsed with no response.</li>
 *   <li>{@link ResourceError}: the radio manager reported a failure.</li>
 *   <li>{@link ConnectFailedUnknownReason}: a connect failed without detail.</li>
 *   <li>{@link ScanTerminatedUnexpectedly}: readiness degraded mid-scan.</li>
 *   <li>{@link ReadinessLost}: readiness degraded while a connect or
 *       disconnect was pending (only under the fail-fast policy).</li>
 * </ul>
 */
public abstract sealed class CentralException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final int code;

    private CentralException(int code, String message) {
        super(message);
        this.code = code;
    }

    private CentralException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** The radio manager reports that the host has no usable radio. */
    public static final class BluetoothUnsupported extends CentralException {
        private static final long serialVersionUID = 1L;

        public BluetoothUnsupported() {
            super(105, "Bluetooth unsupported");
        }
    }

    /** The application is not authorized to use the radio. */
    public static final class BluetoothUnauthorized extends CentralException {
        private static final long serialVersionUID = 1L;

        public BluetoothUnauthorized() {
            super(106, "Bluetooth unauthorized");
        }
    }

    /** The radio is switched off. */
    public static final class BluetoothPoweredOff extends CentralException {
        private static final long serialVersionUID = 1L;

        public BluetoothPoweredOff() {
            super(107, "Bluetooth powered off");
        }
    }

    /** The deadline of an operation elapsed before the radio manager answered. */
    public static final class OperationTimeout extends CentralException {
        private static final long serialVersionUID = 1L;

        private final String operationName;

        public OperationTimeout(String operationName) {
            super(100, "Timed out during \"" + Objects.requireNonNull(operationName, "operationName") + "\" operation");
            this.operationName = operationName;
        }

        public String operationName() {
            return operationName;
        }
    }

    /** The radio manager reported a failure; the underlying error is the cause. */
    public static final class ResourceError extends CentralException {
        private static final long serialVersionUID = 1L;

        private final String operationName;

        public ResourceError(String operationName, Throwable cause) {
            super(101, "Radio manager error during " + Objects.requireNonNull(operationName, "operationName"),
                    Objects.requireNonNull(cause, "cause"));
            this.operationName = operationName;
        }

        public String operationName() {
            return operationName;
        }
    }

    /** The radio manager reported a failed connect without giving a reason. */
    public static final class ConnectFailedUnknownReason extends CentralException {
        private static final long serialVersionUID = 1L;

        public ConnectFailedUnknownReason() {
            super(109, "Failed to connect peripheral: unknown reason");
        }
    }

    /** The active scan was stopped because readiness left {@link ReadinessState#POWERED_ON}. */
    public static final class ScanTerminatedUnexpectedly extends CentralException {
        private static final long serialVersionUID = 1L;

        private final int invalidState;

        public ScanTerminatedUnexpectedly(int invalidState) {
            super(110, "Scan terminated unexpectedly, radio state " + invalidState);
            this.invalidState = invalidState;
        }

        /**
         * Raw value of the state that ended the scan, see {@link ReadinessState#rawValue()}.
         */
        public int invalidState() {
            return invalidState;
        }
    }

    /** A pending connect or disconnect was abandoned because readiness degraded. */
    public static final class ReadinessLost extends CentralException {
        private static final long serialVersionUID = 1L;

        private final int invalidState;

        public ReadinessLost(int invalidState) {
            super(112, "Radio readiness lost, radio state " + invalidState);
            this.invalidState = invalidState;
        }

        public int invalidState() {
            return invalidState;
        }
    }
}
