package com.questrail.central.observability;

import com.questrail.central.api.PeripheralId;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a step in the lifecycle of a scan, connect or disconnect request.
 *
 * @param operation  operation name, e.g. {@code "connect peripheral"}
 * @param peripheral target of the request; empty for scans
 * @param detail     free-form detail (error description, waiter count)
 */
public record CentralOperationEvent(
    Instant timestamp,
    Kind kind,
    String operation,
    Optional<PeripheralId> peripheral,
    String detail
) {
    public enum Kind {
        /** A command was issued to the radio manager. */
        COMMAND_ISSUED,
        /** A new request entry was created. */
        REQUEST_CREATED,
        /** A caller attached to an existing request entry. */
        REQUEST_JOINED,
        /** The caller was satisfied without creating a request. */
        ALREADY_SATISFIED,
        /** A request entry resolved and its waiters were invoked. */
        REQUEST_RESOLVED,
        /** A request deadline elapsed. */
        DEADLINE_ELAPSED,
        /** A radio notification matched no pending request. */
        NOTIFICATION_DROPPED
    }
}
