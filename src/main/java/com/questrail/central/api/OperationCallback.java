package com.questrail.central.api;

import java.util.Optional;

/**
 * Completion callback for connect, disconnect and readiness checks.
 *
 * <p>Invoked exactly once. An empty error means success.</p>
 */
@FunctionalInterface
public interface OperationCallback
{
    void onComplete(Optional<CentralException> error);
}
