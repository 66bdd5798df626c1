package com.questrail.central.api;

/**
 * Receiver of {@link CentralEvent} broadcasts.
 *
 * <p>Invoked on the central event loop thread; implementations must not block.</p>
 */
@FunctionalInterface
public interface CentralEventListener
{
    void onCentralEvent(CentralEvent event);
}
