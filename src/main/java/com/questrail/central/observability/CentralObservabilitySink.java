package com.questrail.central.observability;

/**
 * Main interface for receiving central coordination observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CentralObservabilitySink {
    /**
     * Called when the radio manager reports a readiness change.
     * @param event the transition details
     */
    void onReadinessTransition(ReadinessTransitionEvent event);

    /**
     * Called for each step in a request's lifecycle.
     * @param event the operation event
     */
    void onOperationEvent(CentralOperationEvent event);

    /**
     * Called when an error or anomaly occurs, e.g. a caller callback threw.
     * @param event the error event
     */
    void onError(CentralErrorEvent event);
}
