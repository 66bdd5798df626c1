package com.questrail.central.observability;

/**
 * No-op implementation of CentralObservabilitySink.
 */
public final class NullObservabilitySink implements CentralObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onReadinessTransition(ReadinessTransitionEvent event) {}

    @Override
    public void onOperationEvent(CentralOperationEvent event) {}

    @Override
    public void onError(CentralErrorEvent event) {}
}
