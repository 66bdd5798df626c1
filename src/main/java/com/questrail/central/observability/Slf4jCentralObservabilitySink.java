package com.questrail.central.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CentralObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCentralObservabilitySink implements CentralObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCentralObservabilitySink.class);

    @Override
    public void onReadinessTransition(ReadinessTransitionEvent event) {
        if (event.isDegradation()) {
            log.warn("Central readiness: {} -> {}", event.oldState(), event.newState());
        } else {
            log.info("Central readiness: {} -> {} ({} waiting callbacks released)",
                event.oldState(),
                event.newState(),
                event.releasedCallbacks());
        }
    }

    @Override
    public void onOperationEvent(CentralOperationEvent event) {
        switch (event.kind()) {
            case DEADLINE_ELAPSED -> log.info("Central {}{}: deadline elapsed",
                event.operation(),
                event.peripheral().map(p -> " " + p).orElse(""));
            case NOTIFICATION_DROPPED -> log.debug("Central {}: dropped unmatched notification for {}",
                event.operation(),
                event.peripheral().map(Object::toString).orElse("-"));
            default -> log.debug("Central {} {}{} {}",
                event.operation(),
                event.kind(),
                event.peripheral().map(p -> " " + p).orElse(""),
                event.detail());
        }
    }

    @Override
    public void onError(CentralErrorEvent event) {
        log.error("Central error: {}", event.message(), event.cause());
    }
}
