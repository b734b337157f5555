package com.questrail.speech.protocol.sauc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StreamingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStreamingObservabilitySink implements StreamingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStreamingObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        if (event.isLifecycleChange()) {
            var newState = event.newState();
            if (newState.failureReason().isPresent()) {
                log.info("SAUC Session State: {} -> {} ({}: {})",
                    event.oldState().state(),
                    newState.state(),
                    newState.failureReason().get(),
                    newState.failureDetail());
            } else {
                log.info("SAUC Session State: {} -> {}", event.oldState().state(), newState.state());
            }
        } else if (log.isTraceEnabled()) {
            log.trace("SAUC Session Step: {} on {}", event.newState(), event.triggeringEvent());
        }
    }

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {
        if (event.kind() == ProtocolObservabilityEvent.Kind.FRAME_SKIPPED) {
            log.warn("SAUC Frame skipped (seq {}): {}", event.sequenceNumber(),
                event.protocolError().map(e -> e.reason() + " " + e.detail()).orElse(event.detail()));
        } else {
            log.debug("SAUC Protocol Event: {} seq={} {}", event.kind(), event.sequenceNumber(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        log.info("SAUC Transport Event: {} {}", event.kind(), event.detail());
    }

    @Override
    public void onError(ErrorEvent event) {
        log.error("SAUC Error: {}", event.message(), event.cause());
    }
}
