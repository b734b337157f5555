package com.questrail.speech.protocol.sauc.observability;

/**
 * Main interface for receiving streaming-session observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface StreamingObservabilitySink {
    /**
     * Called after every reducer step that changed the session snapshot.
     * @param event the transition details
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called for protocol-level events (frames sent or skipped, timeouts).
     * @param event the protocol event
     */
    void onProtocolEvent(ProtocolObservabilityEvent event);

    /**
     * Called for transport lifecycle events (opened, closed, failed).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an unexpected error occurs inside the streaming core.
     * @param event the error event
     */
    void onError(ErrorEvent event);
}
