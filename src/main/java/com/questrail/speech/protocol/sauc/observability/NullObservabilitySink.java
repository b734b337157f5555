package com.questrail.speech.protocol.sauc.observability;

/**
 * No-op implementation of StreamingObservabilitySink.
 */
public final class NullObservabilitySink implements StreamingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(ErrorEvent event) {}
}
