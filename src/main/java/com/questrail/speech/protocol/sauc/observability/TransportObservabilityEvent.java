package com.questrail.speech.protocol.sauc.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle change.
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        OPENED,
        CLOSED,
        FAILED
    }
}
