package com.questrail.speech.protocol.sauc.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error in the streaming core.
 */
public record ErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
