package com.questrail.speech.protocol.sauc.observability;

import com.questrail.speech.protocol.sauc.model.ProtocolError;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a protocol-level occurrence that does not by itself
 * change session state.
 */
public record ProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    int sequenceNumber,
    String detail,
    ProtocolError error
) {
    public enum Kind {
        FRAME_SENT,
        FRAME_RECEIVED,
        /** An inbound frame failed to decode and was dropped. */
        FRAME_SKIPPED,
        TIMEOUT_ARMED,
        TIMEOUT_FIRED,
        /** A request that had no effect, such as a repeated finalize. */
        REQUEST_IGNORED
    }

    public static ProtocolObservabilityEvent of(Instant timestamp, Kind kind, int sequenceNumber, String detail) {
        return new ProtocolObservabilityEvent(timestamp, kind, sequenceNumber, detail, null);
    }

    public static ProtocolObservabilityEvent skipped(Instant timestamp, ProtocolError error) {
        int seq = error.frame().map(f -> f.sequenceNumber()).orElse(0);
        return new ProtocolObservabilityEvent(timestamp, Kind.FRAME_SKIPPED, seq, error.detail(), error);
    }

    public Optional<ProtocolError> protocolError() {
        return Optional.ofNullable(error);
    }
}
