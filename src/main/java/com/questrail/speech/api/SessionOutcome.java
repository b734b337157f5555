package com.questrail.speech.api;

import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionOutcome
 * -----------------------------------------------------------------------------
 * The single terminal event of a session, emitted exactly once whether the
 * session succeeded or failed.
 *
 * <p>Results emitted before a failure remain valid and are not retracted;
 * {@link #transcript()} is the text of the last result emitted.</p>
 *
 * @param success         true if the session reached {@link SessionState#CLOSED}
 * @param reason          failure reason, {@code null} on success
 * @param detail          diagnostic text, empty on success
 * @param transcript      text of the last emitted result, empty if none
 * @param resultsEmitted  number of results delivered to the listener
 * @param timestamp       when the session ended (observational only)
 */
public record SessionOutcome(
        boolean success,
        ProtocolErrorReason reason,
        String detail,
        String transcript,
        int resultsEmitted,
        Instant timestamp
) {
    public SessionOutcome {
        if (success && reason != null) {
            throw new IllegalArgumentException("successful outcome cannot carry a reason");
        }
        if (!success) {
            Objects.requireNonNull(reason, "reason");
        }
        detail = (detail == null) ? "" : detail;
        transcript = (transcript == null) ? "" : transcript;
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static SessionOutcome success(String transcript, int resultsEmitted, Instant timestamp) {
        return new SessionOutcome(true, null, "", transcript, resultsEmitted, timestamp);
    }

    public static SessionOutcome failure(ProtocolErrorReason reason, String detail,
                                         String transcript, int resultsEmitted, Instant timestamp) {
        return new SessionOutcome(false, reason, detail, transcript, resultsEmitted, timestamp);
    }

    public Optional<ProtocolErrorReason> failureReason() {
        return Optional.ofNullable(reason);
    }
}
