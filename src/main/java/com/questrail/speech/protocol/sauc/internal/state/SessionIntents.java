package com.questrail.speech.protocol.sauc.internal.state;

import com.questrail.speech.api.RecognitionResult;
import com.questrail.speech.api.SessionOutcome;
import com.questrail.speech.protocol.sauc.internal.events.SessionTimeoutEvent;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable set of side effects requested by the {@link SessionStateReducer}.
 *
 * The reducer decides <b>what</b> should happen next; the streaming engine
 * decides <b>how</b>. No intent performs I/O by itself.
 *
 * <p>Intents that need data carry it: {@link Kind#EMIT_RESULT} the result,
 * {@link Kind#ARM_TIMEOUT} the timeout kind, {@link Kind#REPORT_OUTCOME} the
 * outcome.</p>
 */
public final class SessionIntents
{
    public enum Kind {
        /** Arm the timeout named by {@link #timeout()}. */
        ARM_TIMEOUT,

        /** Cancel whichever timeout is armed. */
        CANCEL_TIMEOUT,

        /** Start reading inbound frames. */
        START_CONSUMER,

        /** Release the producer to stream audio. */
        START_STREAMING,

        /** Stop admitting captured audio; already admitted audio is still sent. */
        CLOSE_INPUT,

        /** Deliver {@link #result()} to the listener. */
        EMIT_RESULT,

        /** Stop the producer and consumer tasks. */
        STOP_TASKS,

        /** Discard captured audio that was not sent. */
        DISCARD_AUDIO,

        /** Close the transport. */
        CLOSE_TRANSPORT,

        /** Deliver {@link #outcome()} to the listener. */
        REPORT_OUTCOME
    }

    private static final SessionIntents NONE = new SessionIntents(EnumSet.noneOf(Kind.class), null, null, null);

    private final Set<Kind> kinds;
    private final RecognitionResult result;
    private final SessionTimeoutEvent.Kind timeout;
    private final SessionOutcome outcome;

    private SessionIntents(Set<Kind> kinds,
                           RecognitionResult result,
                           SessionTimeoutEvent.Kind timeout,
                           SessionOutcome outcome) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        this.result = result;
        this.timeout = timeout;
        this.outcome = outcome;
    }

    public static SessionIntents none() {
        return NONE;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public Optional<RecognitionResult> result() {
        return Optional.ofNullable(result);
    }

    public Optional<SessionTimeoutEvent.Kind> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<SessionOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    @Override
    public String toString() {
        return "SessionIntents" + kinds +
                (timeout != null ? "[timeout=" + timeout + ']' : "");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private RecognitionResult result;
        private SessionTimeoutEvent.Kind timeout;
        private SessionOutcome outcome;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder armTimeout(SessionTimeoutEvent.Kind timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            kinds.add(Kind.ARM_TIMEOUT);
            return this;
        }

        public Builder emit(RecognitionResult result) {
            this.result = Objects.requireNonNull(result, "result");
            kinds.add(Kind.EMIT_RESULT);
            return this;
        }

        public Builder report(SessionOutcome outcome) {
            this.outcome = Objects.requireNonNull(outcome, "outcome");
            kinds.add(Kind.REPORT_OUTCOME);
            return this;
        }

        public SessionIntents build() {
            return new SessionIntents(kinds, result, timeout, outcome);
        }
    }
}
