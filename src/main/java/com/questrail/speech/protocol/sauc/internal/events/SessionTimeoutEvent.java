package com.questrail.speech.protocol.sauc.internal.events;

import com.questrail.speech.api.SessionState;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionTimeoutEvent
 * -----------------------------------------------------------------------------
 * Timeout notifications.
 *
 * <p>Each timeout kind guards exactly one state. A timeout that fires after
 * the session left that state is stale and the reducer ignores it, so a timer
 * whose cancellation lost the race is harmless.</p>
 */
public sealed interface SessionTimeoutEvent extends SessionEvent
        permits SessionTimeoutEvent.TimeoutExpired
{
    enum Kind {
        CONNECT(SessionState.CONNECTING, ProtocolErrorReason.CONNECT_TIMEOUT),
        ACK(SessionState.AWAITING_ACK, ProtocolErrorReason.ACK_TIMEOUT),
        FINAL_ACK(SessionState.FINALIZING, ProtocolErrorReason.FINAL_ACK_TIMEOUT);

        private final SessionState guardedState;
        private final ProtocolErrorReason reason;

        Kind(SessionState guardedState, ProtocolErrorReason reason) {
            this.guardedState = guardedState;
            this.reason = reason;
        }

        public SessionState guardedState() {
            return guardedState;
        }

        public ProtocolErrorReason reason() {
            return reason;
        }
    }

    Kind kind();

    final class TimeoutExpired extends SessionEvent.Base implements SessionTimeoutEvent {
        private final Kind kind;

        public TimeoutExpired(Instant timestamp, Kind kind) {
            super(timestamp);
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        @Override
        public Kind kind() {
            return kind;
        }

        @Override
        public String toString() {
            return "TimeoutExpired[" + kind + ']';
        }
    }
}
