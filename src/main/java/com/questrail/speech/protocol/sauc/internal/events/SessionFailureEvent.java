package com.questrail.speech.protocol.sauc.internal.events;

import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.time.Instant;
import java.util.Objects;

/**
 * Failures detected outside the reducer that end the session.
 */
public sealed interface SessionFailureEvent extends SessionEvent
        permits SessionFailureEvent.TransportFailed,
                SessionFailureEvent.CaptureStarved,
                SessionFailureEvent.TaskFailed
{
    ProtocolErrorReason reason();

    String detail();

    /** Open, send or receive failed, or the connection closed. */
    final class TransportFailed extends SessionEvent.Base implements SessionFailureEvent {
        private final ProtocolErrorReason reason;
        private final String detail;

        public TransportFailed(Instant timestamp, ProtocolErrorReason reason, String detail) {
            super(timestamp);
            this.reason = Objects.requireNonNull(reason, "reason");
            this.detail = (detail == null) ? "" : detail;
        }

        @Override
        public ProtocolErrorReason reason() {
            return reason;
        }

        @Override
        public String detail() {
            return detail;
        }

        @Override
        public String toString() {
            return "TransportFailed[" + reason + ": " + detail + ']';
        }
    }

    /** Capture kept timing out against a full audio queue. */
    final class CaptureStarved extends SessionEvent.Base implements SessionFailureEvent {
        private final int consecutiveTimeouts;

        public CaptureStarved(Instant timestamp, int consecutiveTimeouts) {
            super(timestamp);
            this.consecutiveTimeouts = consecutiveTimeouts;
        }

        public int consecutiveTimeouts() {
            return consecutiveTimeouts;
        }

        @Override
        public ProtocolErrorReason reason() {
            return ProtocolErrorReason.CAPTURE_STARVATION;
        }

        @Override
        public String detail() {
            return consecutiveTimeouts + " consecutive capture offers timed out";
        }
    }

    /** The producer or consumer task hit an error it cannot continue from. */
    final class TaskFailed extends SessionEvent.Base implements SessionFailureEvent {
        private final ProtocolErrorReason reason;
        private final String detail;

        public TaskFailed(Instant timestamp, ProtocolErrorReason reason, String detail) {
            super(timestamp);
            this.reason = Objects.requireNonNull(reason, "reason");
            this.detail = (detail == null) ? "" : detail;
        }

        @Override
        public ProtocolErrorReason reason() {
            return reason;
        }

        @Override
        public String detail() {
            return detail;
        }

        @Override
        public String toString() {
            return "TaskFailed[" + reason + ": " + detail + ']';
        }
    }
}
