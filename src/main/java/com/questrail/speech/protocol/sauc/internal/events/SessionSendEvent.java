package com.questrail.speech.protocol.sauc.internal.events;

import java.time.Instant;

/**
 * SessionSendEvent
 * -----------------------------------------------------------------------------
 * Outbound progress reported by the producer task, the single writer.
 *
 * <p>{@link InitialRequestSent} is reported after the write completes.
 * {@link AudioDispatched} and {@link TerminalDispatched} are reported
 * <em>before</em> the write, so that the reducer can refuse a frame that is
 * not legal in the current state before any byte reaches the wire.</p>
 */
public sealed interface SessionSendEvent extends SessionEvent
        permits SessionSendEvent.InitialRequestSent,
                SessionSendEvent.AudioDispatched,
                SessionSendEvent.TerminalDispatched
{
    int sequenceNumber();

    final class InitialRequestSent extends SessionEvent.Base implements SessionSendEvent {
        private final int sequenceNumber;

        public InitialRequestSent(Instant timestamp, int sequenceNumber) {
            super(timestamp);
            this.sequenceNumber = sequenceNumber;
        }

        @Override
        public int sequenceNumber() {
            return sequenceNumber;
        }
    }

    final class AudioDispatched extends SessionEvent.Base implements SessionSendEvent {
        private final int sequenceNumber;

        public AudioDispatched(Instant timestamp, int sequenceNumber) {
            super(timestamp);
            this.sequenceNumber = sequenceNumber;
        }

        @Override
        public int sequenceNumber() {
            return sequenceNumber;
        }
    }

    final class TerminalDispatched extends SessionEvent.Base implements SessionSendEvent {
        private final int sequenceNumber;

        public TerminalDispatched(Instant timestamp, int sequenceNumber) {
            super(timestamp);
            this.sequenceNumber = sequenceNumber;
        }

        @Override
        public int sequenceNumber() {
            return sequenceNumber;
        }
    }
}
