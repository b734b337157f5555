package com.questrail.speech.protocol.sauc.internal.events;

import java.time.Instant;

/**
 * Requests made by the session's caller.
 */
public sealed interface SessionCommandEvent extends SessionEvent
        permits SessionCommandEvent.ConnectRequested,
                SessionCommandEvent.FinalizeRequested,
                SessionCommandEvent.CancelRequested
{
    final class ConnectRequested extends SessionEvent.Base implements SessionCommandEvent {
        public ConnectRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Graceful finalize: from an explicit stop or the end-of-input signal. */
    final class FinalizeRequested extends SessionEvent.Base implements SessionCommandEvent {
        public FinalizeRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Hard cancellation. */
    final class CancelRequested extends SessionEvent.Base implements SessionCommandEvent {
        public CancelRequested(Instant timestamp) {
            super(timestamp);
        }
    }
}
