package com.questrail.speech.protocol.sauc.internal.events;

import com.questrail.speech.protocol.sauc.internal.decode.InboundMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * Events carrying a decoded service message. Frames that failed to decode
 * never become events; the consumer logs and drops them.
 */
public sealed interface SessionMessageEvent extends SessionEvent
        permits SessionMessageEvent.MessageReceived
{
    InboundMessage message();

    final class MessageReceived extends SessionEvent.Base implements SessionMessageEvent {
        private final InboundMessage message;

        public MessageReceived(Instant timestamp, InboundMessage message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message");
        }

        @Override
        public InboundMessage message() {
            return message;
        }

        @Override
        public String toString() {
            return "MessageReceived[" + message + ']';
        }
    }
}
