package com.questrail.speech.protocol.sauc.transport;

import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.util.Objects;

/**
 * Raised by a {@link FrameTransport} when it cannot open, write or read.
 * Always terminal for the session using the transport.
 */
public class TransportException extends Exception
{
    private final ProtocolErrorReason reason;

    public TransportException(ProtocolErrorReason reason, String message) {
        this(reason, message, null);
    }

    public TransportException(ProtocolErrorReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * {@code TRANSPORT_CLOSED} or {@code CONNECT_TIMEOUT}.
     */
    public ProtocolErrorReason reason() {
        return reason;
    }
}
