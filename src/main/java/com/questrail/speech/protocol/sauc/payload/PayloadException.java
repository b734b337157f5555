package com.questrail.speech.protocol.sauc.payload;

import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.util.Objects;

/**
 * Raised by {@link PayloadTransform} when a payload cannot be compressed,
 * decompressed, serialized or parsed.
 *
 * <p>Checked on purpose: callers on the inbound path convert it to a
 * {@code ProtocolError} value and skip the frame.</p>
 */
public final class PayloadException extends Exception
{
    private final ProtocolErrorReason reason;

    public PayloadException(ProtocolErrorReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ProtocolErrorReason reason() {
        return reason;
    }
}
