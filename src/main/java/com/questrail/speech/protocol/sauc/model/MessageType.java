package com.questrail.speech.protocol.sauc.model;

import java.util.Optional;

/**
 * MessageType
 * -----------------------------------------------------------------------------
 * The four SAUC message types, keyed by their 4-bit wire code (high nibble of
 * header byte 1).
 *
 * <p>Client-originated types are {@link #FULL_REQUEST} and
 * {@link #AUDIO_ONLY_REQUEST}; the service answers with {@link #FULL_RESPONSE}
 * or {@link #ERROR_RESPONSE}.</p>
 */
public enum MessageType
{
    /** Initial request carrying the JSON session configuration. */
    FULL_REQUEST(0b0001),

    /** One segment of raw audio. */
    AUDIO_ONLY_REQUEST(0b0010),

    /** Acceptance or recognition result from the service. */
    FULL_RESPONSE(0b1001),

    /** Service-side failure; carries an error code ahead of the payload. */
    ERROR_RESPONSE(0b1111);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<MessageType> fromCode(int code) {
        for (MessageType t : values()) {
            if (t.code == code) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
