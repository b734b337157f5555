package com.questrail.speech.protocol.sauc.model;

import java.util.Optional;

/**
 * Payload serialization declared in the high nibble of header byte 2.
 */
public enum SerializationKind
{
    RAW(0b0000),
    JSON(0b0001);

    private final int code;

    SerializationKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<SerializationKind> fromCode(int code) {
        for (SerializationKind k : values()) {
            if (k.code == code) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
