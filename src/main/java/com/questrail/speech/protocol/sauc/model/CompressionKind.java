package com.questrail.speech.protocol.sauc.model;

import java.util.Optional;

/**
 * Payload compression declared in the low nibble of header byte 2.
 */
public enum CompressionKind
{
    NONE(0b0000),
    GZIP(0b0001);

    private final int code;

    CompressionKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<CompressionKind> fromCode(int code) {
        for (CompressionKind k : values()) {
            if (k.code == code) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
