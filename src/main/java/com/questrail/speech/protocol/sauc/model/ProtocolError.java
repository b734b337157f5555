package com.questrail.speech.protocol.sauc.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Classification of a decode or transport failure.
 *
 * @param reason       failure reason code
 * @param detail       human-readable diagnostic, never {@code null}
 * @param partialFrame the frame, when the failure happened after the header
 *                     was decoded (e.g. a payload that would not decompress);
 *                     {@code null} otherwise
 */
public record ProtocolError(ProtocolErrorReason reason, String detail, SaucFrame partialFrame)
{
    public ProtocolError {
        Objects.requireNonNull(reason, "reason");
        detail = (detail == null) ? "" : detail;
    }

    public static ProtocolError of(ProtocolErrorReason reason, String detail) {
        return new ProtocolError(reason, detail, null);
    }

    public Optional<SaucFrame> frame() {
        return Optional.ofNullable(partialFrame);
    }

    @Override
    public String toString() {
        return "ProtocolError[" + reason + ": " + detail
                + (partialFrame != null ? ", frame=" + partialFrame : "") + ']';
    }
}
