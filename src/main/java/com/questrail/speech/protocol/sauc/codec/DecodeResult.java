package com.questrail.speech.protocol.sauc.codec;

import com.questrail.speech.protocol.sauc.model.ProtocolError;

import java.util.Objects;

/**
 * DecodeResult
 * -----------------------------------------------------------------------------
 * Outcome of a decode step that may fail for a single inbound frame.
 *
 * <p>Decoders in this protocol stack never throw for malformed input. They
 * return a {@link Failure} carrying a {@link ProtocolError}, which leaves the
 * caller free to log, skip, or abort.</p>
 *
 * @param <T> decoded value type
 */
public sealed interface DecodeResult<T> permits DecodeResult.Success, DecodeResult.Failure
{
    record Success<T>(T value) implements DecodeResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<T>(ProtocolError error) implements DecodeResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> DecodeResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> DecodeResult<T> failure(ProtocolError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns the decoded value.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T value() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw new IllegalStateException("decode failed: " + ((Failure<T>) this).error());
    }
}
