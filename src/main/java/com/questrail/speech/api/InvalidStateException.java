package com.questrail.speech.api;

/**
 * Thrown when an operation is not legal in the session's current state, for
 * example sending audio outside {@link SessionState#STREAMING} or offering
 * audio after finalize.
 *
 * <p>This signals a programming error in the caller. It is never retried and
 * does not by itself end the session.</p>
 */
public class InvalidStateException extends RuntimeException
{
    private final SessionState state;

    public InvalidStateException(SessionState state, String message) {
        super(message + " (state " + state + ")");
        this.state = state;
    }

    public SessionState state() {
        return state;
    }
}
