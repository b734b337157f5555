package com.questrail.speech.api;

/**
 * Presentation-side sink for a session's output.
 *
 * <p>Callbacks are serialized: results arrive in the order the service sent
 * them, and {@link #onOutcome(SessionOutcome)} is the last call, made exactly
 * once. Implementations should return quickly; they run on the session's
 * consumer or timer thread.</p>
 */
public interface RecognitionListener
{
    void onResult(RecognitionResult result);

    void onOutcome(SessionOutcome outcome);

    /**
     * Optional hook for connection status display. Called after every state
     * change: after the result delivered by the same response, before the
     * outcome it caused.
     */
    default void onStateChanged(SessionState previous, SessionState current) {}
}
