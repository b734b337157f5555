package com.questrail.speech.api;

import java.time.Duration;
import java.util.Optional;

/**
 * StreamingRecognizer
 * -----------------------------------------------------------------------------
 * Primary façade for one streaming recognition session.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Opening the connection and negotiating the session</li>
 *   <li>Streaming captured audio in order, with bounded buffering</li>
 *   <li>Delivering temporary and final results to a {@link RecognitionListener}</li>
 *   <li>Reporting exactly one {@link SessionOutcome}</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for capture device selection,
 * credential loading, rendering results or reconnecting after a failure.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start()      → connect, send initial request, begin streaming once accepted
 *   audioInput() → feed PCM buffers, then endOfInput()
 *   stop()       → graceful finalize (same as endOfInput, idempotent)
 *   abort()      → hard cancel: transport closed, buffered audio discarded
 * </pre>
 *
 * An instance serves a single session and cannot be restarted.
 */
public interface StreamingRecognizer extends AutoCloseable
{
    /**
     * Start the session. Returns immediately; progress is reported to the listener.
     *
     * @throws InvalidStateException if already started
     */
    void start();

    AudioInput audioInput();

    /**
     * Request a graceful finalize: remaining admitted audio is sent, followed by
     * exactly one terminal frame. Safe to call repeatedly and from any thread.
     */
    void stop();

    /**
     * Hard cancellation. Closes the transport immediately and ends the session
     * with reason {@code CANCELLED} unless it already ended.
     */
    void abort();

    SessionState state();

    /**
     * Wait for the session outcome.
     *
     * @return the outcome, or empty if the session did not end within the timeout
     */
    Optional<SessionOutcome> awaitOutcome(Duration timeout) throws InterruptedException;

    /**
     * Equivalent to {@link #abort()} if the session is still running.
     */
    @Override
    void close();
}
