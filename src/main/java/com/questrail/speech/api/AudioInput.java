package com.questrail.speech.api;

/**
 * AudioInput
 * -----------------------------------------------------------------------------
 * Capture-side boundary of a session: a bounded hand-off for raw PCM buffers
 * plus the end-of-input signal.
 *
 * <p>Buffers are little-endian PCM in the session's audio format (16 kHz,
 * mono, 16-bit by default) and may be of any size. The core never selects or
 * opens a capture device.</p>
 *
 * <h2>Backpressure</h2>
 * When the hand-off is full, {@link #offer(byte[])} blocks for the configured
 * capture offer timeout and then returns {@code false}; the buffer was not
 * admitted and the caller may retry. Too many consecutive timeouts fail the
 * session with {@code CAPTURE_STARVATION}.
 */
public interface AudioInput
{
    /**
     * Hand one capture buffer to the session.
     *
     * @return true if admitted, false if the hand-off stayed full for the offer timeout
     * @throws InvalidStateException if the session was finalized or has ended
     * @throws InterruptedException  if interrupted while waiting for space
     */
    boolean offer(byte[] pcm) throws InterruptedException;

    /**
     * Signal that capture has ended. Idempotent; equivalent to a stop request.
     */
    void endOfInput();
}
