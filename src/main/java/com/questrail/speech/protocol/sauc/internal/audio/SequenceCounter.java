package com.questrail.speech.protocol.sauc.internal.audio;

/**
 * SequenceCounter
 * -----------------------------------------------------------------------------
 * Produces the request sequence numbers of one session: 1, 2, 3, … and, once,
 * the terminal negative value that closes the stream.
 *
 * <p>The terminal value is the negation of the next unused number, so a stream
 * that sent 1..n ends with {@code -(n + 1)}. After {@link #finish()} the
 * counter is spent; both methods then throw.</p>
 *
 * <p>Not thread-safe: only the producer task draws numbers.</p>
 */
public final class SequenceCounter
{
    private int next = 1;
    private boolean finished;

    /**
     * Returns the next positive sequence number.
     *
     * @throws IllegalStateException after {@link #finish()}
     */
    public int next() {
        requireOpen();
        if (next == Integer.MAX_VALUE) {
            throw new IllegalStateException("sequence space exhausted");
        }
        return next++;
    }

    /**
     * Returns the terminal negative sequence number and retires the counter.
     *
     * @throws IllegalStateException if already finished
     */
    public int finish() {
        requireOpen();
        finished = true;
        return -next;
    }

    /** Last positive number handed out, or 0 if none. */
    public int last() {
        return next - 1;
    }

    public boolean isFinished() {
        return finished;
    }

    private void requireOpen() {
        if (finished) {
            throw new IllegalStateException("sequence counter already finished");
        }
    }
}
