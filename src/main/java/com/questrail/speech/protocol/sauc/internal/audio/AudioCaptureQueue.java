package com.questrail.speech.protocol.sauc.internal.audio;

import com.questrail.speech.api.AudioInput;
import com.questrail.speech.api.InvalidStateException;
import com.questrail.speech.api.SessionState;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * AudioCaptureQueue
 * -----------------------------------------------------------------------------
 * Bounded hand-off between the capture collaborator and the producer task.
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li>{@link #offer(byte[])} blocks up to the offer timeout while the queue is full</li>
 *   <li>each timeout is counted; a successful offer resets the count</li>
 *   <li>reaching the configured limit fires the starvation callback once</li>
 *   <li>after {@link #closeInput()} no buffer is admitted; buffers already
 *       admitted stay queued until drained</li>
 * </ul>
 *
 * <p>An offer that raced with {@link #closeInput()} is either rejected or
 * visible to {@link #isDrained()}; an admitted buffer is never lost. An offer
 * still blocked when {@link #discard()} runs is withdrawn and rejected.</p>
 */
public final class AudioCaptureQueue implements AudioInput
{
    private final BlockingQueue<byte[]> queue;
    private final Duration offerTimeout;
    private final int maxConsecutiveTimeouts;
    private final Supplier<SessionState> stateSupplier;
    private final Runnable onEndOfInput;
    private final Runnable onStarvation;

    private final AtomicInteger consecutiveTimeouts = new AtomicInteger();
    private final AtomicInteger offersInFlight = new AtomicInteger();
    private final AtomicBoolean starvationReported = new AtomicBoolean(false);
    private volatile boolean inputClosed;
    private volatile boolean discarded;

    public AudioCaptureQueue(int capacity,
                             Duration offerTimeout,
                             int maxConsecutiveTimeouts,
                             Supplier<SessionState> stateSupplier,
                             Runnable onEndOfInput,
                             Runnable onStarvation)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (maxConsecutiveTimeouts < 1) {
            throw new IllegalArgumentException("maxConsecutiveTimeouts must be at least 1");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.offerTimeout = Objects.requireNonNull(offerTimeout, "offerTimeout");
        this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
        this.stateSupplier = Objects.requireNonNull(stateSupplier, "stateSupplier");
        this.onEndOfInput = Objects.requireNonNull(onEndOfInput, "onEndOfInput");
        this.onStarvation = Objects.requireNonNull(onStarvation, "onStarvation");
    }

    @Override
    public boolean offer(byte[] pcm) throws InterruptedException {
        Objects.requireNonNull(pcm, "pcm");

        offersInFlight.incrementAndGet();
        try {
            if (inputClosed) {
                throw new InvalidStateException(stateSupplier.get(), "audio offered after end of input");
            }
            if (pcm.length == 0) {
                return true;
            }

            byte[] copy = pcm.clone();
            if (queue.offer(copy, offerTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                if (discarded) {
                    // discard() freed the slot this offer was waiting for
                    queue.remove(copy);
                    throw new InvalidStateException(stateSupplier.get(), "audio offered after the session ended");
                }
                consecutiveTimeouts.set(0);
                return true;
            }
        }
        finally {
            offersInFlight.decrementAndGet();
        }

        if (consecutiveTimeouts.incrementAndGet() >= maxConsecutiveTimeouts
                && starvationReported.compareAndSet(false, true)) {
            onStarvation.run();
        }
        return false;
    }

    @Override
    public void endOfInput() {
        onEndOfInput.run();
    }

    /**
     * Stop admitting audio. Idempotent.
     */
    public void closeInput() {
        inputClosed = true;
    }

    public boolean isInputClosed() {
        return inputClosed;
    }

    /**
     * Wait up to {@code timeout} for the next admitted buffer.
     */
    public Optional<byte[]> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * True once input is closed and every admitted buffer has been polled.
     */
    public boolean isDrained() {
        return inputClosed && offersInFlight.get() == 0 && queue.isEmpty();
    }

    /**
     * Close input and discard everything still queued (hard cancellation).
     */
    public void discard() {
        discarded = true;
        inputClosed = true;
        queue.clear();
    }

    public int size() {
        return queue.size();
    }

    public int consecutiveTimeouts() {
        return consecutiveTimeouts.get();
    }
}
