package com.questrail.speech.protocol.sauc.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * SaucTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for one streaming session.
 *
 * <p>This is deliberately <em>operational only</em>: it controls how long the
 * engine waits, never which transitions are legal. The state reducer remains
 * the sole authority on what a timeout means.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: transport open, including the WebSocket handshake.</li>
 *   <li><b>ackTimeout</b>: from the initial request write until the service accepts it.</li>
 *   <li><b>finalAckTimeout</b>: from the terminal frame until the last response.
 *       A grace period, not a protocol constant.</li>
 *   <li><b>sendTimeout</b>: one blocking frame write; expiry is a transport failure.</li>
 *   <li><b>receivePollInterval</b>: how long the consumer blocks per receive
 *       before re-checking for cancellation.</li>
 *   <li><b>producerPollInterval</b>: how long the producer waits for captured
 *       audio before re-checking for finalize or cancellation.</li>
 *   <li><b>captureOfferTimeout</b>: how long capture blocks on a full audio queue.</li>
 *   <li><b>maxConsecutiveCaptureTimeouts</b>: consecutive full-queue timeouts
 *       tolerated before the session fails with {@code CAPTURE_STARVATION}.</li>
 * </ul>
 */
public record SaucTimingPolicy(
        Duration connectTimeout,
        Duration ackTimeout,
        Duration finalAckTimeout,
        Duration sendTimeout,
        Duration receivePollInterval,
        Duration producerPollInterval,
        Duration captureOfferTimeout,
        int maxConsecutiveCaptureTimeouts
) {
    public SaucTimingPolicy {
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(ackTimeout, "ackTimeout");
        requirePositive(finalAckTimeout, "finalAckTimeout");
        requirePositive(sendTimeout, "sendTimeout");
        requirePositive(receivePollInterval, "receivePollInterval");
        requirePositive(producerPollInterval, "producerPollInterval");
        Objects.requireNonNull(captureOfferTimeout, "captureOfferTimeout");
        if (captureOfferTimeout.isNegative()) {
            throw new IllegalArgumentException("captureOfferTimeout must be non-negative");
        }
        if (maxConsecutiveCaptureTimeouts < 1) {
            throw new IllegalArgumentException("maxConsecutiveCaptureTimeouts must be at least 1");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>connectTimeout: 10s</li>
     *   <li>ackTimeout: 5s</li>
     *   <li>finalAckTimeout: 10s</li>
     *   <li>sendTimeout: 5s</li>
     *   <li>receivePollInterval: 200ms</li>
     *   <li>producerPollInterval: 50ms</li>
     *   <li>captureOfferTimeout: 200ms</li>
     *   <li>maxConsecutiveCaptureTimeouts: 5</li>
     * </ul>
     */
    public static SaucTimingPolicy defaults() {
        return new SaucTimingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(5),
                Duration.ofSeconds(10),
                Duration.ofSeconds(5),
                Duration.ofMillis(200),
                Duration.ofMillis(50),
                Duration.ofMillis(200),
                5
        );
    }

    public SaucTimingPolicy withAckTimeout(Duration ackTimeout) {
        return new SaucTimingPolicy(connectTimeout, ackTimeout, finalAckTimeout, sendTimeout,
                receivePollInterval, producerPollInterval, captureOfferTimeout, maxConsecutiveCaptureTimeouts);
    }

    public SaucTimingPolicy withFinalAckTimeout(Duration finalAckTimeout) {
        return new SaucTimingPolicy(connectTimeout, ackTimeout, finalAckTimeout, sendTimeout,
                receivePollInterval, producerPollInterval, captureOfferTimeout, maxConsecutiveCaptureTimeouts);
    }

    public SaucTimingPolicy withCaptureBackpressure(Duration captureOfferTimeout, int maxConsecutiveCaptureTimeouts) {
        return new SaucTimingPolicy(connectTimeout, ackTimeout, finalAckTimeout, sendTimeout,
                receivePollInterval, producerPollInterval, captureOfferTimeout, maxConsecutiveCaptureTimeouts);
    }
}
