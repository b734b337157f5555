package com.questrail.speech.protocol.sauc.config;

import java.util.Objects;

/**
 * Aggregated per-session configuration: what is declared to the service in the
 * initial request, plus the local audio segmentation settings.
 */
public record SaucSessionConfig(
        AudioFormat audioFormat,
        RecognitionFeatures features,
        String userId,
        int segmentDurationMs,
        int captureQueueCapacity,
        boolean compressAudio
) {
    public SaucSessionConfig {
        Objects.requireNonNull(audioFormat, "audioFormat");
        Objects.requireNonNull(features, "features");
        Objects.requireNonNull(userId, "userId");
        if (segmentDurationMs <= 0) {
            throw new IllegalArgumentException("segmentDurationMs must be positive");
        }
        if (audioFormat.samplesFor(segmentDurationMs) == 0) {
            throw new IllegalArgumentException("segment of " + segmentDurationMs + " ms holds no samples");
        }
        if (captureQueueCapacity <= 0) {
            throw new IllegalArgumentException("captureQueueCapacity must be positive");
        }
    }

    /** Samples per outbound audio segment. */
    public int segmentSamples() {
        return audioFormat.samplesFor(segmentDurationMs);
    }

    public static SaucSessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AudioFormat audioFormat = AudioFormat.pcm16kMono();
        private RecognitionFeatures features = RecognitionFeatures.defaults();
        private String userId = "speech-stream";
        private int segmentDurationMs = 200;
        private int captureQueueCapacity = 64;
        private boolean compressAudio = true;

        public Builder withAudioFormat(AudioFormat audioFormat) {
            this.audioFormat = audioFormat;
            return this;
        }

        public Builder withFeatures(RecognitionFeatures features) {
            this.features = features;
            return this;
        }

        public Builder withUserId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withSegmentDurationMs(int segmentDurationMs) {
            this.segmentDurationMs = segmentDurationMs;
            return this;
        }

        public Builder withCaptureQueueCapacity(int captureQueueCapacity) {
            this.captureQueueCapacity = captureQueueCapacity;
            return this;
        }

        public Builder withCompressAudio(boolean compressAudio) {
            this.compressAudio = compressAudio;
            return this;
        }

        public SaucSessionConfig build() {
            return new SaucSessionConfig(audioFormat, features, userId,
                    segmentDurationMs, captureQueueCapacity, compressAudio);
        }
    }
}
