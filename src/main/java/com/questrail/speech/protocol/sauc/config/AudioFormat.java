package com.questrail.speech.protocol.sauc.config;

/**
 * Raw PCM format of the audio stream.
 *
 * <p>Samples are signed little-endian integers, interleaved when
 * {@code channels > 1}. The wire declares the format as {@code "pcm"} with
 * codec {@code "raw"}: no WAV container is ever sent.</p>
 */
public record AudioFormat(int sampleRate, int bitsPerSample, int channels)
{
    public static final String WIRE_FORMAT = "pcm";
    public static final String WIRE_CODEC = "raw";

    public AudioFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        if (bitsPerSample != 8 && bitsPerSample != 16 && bitsPerSample != 24 && bitsPerSample != 32) {
            throw new IllegalArgumentException("bitsPerSample must be 8, 16, 24 or 32: " + bitsPerSample);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive");
        }
    }

    /** 16 kHz, 16-bit, mono. */
    public static AudioFormat pcm16kMono() {
        return new AudioFormat(16_000, 16, 1);
    }

    /** Bytes occupied by one sample across all channels. */
    public int bytesPerFrame() {
        return channels * (bitsPerSample / 8);
    }

    /** Number of sample frames in the given duration. */
    public int samplesFor(int durationMs) {
        return (int) ((long) durationMs * sampleRate / 1000);
    }
}
