package com.questrail.speech.protocol.sauc.internal.audio;

import com.questrail.speech.protocol.sauc.config.AudioFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AudioSegmenter
 * -----------------------------------------------------------------------------
 * Accumulates capture buffers of arbitrary size into segments of exactly
 * {@code segmentDurationMs × sampleRate / 1000} samples.
 *
 * <p>A segment is emitted as soon as enough bytes have accumulated; the
 * remainder carries over into the next one. Audio is never dropped, resampled
 * or reordered. At end of input, {@link #flush()} releases whatever is still
 * buffered as a final, shorter segment.</p>
 *
 * <p>Not thread-safe: owned by the producer task of a single session.</p>
 */
public final class AudioSegmenter
{
    private final AudioFormat format;
    private final int segmentSamples;
    private final byte[] pending;

    private int filled;
    private int nextIndex;

    public AudioSegmenter(AudioFormat format, int segmentDurationMs) {
        this.format = Objects.requireNonNull(format, "format");
        this.segmentSamples = format.samplesFor(segmentDurationMs);
        if (segmentSamples <= 0) {
            throw new IllegalArgumentException("segment of " + segmentDurationMs + " ms holds no samples");
        }
        this.pending = new byte[segmentSamples * format.bytesPerFrame()];
    }

    public int segmentSamples() {
        return segmentSamples;
    }

    public int segmentBytes() {
        return pending.length;
    }

    /** Bytes currently buffered towards the next segment. */
    public int bufferedBytes() {
        return filled;
    }

    /**
     * Append one capture buffer and return every segment it completes, in
     * capture order (possibly none).
     */
    public List<AudioSegment> append(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm");

        List<AudioSegment> completed = new ArrayList<>(1 + pcm.length / pending.length);
        int offset = 0;
        while (offset < pcm.length) {
            int n = Math.min(pending.length - filled, pcm.length - offset);
            System.arraycopy(pcm, offset, pending, filled, n);
            filled += n;
            offset += n;

            if (filled == pending.length) {
                completed.add(new AudioSegment(nextIndex++, pending, segmentSamples));
                filled = 0;
            }
        }
        return completed;
    }

    /**
     * Emit the buffered remainder, if any, as a final shorter segment.
     */
    public Optional<AudioSegment> flush() {
        if (filled == 0) {
            return Optional.empty();
        }
        byte[] rest = new byte[filled];
        System.arraycopy(pending, 0, rest, 0, filled);
        AudioSegment segment = new AudioSegment(nextIndex++, rest, filled / format.bytesPerFrame());
        filled = 0;
        return Optional.of(segment);
    }
}
