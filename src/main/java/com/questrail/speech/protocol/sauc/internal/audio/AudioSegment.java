package com.questrail.speech.protocol.sauc.internal.audio;

import java.util.Arrays;

/**
 * One fixed-duration slice of raw PCM audio, the payload of a single
 * audio-only request.
 *
 * <p>{@code index} counts segments from 0 in capture order. Only the final
 * segment of a stream may be shorter than the configured duration.</p>
 */
public final class AudioSegment
{
    private final int index;
    private final byte[] pcm;
    private final int sampleCount;

    public AudioSegment(int index, byte[] pcm, int sampleCount) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        this.index = index;
        this.pcm = (pcm == null) ? new byte[0] : pcm.clone();
        this.sampleCount = sampleCount;
    }

    public int index() {
        return index;
    }

    public byte[] pcm() {
        return pcm.clone();
    }

    public int byteLength() {
        return pcm.length;
    }

    public int sampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioSegment other)) {
            return false;
        }
        return index == other.index && sampleCount == other.sampleCount && Arrays.equals(pcm, other.pcm);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + sampleCount) + Arrays.hashCode(pcm);
    }

    @Override
    public String toString() {
        return "AudioSegment[index=" + index + ", samples=" + sampleCount + ", bytes=" + pcm.length + ']';
    }
}
