package com.questrail.speech.protocol.sauc.internal.audio;

import com.questrail.speech.protocol.sauc.config.AudioFormat;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Segmentation tests. Segment size is 200 ms of 16 kHz mono 16-bit audio,
 * i.e. 3200 samples or 6400 bytes.
 */
final class AudioSegmenterTest {

    private static final int SEGMENT_BYTES = 6400;

    @Test
    void segmentSizeFollowsFormatAndDuration() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);

        assertEquals(3200, segmenter.segmentSamples());
        assertEquals(SEGMENT_BYTES, segmenter.segmentBytes());
    }

    @Test
    void sixHundredMillisecondsInOneBufferGivesThreeEqualSegments() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);

        List<AudioSegment> segments = segmenter.append(pcm(3 * SEGMENT_BYTES, 0));

        assertEquals(3, segments.size());
        for (int i = 0; i < segments.size(); i++) {
            assertEquals(i, segments.get(i).index());
            assertEquals(SEGMENT_BYTES, segments.get(i).byteLength());
            assertEquals(3200, segments.get(i).sampleCount());
        }
        assertTrue(segmenter.flush().isEmpty());
    }

    @Test
    void threeSegmentSizedBuffersTakeConsecutiveSequenceNumbers() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);
        SequenceCounter counter = new SequenceCounter();
        assertEquals(1, counter.next());

        List<Integer> sequences = new ArrayList<>();
        for (int buffer = 0; buffer < 3; buffer++) {
            byte[] pcm = pcm(SEGMENT_BYTES, buffer * 31);
            List<AudioSegment> segments = segmenter.append(pcm);

            assertEquals(1, segments.size());
            assertEquals(buffer, segments.get(0).index());
            assertArrayEquals(pcm, segments.get(0).pcm());
            sequences.add(counter.next());
        }

        assertTrue(segmenter.flush().isEmpty());
        assertEquals(List.of(2, 3, 4), sequences);
        assertEquals(-5, counter.finish());
    }

    @Test
    void smallBuffersAccumulateUntilASegmentIsFull() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);

        assertTrue(segmenter.append(pcm(4000, 0)).isEmpty());
        assertEquals(4000, segmenter.bufferedBytes());

        List<AudioSegment> segments = segmenter.append(pcm(4000, 4000));
        assertEquals(1, segments.size());
        assertEquals(1600, segmenter.bufferedBytes());
    }

    @Test
    void remainderIsFlushedAsShorterSegment() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);

        segmenter.append(pcm(SEGMENT_BYTES + 1000, 0));
        Optional<AudioSegment> rest = segmenter.flush();

        assertTrue(rest.isPresent());
        assertEquals(1, rest.get().index());
        assertEquals(1000, rest.get().byteLength());
        assertEquals(500, rest.get().sampleCount());
        assertEquals(0, segmenter.bufferedBytes());
        assertTrue(segmenter.flush().isEmpty());
    }

    @Test
    void irregularBuffersAreNeitherDroppedNorDuplicated() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);
        int[] sizes = {1, 333, 6400, 7001, 2, 12800, 999, 4096};

        ByteArrayOutputStream in = new ByteArrayOutputStream();
        List<AudioSegment> segments = new ArrayList<>();
        int offset = 0;
        for (int size : sizes) {
            byte[] chunk = pcm(size, offset);
            offset += size;
            in.writeBytes(chunk);
            segments.addAll(segmenter.append(chunk));
        }
        segmenter.flush().ifPresent(segments::add);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < segments.size(); i++) {
            assertEquals(i, segments.get(i).index());
            out.writeBytes(segments.get(i).pcm());
        }
        assertArrayEquals(in.toByteArray(), out.toByteArray());
        assertEquals((offset + SEGMENT_BYTES - 1) / SEGMENT_BYTES, segments.size());
    }

    @Test
    void emittedSegmentsAreIndependentOfLaterAppends() {
        AudioSegmenter segmenter = new AudioSegmenter(AudioFormat.pcm16kMono(), 200);

        AudioSegment first = segmenter.append(pcm(SEGMENT_BYTES, 0)).get(0);
        byte[] snapshot = first.pcm();
        segmenter.append(pcm(SEGMENT_BYTES, 77));

        assertArrayEquals(snapshot, first.pcm());
    }

    @Test
    void segmentTooShortForOneSampleIsRejected() {
        AudioFormat lowRate = new AudioFormat(8000, 16, 1);

        assertThrows(IllegalArgumentException.class, () -> new AudioSegmenter(lowRate, 0));
    }

    private static byte[] pcm(int length, int seed) {
        byte[] data = new byte[length];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) (seed + i);
        }
        return data;
    }
}
