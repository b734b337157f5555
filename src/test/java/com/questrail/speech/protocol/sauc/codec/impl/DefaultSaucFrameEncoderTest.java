package com.questrail.speech.protocol.sauc.codec.impl;

import com.questrail.speech.protocol.sauc.model.CompressionKind;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.model.SerializationKind;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Byte-exact tests for {@link DefaultSaucFrameEncoder}.
 */
final class DefaultSaucFrameEncoderTest {

    private final DefaultSaucFrameEncoder encoder = new DefaultSaucFrameEncoder();

    @Test
    void fullRequestHeaderCarriesSequenceFlagJsonAndGzip() {
        SaucFrame frame = SaucFrame.request(MessageType.FULL_REQUEST, SerializationKind.JSON,
                CompressionKind.GZIP, 1, new byte[] {0x7A});

        byte[] bytes = encoder.encode(frame);

        assertArrayEquals(new byte[] {
                0x11, 0x11, 0x11, 0x00,
                0x00, 0x00, 0x00, 0x01,
                0x00, 0x00, 0x00, 0x01,
                0x7A
        }, bytes);
    }

    @Test
    void terminalFrameSetsSequenceAndLastFlagsWithNegativeSequence() {
        SaucFrame frame = SaucFrame.request(MessageType.AUDIO_ONLY_REQUEST, SerializationKind.RAW,
                CompressionKind.NONE, -3, new byte[0]);

        byte[] bytes = encoder.encode(frame);

        assertArrayEquals(new byte[] {
                0x11, 0x23, 0x00, 0x00,
                (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFD,
                0x00, 0x00, 0x00, 0x00
        }, bytes);
    }

    @Test
    void frameWithoutSequenceOmitsTheField() {
        SaucFrame frame = new SaucFrame(SaucFrame.PROTOCOL_VERSION, MessageType.FULL_RESPONSE,
                SerializationKind.JSON, CompressionKind.NONE, 0, false, 0, new byte[] {'{', '}'});

        byte[] bytes = encoder.encode(frame);

        assertEquals(4 + 4 + 2, bytes.length);
        assertEquals((byte) 0x90, bytes[1]);
        assertEquals((byte) 0x10, bytes[2]);
        assertEquals(2, bytes[7]);
    }

    @Test
    void errorResponseWritesErrorCodeBeforeLength() {
        SaucFrame frame = new SaucFrame(SaucFrame.PROTOCOL_VERSION, MessageType.ERROR_RESPONSE,
                SerializationKind.RAW, CompressionKind.NONE, 0, false, 45000001, new byte[] {'x'});

        byte[] bytes = encoder.encode(frame);

        assertArrayEquals(new byte[] {
                0x11, (byte) 0xF0, 0x00, 0x00,
                0x02, (byte) 0xAE, (byte) 0xA5, 0x41,
                0x00, 0x00, 0x00, 0x01,
                'x'
        }, bytes);
    }

    @Test
    void eventCodeIsWrittenAfterSequenceWithEventFlag() {
        SaucFrame frame = new SaucFrame(SaucFrame.PROTOCOL_VERSION, MessageType.FULL_RESPONSE,
                SerializationKind.JSON, CompressionKind.NONE, 2, false, 0, OptionalInt.of(150),
                new byte[] {'{', '}'});

        byte[] bytes = encoder.encode(frame);

        assertArrayEquals(new byte[] {
                0x11, (byte) 0x95, 0x10, 0x00,
                0x00, 0x00, 0x00, 0x02,
                0x00, 0x00, 0x00, (byte) 0x96,
                0x00, 0x00, 0x00, 0x02,
                '{', '}'
        }, bytes);
    }
}
