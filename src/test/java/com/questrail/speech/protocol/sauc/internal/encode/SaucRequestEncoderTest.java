package com.questrail.speech.protocol.sauc.internal.encode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.speech.protocol.sauc.config.RecognitionFeatures;
import com.questrail.speech.protocol.sauc.config.SaucSessionConfig;
import com.questrail.speech.protocol.sauc.model.CompressionKind;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.model.SerializationKind;
import com.questrail.speech.protocol.sauc.payload.PayloadException;
import com.questrail.speech.protocol.sauc.payload.PayloadTransform;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SaucRequestEncoderTest {

    private final PayloadTransform payloads = new PayloadTransform();

    @Test
    void initialRequestDeclaresAudioFormatAndFeatures() throws PayloadException {
        SaucSessionConfig config = SaucSessionConfig.builder()
                .withUserId("tester")
                .withFeatures(RecognitionFeatures.builder()
                        .withPunctuation(false)
                        .withEndWindowSizeMs(800)
                        .withExtraParam("vad_segment_duration", 3000)
                        .build())
                .build();
        SaucRequestEncoder encoder = new SaucRequestEncoder(config, payloads);

        SaucFrame frame = encoder.fullRequest(1);

        assertEquals(MessageType.FULL_REQUEST, frame.messageType());
        assertEquals(SerializationKind.JSON, frame.serialization());
        assertEquals(CompressionKind.GZIP, frame.compression());
        assertEquals(1, frame.sequenceNumber());
        assertFalse(frame.lastPacket());

        JsonNode body = payloads.deserialize(payloads.decompress(frame.payload()), SerializationKind.JSON);
        assertEquals("tester", body.at("/user/uid").asText());
        assertEquals("pcm", body.at("/audio/format").asText());
        assertEquals("raw", body.at("/audio/codec").asText());
        assertEquals(16000, body.at("/audio/rate").asInt());
        assertEquals(16, body.at("/audio/bits").asInt());
        assertEquals(1, body.at("/audio/channel").asInt());
        assertTrue(body.at("/request/enable_itn").asBoolean());
        assertFalse(body.at("/request/enable_punc").asBoolean());
        assertEquals(800, body.at("/request/end_window_size").asInt());
        assertEquals(3000, body.at("/request/vad_segment_duration").asInt());
    }

    @Test
    void endWindowIsOmittedWhenUnset() {
        ObjectNode body = new SaucRequestEncoder(SaucSessionConfig.defaults(), payloads).requestBody();

        assertFalse(body.path("request").has("end_window_size"));
    }

    @Test
    void audioFrameIsGzippedRawByDefault() throws PayloadException {
        SaucRequestEncoder encoder = new SaucRequestEncoder(SaucSessionConfig.defaults(), payloads);
        byte[] pcm = {10, 20, 30, 40};

        SaucFrame frame = encoder.audioRequest(2, pcm);

        assertEquals(MessageType.AUDIO_ONLY_REQUEST, frame.messageType());
        assertEquals(SerializationKind.RAW, frame.serialization());
        assertEquals(CompressionKind.GZIP, frame.compression());
        assertEquals(2, frame.sequenceNumber());
        assertArrayEquals(pcm, payloads.decompress(frame.payload()));
    }

    @Test
    void uncompressedAudioCarriesPcmVerbatim() {
        SaucSessionConfig config = SaucSessionConfig.builder().withCompressAudio(false).build();
        SaucRequestEncoder encoder = new SaucRequestEncoder(config, payloads);
        byte[] pcm = {1, 2};

        SaucFrame frame = encoder.audioRequest(5, pcm);

        assertEquals(CompressionKind.NONE, frame.compression());
        assertArrayEquals(pcm, frame.payload());
    }

    @Test
    void terminalFrameIsNegativeLastAndEmpty() throws PayloadException {
        SaucRequestEncoder encoder = new SaucRequestEncoder(SaucSessionConfig.defaults(), payloads);

        SaucFrame frame = encoder.terminalRequest(-4);

        assertEquals(-4, frame.sequenceNumber());
        assertTrue(frame.lastPacket());
        assertEquals(0, payloads.decompress(frame.payload()).length);
    }

    @Test
    void sequenceSignsAreEnforced() {
        SaucRequestEncoder encoder = new SaucRequestEncoder(SaucSessionConfig.defaults(), payloads);

        assertThrows(IllegalArgumentException.class, () -> encoder.fullRequest(0));
        assertThrows(IllegalArgumentException.class, () -> encoder.audioRequest(-2, new byte[2]));
        assertThrows(IllegalArgumentException.class, () -> encoder.terminalRequest(3));
    }
}
