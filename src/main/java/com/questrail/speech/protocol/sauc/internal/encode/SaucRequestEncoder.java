package com.questrail.speech.protocol.sauc.internal.encode;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.speech.protocol.sauc.config.AudioFormat;
import com.questrail.speech.protocol.sauc.config.RecognitionFeatures;
import com.questrail.speech.protocol.sauc.config.SaucSessionConfig;
import com.questrail.speech.protocol.sauc.model.CompressionKind;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.model.SerializationKind;
import com.questrail.speech.protocol.sauc.payload.PayloadException;
import com.questrail.speech.protocol.sauc.payload.PayloadTransform;

import java.util.Map;
import java.util.Objects;

/**
 * SaucRequestEncoder
 * -----------------------------------------------------------------------------
 * Builds the client-side frames of a session from session configuration and
 * audio bytes.
 *
 * <h2>Frames produced</h2>
 * <ul>
 *   <li>{@link #fullRequest(int)}: session configuration as gzip-compressed JSON</li>
 *   <li>{@link #audioRequest(int, byte[])}: one segment of raw PCM</li>
 *   <li>{@link #terminalRequest(int)}: empty audio frame with the negative
 *       sequence number that closes the stream</li>
 * </ul>
 *
 * This class assigns no sequence numbers itself; it only lays out what it is
 * given. Byte-level encoding is left to the frame encoder.
 */
public final class SaucRequestEncoder
{
    private final SaucSessionConfig config;
    private final PayloadTransform payloads;
    private final CompressionKind audioCompression;

    public SaucRequestEncoder(SaucSessionConfig config, PayloadTransform payloads) {
        this.config = Objects.requireNonNull(config, "config");
        this.payloads = Objects.requireNonNull(payloads, "payloads");
        this.audioCompression = config.compressAudio() ? CompressionKind.GZIP : CompressionKind.NONE;
    }

    /**
     * Returns the initial request body as a JSON tree.
     */
    public ObjectNode requestBody() {
        ObjectNode root = payloads.mapper().createObjectNode();

        root.putObject("user").put("uid", config.userId());

        AudioFormat format = config.audioFormat();
        ObjectNode audio = root.putObject("audio");
        audio.put("format", AudioFormat.WIRE_FORMAT);
        audio.put("codec", AudioFormat.WIRE_CODEC);
        audio.put("rate", format.sampleRate());
        audio.put("bits", format.bitsPerSample());
        audio.put("channel", format.channels());

        RecognitionFeatures features = config.features();
        ObjectNode request = root.putObject("request");
        request.put("model_name", features.modelName());
        request.put("enable_itn", features.enableItn());
        request.put("enable_punc", features.enablePunc());
        request.put("enable_ddc", features.enableDdc());
        request.put("show_utterances", features.showUtterances());
        request.put("result_type", features.resultType());
        if (features.endWindowSizeMs() != null) {
            request.put("end_window_size", features.endWindowSizeMs());
        }
        for (Map.Entry<String, Object> extra : features.extraParams().entrySet()) {
            request.set(extra.getKey(), payloads.mapper().valueToTree(extra.getValue()));
        }
        return root;
    }

    public SaucFrame fullRequest(int sequenceNumber) throws PayloadException {
        requirePositive(sequenceNumber);
        byte[] json = payloads.serialize(requestBody(), SerializationKind.JSON);
        return SaucFrame.request(MessageType.FULL_REQUEST, SerializationKind.JSON, CompressionKind.GZIP,
                sequenceNumber, payloads.compress(json));
    }

    public SaucFrame audioRequest(int sequenceNumber, byte[] pcm) {
        requirePositive(sequenceNumber);
        Objects.requireNonNull(pcm, "pcm");
        return SaucFrame.request(MessageType.AUDIO_ONLY_REQUEST, SerializationKind.RAW, audioCompression,
                sequenceNumber, payloads.compress(pcm, audioCompression));
    }

    public SaucFrame terminalRequest(int sequenceNumber) {
        if (sequenceNumber >= 0) {
            throw new IllegalArgumentException("terminal sequence must be negative: " + sequenceNumber);
        }
        return SaucFrame.request(MessageType.AUDIO_ONLY_REQUEST, SerializationKind.RAW, audioCompression,
                sequenceNumber, payloads.compress(new byte[0], audioCompression));
    }

    private static void requirePositive(int sequenceNumber) {
        if (sequenceNumber <= 0) {
            throw new IllegalArgumentException("sequence must be positive: " + sequenceNumber);
        }
    }
}
