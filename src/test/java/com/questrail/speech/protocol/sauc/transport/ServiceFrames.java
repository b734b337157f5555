package com.questrail.speech.protocol.sauc.transport;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.speech.protocol.sauc.codec.impl.DefaultSaucFrameEncoder;
import com.questrail.speech.protocol.sauc.model.CompressionKind;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.model.SerializationKind;
import com.questrail.speech.protocol.sauc.payload.PayloadException;
import com.questrail.speech.protocol.sauc.payload.PayloadTransform;

import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

/**
 * Builds encoded service-side messages for tests.
 */
public final class ServiceFrames {

    private static final PayloadTransform PAYLOADS = new PayloadTransform();
    private static final DefaultSaucFrameEncoder ENCODER = new DefaultSaucFrameEncoder();

    private ServiceFrames() {
    }

    /** Acceptance of the initial request: code 0, no text. */
    public static byte[] ack() {
        ObjectNode body = PAYLOADS.mapper().createObjectNode();
        body.put("code", 0);
        body.putObject("result").put("text", "");
        return response(1, false, body);
    }

    /** A recognition update with one utterance. */
    public static byte[] result(int sequence, String text, boolean definite, boolean last) {
        return response(sequence, last, OptionalInt.empty(), resultBody(text, definite));
    }

    /** A recognition update whose header also carries an event code. */
    public static byte[] eventResult(int sequence, int event, String text) {
        return response(sequence, false, OptionalInt.of(event), resultBody(text, false));
    }

    private static ObjectNode resultBody(String text, boolean definite) {
        ObjectNode body = PAYLOADS.mapper().createObjectNode();
        body.put("code", 0);
        ObjectNode result = body.putObject("result");
        result.put("text", text);
        ArrayNode utterances = result.putArray("utterances");
        ObjectNode utterance = utterances.addObject();
        utterance.put("text", text);
        utterance.put("start_time", 0);
        utterance.put("end_time", 1200);
        utterance.put("definite", definite);
        return body;
    }

    /** A response that declines the request. */
    public static byte[] rejection(int code, String message) {
        ObjectNode body = PAYLOADS.mapper().createObjectNode();
        body.put("code", code);
        body.put("message", message);
        return response(1, false, body);
    }

    /** An error response frame. */
    public static byte[] error(int code, String message) {
        SaucFrame frame = new SaucFrame(SaucFrame.PROTOCOL_VERSION, MessageType.ERROR_RESPONSE,
                SerializationKind.RAW, CompressionKind.NONE, 0, false, code,
                message.getBytes(StandardCharsets.UTF_8));
        return ENCODER.encode(frame);
    }

    /** A full response declaring gzip whose payload is not gzip. */
    public static byte[] corruptGzip(int sequence) {
        SaucFrame frame = new SaucFrame(SaucFrame.PROTOCOL_VERSION, MessageType.FULL_RESPONSE,
                SerializationKind.JSON, CompressionKind.GZIP, sequence, false, 0,
                new byte[] {1, 2, 3, 4, 5});
        return ENCODER.encode(frame);
    }

    /** A response whose declared payload length exceeds the bytes present. */
    public static byte[] truncated(int sequence) {
        byte[] full = result(sequence, "lost", false, false);
        byte[] cut = new byte[full.length - 3];
        System.arraycopy(full, 0, cut, 0, cut.length);
        return cut;
    }

    private static byte[] response(int sequence, boolean last, ObjectNode body) {
        return response(sequence, last, OptionalInt.empty(), body);
    }

    private static byte[] response(int sequence, boolean last, OptionalInt event, ObjectNode body) {
        try {
            byte[] json = PAYLOADS.serialize(body, SerializationKind.JSON);
            SaucFrame frame = new SaucFrame(SaucFrame.PROTOCOL_VERSION, MessageType.FULL_RESPONSE,
                    SerializationKind.JSON, CompressionKind.GZIP, sequence, last, 0, event, PAYLOADS.compress(json));
            return ENCODER.encode(frame);
        }
        catch (PayloadException e) {
            throw new IllegalStateException(e);
        }
    }
}
