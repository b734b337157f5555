package com.questrail.speech.protocol.sauc.internal.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.speech.api.RecognitionResult;
import com.questrail.speech.api.Utterance;
import com.questrail.speech.protocol.sauc.codec.DecodeResult;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.ProtocolError;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.payload.PayloadException;
import com.questrail.speech.protocol.sauc.payload.PayloadTransform;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SaucResponseDecoder
 * -----------------------------------------------------------------------------
 * Converts a decoded {@link SaucFrame} into an {@link InboundMessage}.
 *
 * <h2>Response body</h2>
 * <pre>
 *   {"code": 0,
 *    "result": {"text": "...",
 *               "utterances": [{"text": "...", "definite": true,
 *                               "start_time": 0, "end_time": 1200}]}}
 * </pre>
 *
 * <ul>
 *   <li>a non-zero integer {@code code} or an {@code error} field marks a rejection</li>
 *   <li>{@code text} falls back to the joined utterance texts when blank</li>
 *   <li>the result is final when the frame carries the last-packet flag or the
 *       last utterance is definite</li>
 *   <li>{@code result} may also be an array; its first element is used</li>
 * </ul>
 *
 * <p>Payload failures are returned as {@link DecodeResult.Failure} values that
 * carry the frame, never thrown.</p>
 */
public final class SaucResponseDecoder
{
    private final PayloadTransform payloads;

    public SaucResponseDecoder(PayloadTransform payloads) {
        this.payloads = Objects.requireNonNull(payloads, "payloads");
    }

    public DecodeResult<InboundMessage> decode(SaucFrame frame) {
        Objects.requireNonNull(frame, "frame");

        MessageType type = frame.messageType();
        if (type == MessageType.ERROR_RESPONSE) {
            return DecodeResult.success(new InboundMessage.ServerError(frame.errorCode(), errorMessage(frame)));
        }
        if (type != MessageType.FULL_RESPONSE) {
            return DecodeResult.failure(new ProtocolError(ProtocolErrorReason.MALFORMED_HEADER,
                    "unexpected client message type from service: " + type, frame));
        }

        JsonNode body;
        try {
            byte[] plain = payloads.decompress(frame.payload(), frame.compression());
            body = payloads.deserialize(plain, frame.serialization());
        }
        catch (PayloadException e) {
            return DecodeResult.failure(new ProtocolError(e.reason(), e.getMessage(), frame));
        }

        if (!body.isObject()) {
            return DecodeResult.failure(new ProtocolError(ProtocolErrorReason.MALFORMED_PAYLOAD,
                    "response body is not a JSON object", frame));
        }

        String rejection = rejectionOf(body);
        RecognitionResult result = resultOf(body, frame);
        return DecodeResult.success(
                new InboundMessage.Response(result, frame.lastPacket(), rejection, frame.sequenceNumber()));
    }

    private String errorMessage(SaucFrame frame) {
        try {
            byte[] plain = payloads.decompress(frame.payload(), frame.compression());
            return new String(plain, StandardCharsets.UTF_8);
        }
        catch (PayloadException e) {
            // the error code alone still ends the session
            return "undecodable error message (" + frame.payloadLength() + " bytes)";
        }
    }

    private static String rejectionOf(JsonNode body) {
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            return error.isTextual() ? error.asText() : error.toString();
        }
        JsonNode code = body.get("code");
        if (code != null && code.isIntegralNumber() && code.asLong() != 0) {
            JsonNode message = body.get("message");
            return "code " + code.asLong() + (message != null ? ": " + message.asText() : "");
        }
        return null;
    }

    private static RecognitionResult resultOf(JsonNode body, SaucFrame frame) {
        JsonNode result = body.get("result");
        if (result != null && result.isArray()) {
            result = result.size() > 0 ? result.get(0) : null;
        }
        if (result == null || !result.isObject()) {
            return null;
        }

        List<Utterance> utterances = new ArrayList<>();
        JsonNode spans = result.get("utterances");
        if (spans != null && spans.isArray()) {
            for (JsonNode span : spans) {
                utterances.add(new Utterance(
                        span.path("text").asText(""),
                        span.path("start_time").asLong(-1),
                        span.path("end_time").asLong(-1),
                        span.path("definite").asBoolean(false)));
            }
        }

        String text = result.path("text").asText("");
        if (text.isBlank()) {
            StringBuilder joined = new StringBuilder();
            for (Utterance u : utterances) {
                joined.append(u.text());
            }
            text = joined.toString();
        }
        if (text.isBlank()) {
            return null;
        }

        boolean definite = !utterances.isEmpty() && utterances.get(utterances.size() - 1).definite();
        return new RecognitionResult(text, frame.lastPacket() || definite, utterances, frame.sequenceNumber());
    }
}
