package com.questrail.speech.protocol.sauc.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.speech.protocol.sauc.model.CompressionKind;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;
import com.questrail.speech.protocol.sauc.model.SerializationKind;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * PayloadTransform
 * -----------------------------------------------------------------------------
 * Serialization and compression of frame payloads.
 *
 * <pre>
 *   outbound: request body → JSON (Jackson) → gzip → frame payload
 *   inbound:  frame payload → gunzip (if declared) → JSON → JsonNode
 * </pre>
 *
 * <p>Stateless and thread-safe; a single instance is shared by the encoder
 * and decoder of a session.</p>
 */
public final class PayloadTransform
{
    private final ObjectMapper mapper;

    public PayloadTransform() {
        this(new ObjectMapper());
    }

    public PayloadTransform(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Serialize a request body. {@link SerializationKind#RAW} bodies must
     * already be {@code byte[]}.
     */
    public byte[] serialize(Object body, SerializationKind kind) throws PayloadException {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(kind, "kind");

        if (kind == SerializationKind.RAW) {
            if (body instanceof byte[] raw) {
                return raw.clone();
            }
            throw new IllegalArgumentException("RAW payload must be byte[], got " + body.getClass().getName());
        }

        try {
            return mapper.writeValueAsBytes(body);
        }
        catch (JsonProcessingException e) {
            throw new PayloadException(ProtocolErrorReason.MALFORMED_PAYLOAD, "JSON serialization failed", e);
        }
    }

    /**
     * Parse a (decompressed) payload. Raw payloads come back as a binary node.
     */
    public JsonNode deserialize(byte[] bytes, SerializationKind kind) throws PayloadException {
        Objects.requireNonNull(bytes, "bytes");

        if (kind == SerializationKind.RAW) {
            return mapper.getNodeFactory().binaryNode(bytes.clone());
        }
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }

        try {
            return mapper.readTree(bytes);
        }
        catch (IOException e) {
            throw new PayloadException(ProtocolErrorReason.MALFORMED_PAYLOAD, "JSON payload did not parse", e);
        }
    }

    public byte[] compress(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");

        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, bytes.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(bytes);
        }
        catch (IOException e) {
            // in-memory streams do not fail
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public byte[] decompress(byte[] bytes) throws PayloadException {
        Objects.requireNonNull(bytes, "bytes");

        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return gzip.readAllBytes();
        }
        catch (IOException e) {
            throw new PayloadException(ProtocolErrorReason.DECOMPRESSION_FAILED,
                    "gzip payload of " + bytes.length + " bytes did not decompress", e);
        }
    }

    /**
     * Apply the compression declared by a frame.
     */
    public byte[] compress(byte[] bytes, CompressionKind kind) {
        return (kind == CompressionKind.GZIP) ? compress(bytes) : bytes;
    }

    /**
     * Remove the compression declared by a frame; {@link CompressionKind#NONE}
     * skips decompression.
     */
    public byte[] decompress(byte[] bytes, CompressionKind kind) throws PayloadException {
        return (kind == CompressionKind.GZIP) ? decompress(bytes) : bytes;
    }
}
