package com.questrail.speech.protocol.sauc.codec.impl;

import com.questrail.speech.protocol.sauc.codec.DecodeResult;
import com.questrail.speech.protocol.sauc.codec.SaucFrameDecoder;
import com.questrail.speech.protocol.sauc.model.CompressionKind;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.ProtocolError;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.model.SerializationKind;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * DefaultSaucFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SaucFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Version check (byte 0, high nibble)</li>
 *   <li>Header validation: header size, message type, flags, serialization,
 *       compression</li>
 *   <li>Optional sequence, event and error-code fields, in that order</li>
 *   <li>Payload length check against the bytes actually available</li>
 * </ol>
 *
 * <p>Header extension words (header size &gt; 1) are skipped.</p>
 */
public final class DefaultSaucFrameDecoder implements SaucFrameDecoder
{
    @Override
    public DecodeResult<SaucFrame> decode(byte[] message)
    {
        if (message == null || message.length < SaucHeader.SIZE) {
            return fail(ProtocolErrorReason.TRUNCATED,
                    "message shorter than header: " + (message == null ? 0 : message.length));
        }

        final int version = SaucHeader.high(message[0]);
        if (version != SaucFrame.PROTOCOL_VERSION) {
            return fail(ProtocolErrorReason.UNSUPPORTED_VERSION, "version " + version);
        }

        final int headerWords = SaucHeader.low(message[0]);
        if (headerWords == 0) {
            return fail(ProtocolErrorReason.MALFORMED_HEADER, "header size 0");
        }

        Optional<MessageType> type = MessageType.fromCode(SaucHeader.high(message[1]));
        if (type.isEmpty()) {
            return fail(ProtocolErrorReason.MALFORMED_HEADER,
                    "unknown message type 0x" + Integer.toHexString(SaucHeader.high(message[1])));
        }

        final int flags = SaucHeader.low(message[1]);
        if ((flags & ~SaucHeader.KNOWN_FLAGS) != 0) {
            return fail(ProtocolErrorReason.MALFORMED_HEADER, "unknown flags 0b" + Integer.toBinaryString(flags));
        }

        Optional<SerializationKind> serialization = SerializationKind.fromCode(SaucHeader.high(message[2]));
        if (serialization.isEmpty()) {
            return fail(ProtocolErrorReason.MALFORMED_HEADER,
                    "unknown serialization " + SaucHeader.high(message[2]));
        }

        Optional<CompressionKind> compression = CompressionKind.fromCode(SaucHeader.low(message[2]));
        if (compression.isEmpty()) {
            return fail(ProtocolErrorReason.MALFORMED_HEADER,
                    "unknown compression " + SaucHeader.low(message[2]));
        }

        ByteBuffer in = ByteBuffer.wrap(message).order(ByteOrder.BIG_ENDIAN);
        final int headerBytes = headerWords * SaucHeader.SIZE;
        if (message.length < headerBytes) {
            return fail(ProtocolErrorReason.TRUNCATED, "header extension past end of message");
        }
        in.position(headerBytes);

        int sequence = 0;
        if ((flags & SaucHeader.FLAG_SEQUENCE) != 0) {
            if (in.remaining() < Integer.BYTES) {
                return fail(ProtocolErrorReason.TRUNCATED, "missing sequence number");
            }
            sequence = in.getInt();
        }

        OptionalInt event = OptionalInt.empty();
        if ((flags & SaucHeader.FLAG_EVENT) != 0) {
            if (in.remaining() < Integer.BYTES) {
                return fail(ProtocolErrorReason.TRUNCATED, "missing event code");
            }
            event = OptionalInt.of(in.getInt());
        }

        int errorCode = 0;
        if (type.get() == MessageType.ERROR_RESPONSE) {
            if (in.remaining() < Integer.BYTES) {
                return fail(ProtocolErrorReason.TRUNCATED, "missing error code");
            }
            errorCode = in.getInt();
        }

        if (in.remaining() < Integer.BYTES) {
            return fail(ProtocolErrorReason.TRUNCATED, "missing payload length");
        }
        // uint32 on the wire
        final long declared = Integer.toUnsignedLong(in.getInt());
        if (declared > in.remaining()) {
            return fail(ProtocolErrorReason.TRUNCATED,
                    "declared payload " + declared + " bytes, " + in.remaining() + " available");
        }

        byte[] payload = new byte[(int) declared];
        in.get(payload);

        return DecodeResult.success(new SaucFrame(
                version,
                type.get(),
                serialization.get(),
                compression.get(),
                sequence,
                (flags & SaucHeader.FLAG_LAST) != 0,
                errorCode,
                event,
                payload));
    }

    private static DecodeResult<SaucFrame> fail(ProtocolErrorReason reason, String detail) {
        return DecodeResult.failure(ProtocolError.of(reason, detail));
    }
}
