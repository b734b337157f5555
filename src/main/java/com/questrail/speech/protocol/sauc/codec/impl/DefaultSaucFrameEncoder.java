package com.questrail.speech.protocol.sauc.codec.impl;

import com.questrail.speech.protocol.sauc.codec.SaucFrameEncoder;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.SaucFrame;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * DefaultSaucFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SaucFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultSaucFrameDecoder}. The
 * flags nibble is derived from the frame: bit 0 when a sequence number is
 * present, bit 1 for the last packet, bit 2 when an event code is present.</p>
 */
public final class DefaultSaucFrameEncoder implements SaucFrameEncoder
{
    @Override
    public byte[] encode(SaucFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final int flags = (frame.hasSequence() ? SaucHeader.FLAG_SEQUENCE : 0)
                | (frame.lastPacket() ? SaucHeader.FLAG_LAST : 0)
                | (frame.event().isPresent() ? SaucHeader.FLAG_EVENT : 0);
        final boolean error = frame.messageType() == MessageType.ERROR_RESPONSE;
        final byte[] payload = frame.payload();

        int length = SaucHeader.SIZE
                + (frame.hasSequence() ? Integer.BYTES : 0)
                + (frame.event().isPresent() ? Integer.BYTES : 0)
                + (error ? Integer.BYTES : 0)
                + Integer.BYTES
                + payload.length;

        ByteBuffer out = ByteBuffer.allocate(length).order(ByteOrder.BIG_ENDIAN);

        out.put(SaucHeader.pack(frame.version(), SaucHeader.HEADER_WORDS));
        out.put(SaucHeader.pack(frame.messageType().code(), flags));
        out.put(SaucHeader.pack(frame.serialization().code(), frame.compression().code()));
        out.put((byte) SaucHeader.RESERVED);

        if (frame.hasSequence()) {
            out.putInt(frame.sequenceNumber());
        }
        frame.event().ifPresent(out::putInt);
        if (error) {
            out.putInt(frame.errorCode());
        }

        out.putInt(payload.length);
        out.put(payload);

        return out.array();
    }
}
