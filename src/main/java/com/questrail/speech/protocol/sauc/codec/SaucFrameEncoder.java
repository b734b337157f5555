package com.questrail.speech.protocol.sauc.codec;

import com.questrail.speech.protocol.sauc.model.SaucFrame;

/**
 * SaucFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for SAUC framing.
 *
 * <p>This is the outbound wire-mechanics boundary between a structured
 * {@link SaucFrame} and the bytes of one binary WebSocket message. It does not
 * decide what to send, and it does not serialize or compress payloads; the
 * frame payload is written as-is.</p>
 */
public interface SaucFrameEncoder
{
    /**
     * Encode a frame into a wire-ready binary message.
     */
    byte[] encode(SaucFrame frame);
}
