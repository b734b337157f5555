package com.questrail.speech.protocol.sauc.codec;

import com.questrail.speech.protocol.sauc.model.SaucFrame;

/**
 * SaucFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for SAUC framing.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the fixed header and its enumerated fields</li>
 *   <li>Detecting truncation against the declared payload length</li>
 *   <li>Constructing a {@link SaucFrame} on success</li>
 * </ul>
 *
 * <p>It does not decompress or deserialize payloads and does not classify
 * responses. Every failure is returned as a
 * {@link DecodeResult.Failure}; nothing is thrown for malformed input.</p>
 */
public interface SaucFrameDecoder
{
    /**
     * Decode exactly one frame from a complete binary message.
     *
     * @param message raw bytes of one inbound WebSocket binary message
     * @return the decoded frame, or a failure with reason
     *         {@code TRUNCATED}, {@code UNSUPPORTED_VERSION} or {@code MALFORMED_HEADER}
     */
    DecodeResult<SaucFrame> decode(byte[] message);
}
