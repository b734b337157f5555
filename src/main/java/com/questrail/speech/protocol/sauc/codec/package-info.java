/**
 * SAUC Codec
 * =============================================================================
 *
 * <p>Wire-level framing for the SAUC streaming recognition protocol. One
 * binary WebSocket message carries exactly one frame:</p>
 *
 * <pre>
 *   byte 0   version(4) | header size in words(4)
 *   byte 1   message type(4) | flags(4)
 *   byte 2   serialization(4) | compression(4)
 *   byte 3   reserved
 *   [int32  sequence]          when flags bit 0 is set
 *   [int32  error code]        ERROR_RESPONSE only
 *   uint32  payload length
 *   payload
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] message
 *        → SaucFrameDecoder        (header rules applied here)
 *            → SaucFrame           (payload still compressed)
 *                → SaucResponseDecoder
 *                    → InboundMessage → session events
 * </pre>
 *
 * <p>Payload serialization and compression live in the {@code payload}
 * package; this layer never touches payload contents.</p>
 */
package com.questrail.speech.protocol.sauc.codec;
