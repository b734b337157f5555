package com.questrail.speech.protocol.sauc.codec.impl;

/**
 * SaucHeader
 * -----------------------------------------------------------------------------
 * Constants and nibble helpers for the fixed 4-byte SAUC header.
 *
 * <p>Package-private: only the default encoder and decoder apply these
 * rules.</p>
 */
final class SaucHeader
{
    /** Fixed header length in bytes (one 4-byte word). */
    static final int SIZE = 4;

    /** Header size nibble written by this implementation, in 4-byte words. */
    static final int HEADER_WORDS = 0b0001;

    /** Flags bit 0: a sequence number follows the header. */
    static final int FLAG_SEQUENCE = 0b0001;

    /** Flags bit 1: last packet of the stream. */
    static final int FLAG_LAST = 0b0010;

    /** Flags bit 2: an event code follows the sequence number. */
    static final int FLAG_EVENT = 0b0100;

    static final int KNOWN_FLAGS = FLAG_SEQUENCE | FLAG_LAST | FLAG_EVENT;

    static final int RESERVED = 0x00;

    private SaucHeader() {}

    static byte pack(int high, int low) {
        return (byte) (((high & 0x0F) << 4) | (low & 0x0F));
    }

    static int high(byte b) {
        return (b >> 4) & 0x0F;
    }

    static int low(byte b) {
        return b & 0x0F;
    }
}
