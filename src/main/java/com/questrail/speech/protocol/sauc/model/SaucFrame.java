package com.questrail.speech.protocol.sauc.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * SaucFrame
 * -----------------------------------------------------------------------------
 * Immutable, structured representation of one SAUC protocol message.
 *
 * <h2>What this represents</h2>
 * A {@code SaucFrame} is the header fields plus the payload bytes exactly as
 * they travel on the wire: a gzip-declared frame holds the <em>compressed</em>
 * payload. Serialization and compression are applied by the payload layer, not
 * by this class.
 *
 * <h2>Sequence numbers</h2>
 * <ul>
 *   <li>{@code sequenceNumber == 0}: no sequence field on the wire</li>
 *   <li>positive: ongoing stream segment</li>
 *   <li>negative: terminal frame; always carries the last-packet flag</li>
 * </ul>
 *
 * <p>Service responses may also carry an event code (flags bit 2). It is kept
 * so that a re-encoded frame matches the one received.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class SaucFrame
{
    /** Protocol revision spoken by this implementation. */
    public static final int PROTOCOL_VERSION = 0b0001;

    private final int version;
    private final MessageType messageType;
    private final SerializationKind serialization;
    private final CompressionKind compression;
    private final int sequenceNumber;
    private final boolean lastPacket;
    private final int errorCode;
    private final OptionalInt event;
    private final byte[] payload;

    public SaucFrame(int version,
                     MessageType messageType,
                     SerializationKind serialization,
                     CompressionKind compression,
                     int sequenceNumber,
                     boolean lastPacket,
                     int errorCode,
                     byte[] payload) {
        this(version, messageType, serialization, compression,
                sequenceNumber, lastPacket, errorCode, OptionalInt.empty(), payload);
    }

    public SaucFrame(int version,
                     MessageType messageType,
                     SerializationKind serialization,
                     CompressionKind compression,
                     int sequenceNumber,
                     boolean lastPacket,
                     int errorCode,
                     OptionalInt event,
                     byte[] payload) {

        if (version < 0 || version > 0x0F) {
            throw new IllegalArgumentException("version must fit in 4 bits: " + version);
        }
        this.version = version;
        this.messageType = Objects.requireNonNull(messageType, "messageType");
        this.serialization = Objects.requireNonNull(serialization, "serialization");
        this.compression = Objects.requireNonNull(compression, "compression");
        this.sequenceNumber = sequenceNumber;
        this.lastPacket = lastPacket || sequenceNumber < 0;
        this.errorCode = (messageType == MessageType.ERROR_RESPONSE) ? errorCode : 0;
        this.event = Objects.requireNonNull(event, "event");
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    /**
     * Creates a client request frame at the current protocol version.
     */
    public static SaucFrame request(MessageType type,
                                    SerializationKind serialization,
                                    CompressionKind compression,
                                    int sequenceNumber,
                                    byte[] payload) {
        return new SaucFrame(PROTOCOL_VERSION, type, serialization, compression,
                sequenceNumber, false, 0, payload);
    }

    public int version() {
        return version;
    }

    public MessageType messageType() {
        return messageType;
    }

    public SerializationKind serialization() {
        return serialization;
    }

    public CompressionKind compression() {
        return compression;
    }

    /**
     * Returns the sequence number, or 0 when the frame carries none.
     */
    public int sequenceNumber() {
        return sequenceNumber;
    }

    public boolean hasSequence() {
        return sequenceNumber != 0;
    }

    /**
     * Indicates the last-packet flag: the terminal client frame, or the
     * service's final response for the stream.
     */
    public boolean lastPacket() {
        return lastPacket;
    }

    /**
     * Service error code; always 0 unless this is an {@link MessageType#ERROR_RESPONSE}.
     */
    public int errorCode() {
        return errorCode;
    }

    /**
     * Event code from flags bit 2, if the frame carried one.
     */
    public OptionalInt event() {
        return event;
    }

    /**
     * Returns a copy of the payload bytes (never {@code null}).
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SaucFrame other)) {
            return false;
        }
        return version == other.version
                && sequenceNumber == other.sequenceNumber
                && lastPacket == other.lastPacket
                && errorCode == other.errorCode
                && event.equals(other.event)
                && messageType == other.messageType
                && serialization == other.serialization
                && compression == other.compression
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(version, messageType, serialization, compression,
                sequenceNumber, lastPacket, errorCode, event);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "SaucFrame[" +
                "type=" + messageType +
                ", seq=" + sequenceNumber +
                ", last=" + lastPacket +
                ", serialization=" + serialization +
                ", compression=" + compression +
                (messageType == MessageType.ERROR_RESPONSE ? ", errorCode=" + errorCode : "") +
                (event.isPresent() ? ", event=" + event.getAsInt() : "") +
                ", payloadLength=" + payload.length +
                ']';
    }
}
