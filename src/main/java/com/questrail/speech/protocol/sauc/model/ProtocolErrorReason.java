package com.questrail.speech.protocol.sauc.model;

/**
 * ProtocolErrorReason
 * -----------------------------------------------------------------------------
 * Reason codes for every failure the streaming core can observe or report.
 *
 * <p>The first group is recoverable per inbound frame: the frame is logged and
 * dropped while the session carries on. The remaining codes are terminal for a
 * session and surface in its {@code SessionOutcome}, except
 * {@link #INVALID_STATE}, which is reported to the offending caller.</p>
 */
public enum ProtocolErrorReason
{
    TRUNCATED(true),
    UNSUPPORTED_VERSION(true),
    MALFORMED_HEADER(true),
    DECOMPRESSION_FAILED(true),
    MALFORMED_PAYLOAD(true),

    INVALID_STATE(false),

    TRANSPORT_CLOSED(false),
    CONNECT_TIMEOUT(false),
    ACK_TIMEOUT(false),
    FINAL_ACK_TIMEOUT(false),
    CAPTURE_STARVATION(false),
    SERVER_ERROR(false),
    REJECTED(false),
    CANCELLED(false);

    private final boolean recoverable;

    ProtocolErrorReason(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * Returns true if a failure with this reason affects a single inbound frame
     * only and must not end the session.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
