package com.questrail.speech.api;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Lifecycle state of one streaming recognition session.
 *
 * <pre>
 *   IDLE → CONNECTING → AWAITING_ACK → STREAMING → FINALIZING → CLOSED
 *     \________\______________\____________\___________→ ERRORED
 * </pre>
 *
 * <p>{@link #CLOSED} and {@link #ERRORED} are terminal: a session never leaves
 * them, and recovery means constructing a new session. Reconnection policy
 * belongs to the caller.</p>
 */
public enum SessionState
{
    /** Constructed, nothing opened yet. */
    IDLE,

    /** Opening the transport and writing the initial request. */
    CONNECTING,

    /** Initial request written; waiting for the service to accept it. */
    AWAITING_ACK,

    /** Accepted; audio segments flow out and results flow back. */
    STREAMING,

    /** Terminal frame written; waiting for the last response. */
    FINALIZING,

    /** Completed successfully; transport closed. */
    CLOSED,

    /** Failed; transport closed. */
    ERRORED;

    public boolean isTerminal() {
        return this == CLOSED || this == ERRORED;
    }

    /**
     * Returns true while audio offered by capture is still admitted
     * (it is queued until the session reaches {@link #STREAMING}).
     */
    public boolean admitsAudio() {
        return this == IDLE || this == CONNECTING || this == AWAITING_ACK || this == STREAMING;
    }
}
