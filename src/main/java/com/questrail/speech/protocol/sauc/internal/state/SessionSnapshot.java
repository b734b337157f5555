package com.questrail.speech.protocol.sauc.internal.state;

import com.questrail.speech.api.SessionState;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionSnapshot
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one session's <em>logical</em> state.
 *
 * <h2>Role in the architecture</h2>
 * Consumed and produced by {@link SessionStateReducer}; held by
 * {@link SessionStateMachine}. Pure data: no I/O handles, no timers.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>lifecycle {@link SessionState}</li>
 *   <li>last sequence number written (0 before the initial request)</li>
 *   <li>whether finalize was requested and whether the terminal frame went out</li>
 *   <li>results delivered so far and the last transcript</li>
 *   <li>failure reason and detail once {@link SessionState#ERRORED}</li>
 * </ul>
 */
public final class SessionSnapshot
{
    private final SessionState state;
    private final int lastSequence;
    private final boolean finalizeRequested;
    private final boolean terminalDispatched;
    private final int resultsEmitted;
    private final String lastTranscript;
    private final ProtocolErrorReason failureReason;
    private final String failureDetail;
    private final Instant lastTransition;

    private SessionSnapshot(SessionState state,
                            int lastSequence,
                            boolean finalizeRequested,
                            boolean terminalDispatched,
                            int resultsEmitted,
                            String lastTranscript,
                            ProtocolErrorReason failureReason,
                            String failureDetail,
                            Instant lastTransition) {
        this.state = Objects.requireNonNull(state, "state");
        this.lastSequence = lastSequence;
        this.finalizeRequested = finalizeRequested;
        this.terminalDispatched = terminalDispatched;
        this.resultsEmitted = resultsEmitted;
        this.lastTranscript = Objects.requireNonNull(lastTranscript, "lastTranscript");
        this.failureReason = failureReason;
        this.failureDetail = Objects.requireNonNull(failureDetail, "failureDetail");
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public static SessionSnapshot idle(Instant now) {
        return new SessionSnapshot(SessionState.IDLE, 0, false, false, 0, "", null, "", now);
    }

    public SessionState state() {
        return state;
    }

    public int lastSequence() {
        return lastSequence;
    }

    public boolean finalizeRequested() {
        return finalizeRequested;
    }

    public boolean terminalDispatched() {
        return terminalDispatched;
    }

    public int resultsEmitted() {
        return resultsEmitted;
    }

    public String lastTranscript() {
        return lastTranscript;
    }

    public Optional<ProtocolErrorReason> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    public String failureDetail() {
        return failureDetail;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Copy-on-write helpers
    // ---------------------------------------------------------------------

    public SessionSnapshot withState(SessionState newState, Instant now) {
        return new SessionSnapshot(newState, lastSequence, finalizeRequested, terminalDispatched,
                resultsEmitted, lastTranscript, failureReason, failureDetail, now);
    }

    public SessionSnapshot withLastSequence(int sequence) {
        return new SessionSnapshot(state, sequence, finalizeRequested, terminalDispatched,
                resultsEmitted, lastTranscript, failureReason, failureDetail, lastTransition);
    }

    public SessionSnapshot withFinalizeRequested() {
        return new SessionSnapshot(state, lastSequence, true, terminalDispatched,
                resultsEmitted, lastTranscript, failureReason, failureDetail, lastTransition);
    }

    public SessionSnapshot withTerminalDispatched(int terminalSequence, Instant now) {
        return new SessionSnapshot(SessionState.FINALIZING, terminalSequence, true, true,
                resultsEmitted, lastTranscript, failureReason, failureDetail, now);
    }

    public SessionSnapshot withResult(String transcript) {
        return new SessionSnapshot(state, lastSequence, finalizeRequested, terminalDispatched,
                resultsEmitted + 1, transcript, failureReason, failureDetail, lastTransition);
    }

    public SessionSnapshot errored(ProtocolErrorReason reason, String detail, Instant now) {
        return new SessionSnapshot(SessionState.ERRORED, lastSequence, finalizeRequested, terminalDispatched,
                resultsEmitted, lastTranscript, Objects.requireNonNull(reason, "reason"), detail, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionSnapshot other)) {
            return false;
        }
        return lastSequence == other.lastSequence
                && finalizeRequested == other.finalizeRequested
                && terminalDispatched == other.terminalDispatched
                && resultsEmitted == other.resultsEmitted
                && state == other.state
                && failureReason == other.failureReason
                && lastTranscript.equals(other.lastTranscript)
                && failureDetail.equals(other.failureDetail)
                && lastTransition.equals(other.lastTransition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, lastSequence, finalizeRequested, terminalDispatched,
                resultsEmitted, lastTranscript, failureReason, failureDetail, lastTransition);
    }

    @Override
    public String toString() {
        return "SessionSnapshot[" + state +
                ", lastSeq=" + lastSequence +
                ", finalizeRequested=" + finalizeRequested +
                ", results=" + resultsEmitted +
                (failureReason != null ? ", failure=" + failureReason : "") +
                ']';
    }
}
