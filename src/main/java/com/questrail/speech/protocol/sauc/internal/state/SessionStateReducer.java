package com.questrail.speech.protocol.sauc.internal.state;

import com.questrail.speech.api.InvalidStateException;
import com.questrail.speech.api.RecognitionResult;
import com.questrail.speech.api.SessionOutcome;
import com.questrail.speech.api.SessionState;
import com.questrail.speech.protocol.sauc.internal.decode.InboundMessage;
import com.questrail.speech.protocol.sauc.internal.events.SessionCommandEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionFailureEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionMessageEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionSendEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionTimeoutEvent;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * SessionStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one streaming session.
 *
 * <pre>
 *   IDLE ──connect──▶ CONNECTING ──initial request sent──▶ AWAITING_ACK
 *   AWAITING_ACK ──accepting response──▶ STREAMING
 *   STREAMING ──terminal frame dispatched──▶ FINALIZING ──last response──▶ CLOSED
 *   any non-terminal ──transport failure, error response, timeout,
 *                      capture starvation, cancel──▶ ERRORED
 * </pre>
 *
 * Given a prior {@link SessionSnapshot} and one {@link SessionEvent}, the
 * reducer computes the next snapshot and the {@link SessionIntents} the engine
 * must carry out. It performs no I/O and reads no clock; time comes from the
 * event.
 *
 * <h2>Rules worth knowing</h2>
 * <ul>
 *   <li>Events arriving in a terminal state are ignored.</li>
 *   <li>A timeout is honoured only in the state it guards; otherwise it is stale.</li>
 *   <li>Dispatching audio outside {@code STREAMING}, or a second terminal
 *       frame, is refused with {@link InvalidStateException} before anything
 *       is written.</li>
 *   <li>Sequence numbers must advance by exactly one; the terminal number is
 *       the negation of the next one.</li>
 *   <li>Finalize is idempotent.</li>
 *   <li>Every transition into {@code CLOSED} or {@code ERRORED} reports the
 *       outcome, and nothing else ever does, so it is reported exactly once.</li>
 * </ul>
 */
public final class SessionStateReducer
{
    /**
     * Result of applying an event.
     *
     * @param newState the updated snapshot
     * @param intents  side effects for the caller to execute
     */
    public record Result(SessionSnapshot newState, SessionIntents intents) {}

    public Result apply(SessionSnapshot state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof SessionCommandEvent.ConnectRequested e) {
            return onConnectRequested(state, e);
        }
        if (event instanceof SessionCommandEvent.FinalizeRequested e) {
            return onFinalizeRequested(state, e);
        }
        if (event instanceof SessionCommandEvent.CancelRequested e) {
            return ignoredWhenTerminal(state, () -> fail(state, ProtocolErrorReason.CANCELLED,
                    "cancelled by caller", e.timestamp()));
        }
        if (event instanceof SessionSendEvent.InitialRequestSent e) {
            return onInitialRequestSent(state, e);
        }
        if (event instanceof SessionSendEvent.AudioDispatched e) {
            return onAudioDispatched(state, e);
        }
        if (event instanceof SessionSendEvent.TerminalDispatched e) {
            return onTerminalDispatched(state, e);
        }
        if (event instanceof SessionMessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof SessionFailureEvent e) {
            return ignoredWhenTerminal(state, () -> fail(state, e.reason(), e.detail(), e.timestamp()));
        }
        if (event instanceof SessionTimeoutEvent.TimeoutExpired e) {
            return onTimeout(state, e);
        }

        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onConnectRequested(SessionSnapshot state, SessionCommandEvent.ConnectRequested e) {
        if (state.state() != SessionState.IDLE) {
            throw new InvalidStateException(state.state(), "session already started");
        }
        return new Result(
                state.withState(SessionState.CONNECTING, e.timestamp()),
                SessionIntents.builder().armTimeout(SessionTimeoutEvent.Kind.CONNECT).build());
    }

    private Result onFinalizeRequested(SessionSnapshot state, SessionCommandEvent.FinalizeRequested e) {
        switch (state.state()) {
            case IDLE:
                // nothing was opened and nothing was captured
                return close(state, e.timestamp());
            case CONNECTING:
            case AWAITING_ACK:
            case STREAMING:
                if (state.finalizeRequested()) {
                    return unchanged(state);
                }
                return new Result(state.withFinalizeRequested(),
                        SessionIntents.builder().add(SessionIntents.Kind.CLOSE_INPUT).build());
            default:
                return unchanged(state);
        }
    }

    private Result onInitialRequestSent(SessionSnapshot state, SessionSendEvent.InitialRequestSent e) {
        if (state.state().isTerminal()) {
            return unchanged(state);
        }
        if (state.state() != SessionState.CONNECTING) {
            throw new InvalidStateException(state.state(), "initial request reported outside CONNECTING");
        }
        requireNextSequence(state, e.sequenceNumber());

        return new Result(
                state.withState(SessionState.AWAITING_ACK, e.timestamp()).withLastSequence(e.sequenceNumber()),
                SessionIntents.builder()
                        .add(SessionIntents.Kind.CANCEL_TIMEOUT)
                        .armTimeout(SessionTimeoutEvent.Kind.ACK)
                        .add(SessionIntents.Kind.START_CONSUMER)
                        .build());
    }

    private Result onAudioDispatched(SessionSnapshot state, SessionSendEvent.AudioDispatched e) {
        if (state.state() != SessionState.STREAMING) {
            throw new InvalidStateException(state.state(), "audio can only be sent while STREAMING");
        }
        requireNextSequence(state, e.sequenceNumber());
        return new Result(state.withLastSequence(e.sequenceNumber()), SessionIntents.none());
    }

    private Result onTerminalDispatched(SessionSnapshot state, SessionSendEvent.TerminalDispatched e) {
        if (state.state() != SessionState.STREAMING || state.terminalDispatched()) {
            throw new InvalidStateException(state.state(), "terminal frame can only be sent once, while STREAMING");
        }
        if (!state.finalizeRequested()) {
            throw new InvalidStateException(state.state(), "terminal frame sent without a finalize request");
        }
        int expected = -(state.lastSequence() + 1);
        if (e.sequenceNumber() != expected) {
            throw new IllegalArgumentException("terminal sequence must be " + expected + ", got " + e.sequenceNumber());
        }

        return new Result(
                state.withTerminalDispatched(e.sequenceNumber(), e.timestamp()),
                SessionIntents.builder().armTimeout(SessionTimeoutEvent.Kind.FINAL_ACK).build());
    }

    private Result onMessageReceived(SessionSnapshot state, SessionMessageEvent.MessageReceived e) {
        SessionState s = state.state();
        if (s.isTerminal() || s == SessionState.IDLE || s == SessionState.CONNECTING) {
            return unchanged(state);
        }

        InboundMessage message = e.message();
        if (message instanceof InboundMessage.ServerError error) {
            return fail(state, ProtocolErrorReason.SERVER_ERROR,
                    "code " + error.code() + ": " + error.message(), e.timestamp());
        }

        InboundMessage.Response response = (InboundMessage.Response) message;
        if (s == SessionState.AWAITING_ACK) {
            return onAcknowledgement(state, response, e.timestamp());
        }

        // STREAMING or FINALIZING
        if (response.isRejection()) {
            return fail(state, ProtocolErrorReason.SERVER_ERROR, response.rejection(), e.timestamp());
        }
        return deliver(state, SessionIntents.builder(), response, e.timestamp());
    }

    private Result onAcknowledgement(SessionSnapshot state, InboundMessage.Response response, Instant now) {
        if (response.isRejection()) {
            return fail(state, ProtocolErrorReason.REJECTED, response.rejection(), now);
        }

        SessionIntents.Builder intents = SessionIntents.builder()
                .add(SessionIntents.Kind.CANCEL_TIMEOUT)
                .add(SessionIntents.Kind.START_STREAMING);

        return deliver(state.withState(SessionState.STREAMING, now), intents, response, now);
    }

    private Result onTimeout(SessionSnapshot state, SessionTimeoutEvent.TimeoutExpired e) {
        SessionTimeoutEvent.Kind kind = e.kind();
        if (state.state() != kind.guardedState()) {
            return unchanged(state);
        }
        return fail(state, kind.reason(), "no progress in " + kind.guardedState(), e.timestamp());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Result deliver(SessionSnapshot state,
                           SessionIntents.Builder intents,
                           InboundMessage.Response response,
                           Instant now) {
        SessionSnapshot next = state;
        if (response.result() != null) {
            RecognitionResult result = response.result();
            next = next.withResult(result.text());
            intents.emit(result);
        }

        if (response.lastPacket()) {
            return close(next, intents, now);
        }
        return new Result(next, intents.build());
    }

    private Result close(SessionSnapshot state, Instant now) {
        return close(state, SessionIntents.builder(), now);
    }

    private Result close(SessionSnapshot state, SessionIntents.Builder intents, Instant now) {
        SessionSnapshot closed = state.withState(SessionState.CLOSED, now);
        SessionOutcome outcome = SessionOutcome.success(closed.lastTranscript(), closed.resultsEmitted(), now);
        return new Result(closed, shutdown(intents).report(outcome).build());
    }

    private Result fail(SessionSnapshot state, ProtocolErrorReason reason, String detail, Instant now) {
        SessionSnapshot errored = state.errored(reason, detail, now);
        SessionOutcome outcome = SessionOutcome.failure(reason, detail,
                errored.lastTranscript(), errored.resultsEmitted(), now);
        return new Result(errored, shutdown(SessionIntents.builder()).report(outcome).build());
    }

    private static SessionIntents.Builder shutdown(SessionIntents.Builder intents) {
        return intents
                .add(SessionIntents.Kind.CANCEL_TIMEOUT)
                .add(SessionIntents.Kind.CLOSE_INPUT)
                .add(SessionIntents.Kind.STOP_TASKS)
                .add(SessionIntents.Kind.DISCARD_AUDIO)
                .add(SessionIntents.Kind.CLOSE_TRANSPORT);
    }

    private static void requireNextSequence(SessionSnapshot state, int sequence) {
        if (sequence != state.lastSequence() + 1) {
            throw new IllegalArgumentException("sequence must advance by one: last "
                    + state.lastSequence() + ", got " + sequence);
        }
    }

    private static Result ignoredWhenTerminal(SessionSnapshot state, Supplier<Result> transition) {
        return state.state().isTerminal() ? unchanged(state) : transition.get();
    }

    private static Result unchanged(SessionSnapshot state) {
        return new Result(state, SessionIntents.none());
    }
}
