package com.questrail.speech.protocol.sauc.internal.state;

import com.questrail.speech.api.InvalidStateException;
import com.questrail.speech.api.SessionState;
import com.questrail.speech.protocol.sauc.internal.events.SessionCommandEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionSendEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionTimeoutEvent;
import com.questrail.speech.protocol.sauc.observability.RecordingObservabilitySink;
import com.questrail.speech.protocol.sauc.observability.StateTransitionEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SessionStateMachineTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final SessionStateMachine machine =
            new SessionStateMachine(new SessionStateReducer(), Clock.systemUTC(), sink);

    @Test
    void startsIdle() {
        assertEquals(SessionState.IDLE, machine.state());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void transitionsAreReportedToSink() {
        machine.apply(new SessionCommandEvent.ConnectRequested(Instant.now()));
        machine.apply(new SessionSendEvent.InitialRequestSent(Instant.now(), 1));

        List<StateTransitionEvent> transitions = sink.getStateTransitions();
        assertEquals(2, transitions.size());
        assertEquals(SessionState.IDLE, transitions.get(0).oldState().state());
        assertEquals(SessionState.CONNECTING, transitions.get(0).newState().state());
        assertTrue(transitions.get(1).isLifecycleChange());
        assertTrue(transitions.get(1).resultingIntents().contains(SessionIntents.Kind.START_CONSUMER));
    }

    @Test
    void unchangedSnapshotIsNotReported() {
        machine.apply(new SessionCommandEvent.ConnectRequested(Instant.now()));

        SessionIntents intents = machine.apply(
                new SessionTimeoutEvent.TimeoutExpired(Instant.now(), SessionTimeoutEvent.Kind.ACK));

        assertTrue(intents.isEmpty());
        assertEquals(1, sink.getStateTransitions().size());
    }

    @Test
    void refusedEventLeavesSnapshotUntouched() {
        machine.apply(new SessionCommandEvent.ConnectRequested(Instant.now()));
        SessionSnapshot before = machine.snapshot();

        assertThrows(InvalidStateException.class,
                () -> machine.apply(new SessionSendEvent.AudioDispatched(Instant.now(), 1)));

        assertSame(before, machine.snapshot());
    }
}
