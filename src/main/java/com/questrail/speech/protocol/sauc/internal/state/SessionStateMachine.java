package com.questrail.speech.protocol.sauc.internal.state;

import com.questrail.speech.api.SessionState;
import com.questrail.speech.protocol.sauc.internal.events.SessionEvent;
import com.questrail.speech.protocol.sauc.observability.NullObservabilitySink;
import com.questrail.speech.protocol.sauc.observability.StateTransitionEvent;
import com.questrail.speech.protocol.sauc.observability.StreamingObservabilitySink;

import java.time.Clock;
import java.util.Objects;

/**
 * SessionStateMachine
 * =============================================================================
 * Thread-safe holder of the current {@link SessionSnapshot}.
 *
 * <p>Producer, consumer, timer and caller threads all report events here.
 * Each {@link #apply(SessionEvent)} runs the reducer under one lock, so
 * snapshots advance one event at a time in a single total order. Intents are
 * returned to the caller for execution; this class performs no I/O.</p>
 *
 * <p>If the reducer refuses an event with an exception, the snapshot is left
 * unchanged and the exception propagates to the reporting thread.</p>
 */
public final class SessionStateMachine
{
    private final SessionStateReducer reducer;
    private final StreamingObservabilitySink observabilitySink;
    private final Clock clock;
    private final Object stateLock = new Object();

    private SessionSnapshot current;

    public SessionStateMachine(SessionStateReducer reducer,
                               Clock clock,
                               StreamingObservabilitySink observabilitySink)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.current = SessionSnapshot.idle(clock.instant());
    }

    /**
     * Applies one event and returns the intents it produced.
     */
    public SessionIntents apply(SessionEvent event) {
        Objects.requireNonNull(event, "event");

        final SessionSnapshot oldState;
        final SessionStateReducer.Result result;

        synchronized (stateLock) {
            oldState = current;
            result = reducer.apply(current, event);
            current = result.newState();

            if (!oldState.equals(result.newState())) {
                observabilitySink.onStateTransition(new StateTransitionEvent(
                    clock.instant(),
                    oldState,
                    result.newState(),
                    event,
                    result.intents()
                ));
            }
        }
        return result.intents();
    }

    public SessionSnapshot snapshot() {
        synchronized (stateLock) {
            return current;
        }
    }

    public SessionState state() {
        return snapshot().state();
    }
}
