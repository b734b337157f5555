package com.questrail.speech.protocol.sauc.observability;

import com.questrail.speech.protocol.sauc.internal.events.SessionEvent;
import com.questrail.speech.protocol.sauc.internal.state.SessionIntents;
import com.questrail.speech.protocol.sauc.internal.state.SessionSnapshot;

import java.time.Instant;

/**
 * Record representing one reducer step of a session.
 */
public record StateTransitionEvent(
    Instant timestamp,
    SessionSnapshot oldState,
    SessionSnapshot newState,
    SessionEvent triggeringEvent,
    SessionIntents resultingIntents
) {
    /**
     * Checks if the lifecycle state changed during this step.
     */
    public boolean isLifecycleChange() {
        return oldState.state() != newState.state();
    }
}
