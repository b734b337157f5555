package com.questrail.speech.protocol.sauc.runtime;

import com.questrail.speech.api.RecognitionListener;
import com.questrail.speech.api.RecognitionResult;
import com.questrail.speech.api.SessionOutcome;
import com.questrail.speech.api.SessionState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Listener that records every callback in arrival order. State changes are
 * recorded as the state entered.
 */
class RecordingListener implements RecognitionListener {

    private final List<Object> callbacks = new ArrayList<>();
    private final List<SessionState> states = new ArrayList<>();

    @Override
    public synchronized void onResult(RecognitionResult result) {
        callbacks.add(result);
    }

    @Override
    public synchronized void onOutcome(SessionOutcome outcome) {
        callbacks.add(outcome);
    }

    @Override
    public synchronized void onStateChanged(SessionState previous, SessionState current) {
        states.add(current);
        callbacks.add(current);
    }

    synchronized List<Object> callbacks() {
        return new ArrayList<>(callbacks);
    }

    synchronized List<RecognitionResult> results() {
        return callbacks.stream()
                .filter(c -> c instanceof RecognitionResult)
                .map(c -> (RecognitionResult) c)
                .collect(Collectors.toList());
    }

    synchronized List<SessionOutcome> outcomes() {
        return callbacks.stream()
                .filter(c -> c instanceof SessionOutcome)
                .map(c -> (SessionOutcome) c)
                .collect(Collectors.toList());
    }

    synchronized List<SessionState> states() {
        return new ArrayList<>(states);
    }
}
