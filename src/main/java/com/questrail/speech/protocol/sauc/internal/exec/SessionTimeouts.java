package com.questrail.speech.protocol.sauc.internal.exec;

import com.questrail.speech.protocol.sauc.internal.events.SessionEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionTimeoutEvent;
import com.questrail.speech.protocol.sauc.internal.time.TimeoutScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * SessionTimeouts
 * =============================================================================
 * Arms and cancels the single active session timeout. Delays elapse on the
 * {@link TimeoutScheduler}; the {@link Clock} only stamps the expiry event.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>At most one timeout is armed; arming cancels the previous one.</li>
 *   <li>On expiry a {@link SessionTimeoutEvent.TimeoutExpired} is submitted;
 *       the reducer alone decides what it means.</li>
 *   <li>A task whose arm generation was superseded does nothing.</li>
 * </ul>
 */
public final class SessionTimeouts
{
    private final TimeoutScheduler scheduler;
    private final Clock clock;
    private final SaucTimingPolicy timingPolicy;
    private final Consumer<SessionEvent> eventSink;

    private final AtomicLong generation = new AtomicLong();
    private volatile TimeoutScheduler.TimeoutHandle armed;

    public SessionTimeouts(TimeoutScheduler scheduler,
                           Clock clock,
                           SaucTimingPolicy timingPolicy,
                           Consumer<SessionEvent> eventSink)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
    }

    public Duration durationOf(SessionTimeoutEvent.Kind kind) {
        switch (kind) {
            case CONNECT:
                return timingPolicy.connectTimeout();
            case ACK:
                return timingPolicy.ackTimeout();
            case FINAL_ACK:
                return timingPolicy.finalAckTimeout();
            default:
                throw new IllegalArgumentException("unknown timeout kind " + kind);
        }
    }

    public synchronized void arm(SessionTimeoutEvent.Kind kind) {
        Objects.requireNonNull(kind, "kind");
        cancel();

        long armedGeneration = generation.get();
        armed = scheduler.schedule(durationOf(kind), () -> {
            if (generation.get() != armedGeneration) {
                return;
            }
            eventSink.accept(new SessionTimeoutEvent.TimeoutExpired(clock.instant(), kind));
        });
    }

    public synchronized void cancel() {
        generation.incrementAndGet();
        TimeoutScheduler.TimeoutHandle prior = armed;
        if (prior != null) {
            prior.cancel();
            armed = null;
        }
    }
}
