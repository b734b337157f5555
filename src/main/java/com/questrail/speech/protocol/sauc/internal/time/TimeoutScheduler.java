package com.questrail.speech.protocol.sauc.internal.time;

import java.time.Duration;

/**
 * TimeoutScheduler
 * =============================================================================
 * Arms the one-shot connect, acceptance and final-acknowledgement timeouts of
 * a session.
 *
 * <p>Delays are relative and elapse on a monotonic source, so wall-clock
 * adjustments never move a deadline. Tests substitute a scheduler whose time
 * only advances on request.</p>
 */
public interface TimeoutScheduler
{
    /**
     * Run {@code task} once {@code delay} has elapsed. A zero delay runs it as
     * soon as possible.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    TimeoutHandle schedule(Duration delay, Runnable task);

    /**
     * Disarms one scheduled timeout.
     */
    interface TimeoutHandle
    {
        /**
         * @return {@code true} if the task was disarmed before it started
         */
        boolean cancel();
    }
}
