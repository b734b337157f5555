package com.questrail.speech.protocol.sauc.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link TimeoutScheduler} backed by a {@link ScheduledExecutorService},
 * whose delays elapse on {@link System#nanoTime()}.
 *
 * <p>The executor is not owned: whoever created it shuts it down.</p>
 */
public final class ExecutorTimeoutScheduler implements TimeoutScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorTimeoutScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public TimeoutHandle schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0: " + delay);
        }

        ScheduledFuture<?> future = executor.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);

        // never interrupt a timeout handler that is already running
        return () -> future.cancel(false);
    }
}
