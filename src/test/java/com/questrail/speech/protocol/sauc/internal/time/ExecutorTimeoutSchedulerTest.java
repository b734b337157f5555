package com.questrail.speech.protocol.sauc.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutorTimeoutSchedulerTest {

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorTimeoutScheduler scheduler = new ExecutorTimeoutScheduler(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void zeroDelayRunsPromptly() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule(Duration.ZERO, ran::countDown);

        assertTrue(ran.await(1, TimeUnit.SECONDS));
    }

    @Test
    void cancelledTimeoutDoesNotRun() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        TimeoutScheduler.TimeoutHandle handle = scheduler.schedule(Duration.ofMillis(200), () -> ran.set(true));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        Thread.sleep(300);
        assertFalse(ran.get());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.schedule(Duration.ofMillis(-1), () -> { }));
    }
}
