package com.questrail.helixd.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler used to arm wait timeouts.
 *
 * Note: These tests use real time. Tolerances are generous to avoid false
 * failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long before = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Task should execute");
        assertTrue(System.nanoTime() - before >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(
                Duration.ofMillis(100), SystemMonotonicClock.INSTANCE, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(200);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        // the future may still be finishing after the task body ran
        Thread.sleep(20);
        assertFalse(handle.cancel(), "Cancel after execution should return false");
    }

    @Test
    void multipleTasksExecuteInDeadlineOrder() throws InterruptedException {
        AtomicInteger counter = new AtomicInteger(0);
        CountDownLatch latch = new CountDownLatch(3);
        int[] executionOrder = new int[3];

        long now = SystemMonotonicClock.INSTANCE.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> {
            executionOrder[2] = counter.incrementAndGet();
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> {
            executionOrder[1] = counter.incrementAndGet();
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> {
            executionOrder[0] = counter.incrementAndGet();
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertArrayEquals(new int[] {1, 2, 3}, executionOrder);
    }

    @Test
    void unboundedDelayIsArmedAndCancellable() {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(
                Duration.ofMillis(Long.MAX_VALUE), SystemMonotonicClock.INSTANCE, () -> executed.set(true));

        assertTrue(handle.cancel());
        assertFalse(executed.get());
    }

    @Test
    void deadlineArithmeticSaturates() {
        assertEquals(Long.MAX_VALUE, MonotonicScheduler.deadlineAfter(0, Duration.ofSeconds(Long.MAX_VALUE)));
        assertEquals(Long.MAX_VALUE, MonotonicScheduler.deadlineAfter(Long.MAX_VALUE - 5, Duration.ofNanos(6)));
        assertEquals(-5, MonotonicScheduler.deadlineAfter(-10, Duration.ofNanos(5)));
    }

    @Test
    void delayToDistantDeadlineSaturates() {
        ScheduledExecutorScheduler negativeNow = new ScheduledExecutorScheduler(executor, () -> -10L);

        assertEquals(Long.MAX_VALUE, negativeNow.delayUntil(Long.MAX_VALUE));
        assertEquals(0, new ScheduledExecutorScheduler(executor, () -> 10L).delayUntil(Long.MIN_VALUE));
        assertEquals(15, negativeNow.delayUntil(5));
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
