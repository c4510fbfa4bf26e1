package com.questrail.helixd.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the supplied {@link MonotonicClock}. The same clock instance must be
 * used by callers computing deadlines.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the provided executor. The
 * daemon runtime shuts it down on close.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may execute slightly after their deadline, but never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        ScheduledFuture<?> future = executor.schedule(task, delayUntil(deadlineNanos), TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    /**
     * Relative delay to a deadline. Past deadlines yield zero and distances
     * beyond {@code long} range yield {@link Long#MAX_VALUE}.
     */
    long delayUntil(long deadlineNanos) {
        try {
            return Math.max(0, Math.subtractExact(deadlineNanos, clock.nowNanos()));
        } catch (ArithmeticException e) {
            return deadlineNanos > 0 ? Long.MAX_VALUE : 0;
        }
    }
}
