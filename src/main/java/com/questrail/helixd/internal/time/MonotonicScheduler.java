package com.questrail.helixd.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used to arm {@code wait_sync} timeouts.
 *
 * <h2>Binding invariant</h2>
 * Scheduling MUST be expressed in monotonic ticks or durations, never in
 * wall-clock instants.
 *
 * <h2>Far-future deadlines</h2>
 * Client supplied timeouts may be arbitrarily large. Deadline arithmetic
 * saturates at {@link Long#MAX_VALUE} nanoseconds instead of overflowing, so a
 * huge timeout behaves as "never" rather than as an already elapsed deadline.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task         runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration using a provided monotonic clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(deadlineAfter(clock.nowNanos(), delay), task);
    }

    /**
     * {@code nowNanos + delay}, clamped to {@link Long#MAX_VALUE}.
     */
    static long deadlineAfter(long nowNanos, Duration delay)
    {
        final long delayNanos;
        try {
            delayNanos = delay.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
        long deadline = nowNanos + delayNanos;
        // delay is non-negative, so a wrap can only go below nowNanos
        return deadline < nowNanos ? Long.MAX_VALUE : deadline;
    }
}
