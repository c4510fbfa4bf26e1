package com.questrail.helixd.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for job ages, daemon uptime and wait deadlines.
 *
 * <h2>Binding invariant</h2>
 * All elapsed-time logic in the daemon MUST use a monotonic time source.
 * Wall-clock time is permitted only for observability and for the
 * {@code queued_at_ms} value reported to clients.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
