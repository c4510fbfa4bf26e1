package com.questrail.helixd.queue;

import com.questrail.helixd.protocol.model.SyncState;
import com.questrail.helixd.protocol.model.SyncStats;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable point-in-time view of a sync job.
 *
 * <p>{@code queuedAtNanos} is a monotonic tick used for ages; {@code queuedAt}
 * is the wall-clock admission time reported to clients.</p>
 */
public record SyncJob(
        String syncId,
        QueueKey key,
        SyncState state,
        long queuedAtNanos,
        Instant queuedAt,
        SyncStats stats,
        String error
) {
    public SyncJob {
        Objects.requireNonNull(syncId, "syncId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(queuedAt, "queuedAt");
    }

    public long queuedAtMs() {
        return queuedAt.toEpochMilli();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
