package com.questrail.helixd.observability;

import com.questrail.helixd.protocol.model.SyncState;
import com.questrail.helixd.queue.QueueKey;

import java.time.Instant;

/**
 * Record representing a sync job state change.
 *
 * <p>{@code from} is {@code null} when the job has just been admitted.
 * {@code detail} carries the failure message for {@code FAILED} transitions.</p>
 */
public record JobTransitionEvent(
    Instant timestamp,
    String syncId,
    QueueKey key,
    SyncState from,
    SyncState to,
    String detail
) {
    public boolean isAdmission() {
        return from == null;
    }
}
