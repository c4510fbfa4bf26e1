package com.questrail.helixd.queue;

import java.util.Objects;

/**
 * Outcome of an admission decision.
 *
 * @param job   snapshot of the job the caller should track
 * @param isNew {@code true} when a new job was admitted, {@code false} when
 *              the request collapsed onto an active one
 */
public record EnqueueResult(SyncJob job, boolean isNew) {
    public EnqueueResult {
        Objects.requireNonNull(job, "job");
    }

    public String syncId() {
        return job.syncId();
    }
}
