package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle state of a sync job.
 *
 * <pre>
 *   QUEUED → RUNNING → { SUCCEEDED, FAILED }
 * </pre>
 */
public enum SyncState {
    @JsonProperty("queued")
    QUEUED,

    @JsonProperty("running")
    RUNNING,

    @JsonProperty("succeeded")
    SUCCEEDED,

    @JsonProperty("failed")
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean isActive() {
        return !isTerminal();
    }
}
