package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters reported by a sync executor when a job completes successfully.
 */
public record SyncStats(
        @JsonProperty("documents_scanned") long documentsScanned,
        @JsonProperty("documents_changed") long documentsChanged,
        @JsonProperty("documents_removed") long documentsRemoved,
        @JsonProperty("duration_ms") long durationMs
) {
    public static SyncStats ofDuration(long durationMs) {
        return new SyncStats(0, 0, 0, durationMs);
    }

    public SyncStats withDurationMs(long durationMs) {
        return new SyncStats(documentsScanned, documentsChanged, documentsRemoved, durationMs);
    }
}
