package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the {@code status} response: the most recent job for a queue key.
 */
public record QueueStatus(
        @JsonProperty("repo_root") String repoRoot,
        @JsonProperty("tool") String tool,
        @JsonProperty("directory") String directory,
        @JsonProperty("sync_id") String syncId,
        @JsonProperty("state") SyncState state,
        @JsonProperty("age_ms") long ageMs
) {
}
