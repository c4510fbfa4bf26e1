package com.questrail.helixd.queue;

import java.util.Objects;

/**
 * Unit of deduplication: two enqueue requests with equal keys refer to the
 * same logical sync.
 */
public record QueueKey(String repoRoot, String tool, String directory) {
    public QueueKey {
        Objects.requireNonNull(repoRoot, "repoRoot");
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(directory, "directory");
    }
}
