package com.questrail.helixd.observability;

import java.time.Instant;

/**
 * Record representing a daemon lifecycle milestone.
 */
public record LifecycleEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        LISTENING,
        SHUTDOWN_REQUESTED,
        STOPPED
    }
}
