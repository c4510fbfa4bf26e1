package com.questrail.helixd.observability;

import java.time.Instant;

/**
 * Record representing an error that was contained by the daemon.
 */
public record DaemonErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
