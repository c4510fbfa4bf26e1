package com.questrail.helixd.observability;

import java.time.Instant;

/**
 * Record representing a client connection opening or closing.
 */
public record ConnectionEvent(
    Instant timestamp,
    long connectionId,
    Kind kind
) {
    public enum Kind {
        OPENED,
        CLOSED
    }
}
