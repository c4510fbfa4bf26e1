package com.questrail.helixd.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for observability timestamps and the
 * {@code queued_at_ms} value reported to clients.
 *
 * <p>This clock may jump due to NTP adjustments or explicit time setting.
 * It MUST NOT be used for ages, uptime or timeouts.</p>
 */
public interface WallClock
{
    Instant now();
}
