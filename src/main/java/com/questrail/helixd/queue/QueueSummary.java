package com.questrail.helixd.queue;

import com.questrail.helixd.protocol.model.SyncState;

import java.time.Duration;

/**
 * Most recent job of one queue key, as listed by {@link SyncQueue#listQueues()}.
 */
public record QueueSummary(QueueKey key, String syncId, SyncState state, Duration age) {
}
