/**
 * In-memory sync job table with per-key admission control.
 *
 * <p>{@link com.questrail.helixd.queue.SyncQueue} is the only mutable state
 * shared between connections. It is created by the runtime and injected into
 * the dispatcher; there is no global instance.</p>
 */
package com.questrail.helixd.queue;
