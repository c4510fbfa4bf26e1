package com.questrail.helixd.queue;

import com.questrail.helixd.protocol.model.SyncStats;

/**
 * SyncExecutor
 * -----------------------------------------------------------------------------
 * Collaborator that performs the actual sync work for one queue key.
 *
 * <p>The queue invokes {@link #execute(QueueKey)} on one of its worker
 * threads, never on the thread that called {@code enqueue}. Returning normally
 * marks the job {@code SUCCEEDED}; throwing marks it {@code FAILED} with the
 * exception message. Each invocation therefore reports exactly one terminal
 * outcome.</p>
 *
 * <p>Implementations own no queue state and may be invoked concurrently for
 * different keys, and for the same key when a forced sync supersedes one in
 * flight.</p>
 */
@FunctionalInterface
public interface SyncExecutor
{
    /**
     * Perform the sync.
     *
     * @param key repository root, calling tool and directory to sync
     * @return completion statistics; {@code null} is treated as "no counters"
     * @throws Exception any failure; the job becomes {@code FAILED}
     */
    SyncStats execute(QueueKey key) throws Exception;
}
