package com.questrail.helixd.queue;

import com.questrail.helixd.internal.time.Cancellable;
import com.questrail.helixd.internal.time.MonotonicClock;
import com.questrail.helixd.internal.time.MonotonicScheduler;
import com.questrail.helixd.internal.time.WallClock;
import com.questrail.helixd.observability.DaemonErrorEvent;
import com.questrail.helixd.observability.DaemonObservabilitySink;
import com.questrail.helixd.observability.JobTransitionEvent;
import com.questrail.helixd.observability.NullObservabilitySink;
import com.questrail.helixd.protocol.model.SyncState;
import com.questrail.helixd.protocol.model.SyncStats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * SyncQueue
 * =============================================================================
 * Admission-controlled, in-memory job table keyed by {@link QueueKey}.
 *
 * <h2>Admission</h2>
 * At most one job per key is <em>current</em>. While the current job is
 * {@code QUEUED} or {@code RUNNING}, a non-forced {@link #enqueue} returns it
 * instead of starting new work, so concurrent callers collapse onto a single
 * execution. A forced enqueue, or any enqueue after the current job finished,
 * admits a new job and supersedes the previous one.
 *
 * <h2>Supersession</h2>
 * A superseded job leaves both the key table and the sync id table. Waiters
 * that already hold it are still released when it finishes; new lookups by its
 * id behave as if the id were unknown.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>All table reads and writes happen under a single monitor</li>
 *   <li>{@link SyncExecutor#execute} runs on the supplied worker executor</li>
 *   <li>Waiters are futures; no thread is parked while waiting</li>
 *   <li>Wait timeouts are armed on the {@link MonotonicScheduler}; an expired
 *       waiter is detached from its job, so polling a job that never finishes
 *       does not accumulate state</li>
 *   <li>Futures and observability callbacks are completed outside the monitor</li>
 * </ul>
 */
public final class SyncQueue {

    private final SyncExecutor syncExecutor;
    private final Executor workers;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final DaemonObservabilitySink observabilitySink;
    private final Supplier<String> syncIdGenerator;

    private final Object lock = new Object();
    private final Map<QueueKey, JobRecord> currentByKey = new LinkedHashMap<>();
    private final Map<String, JobRecord> jobsById = new HashMap<>();

    /**
     * Creates a queue.
     *
     * @param syncExecutor      performs the sync work
     * @param workers           runs {@code syncExecutor} off the caller's thread
     * @param clock             monotonic clock for ages and timeouts
     * @param wallClock         wall clock for admission timestamps and events
     * @param scheduler         arms wait timeouts
     * @param observabilitySink receives job transitions; {@code null} for none
     * @param syncIdGenerator   produces unique sync ids
     */
    public SyncQueue(SyncExecutor syncExecutor,
                     Executor workers,
                     MonotonicClock clock,
                     WallClock wallClock,
                     MonotonicScheduler scheduler,
                     DaemonObservabilitySink observabilitySink,
                     Supplier<String> syncIdGenerator)
    {
        this.syncExecutor = Objects.requireNonNull(syncExecutor, "syncExecutor");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.syncIdGenerator = Objects.requireNonNull(syncIdGenerator, "syncIdGenerator");
    }

    public SyncQueue(SyncExecutor syncExecutor,
                     Executor workers,
                     MonotonicClock clock,
                     WallClock wallClock,
                     MonotonicScheduler scheduler,
                     DaemonObservabilitySink observabilitySink)
    {
        this(syncExecutor, workers, clock, wallClock, scheduler, observabilitySink,
                () -> UUID.randomUUID().toString());
    }

    /**
     * Admit a sync for {@code (repoRoot, tool, directory)}.
     *
     * <p>Returns as soon as the admission decision is made; the work itself is
     * handed to the worker executor.</p>
     */
    public EnqueueResult enqueue(String repoRoot, String tool, String directory, boolean force) {
        final QueueKey key = new QueueKey(repoRoot, tool, directory);
        final JobRecord admitted;
        final SyncJob snapshot;

        synchronized (lock) {
            JobRecord current = currentByKey.get(key);
            if (current != null && current.state.isActive() && !force) {
                return new EnqueueResult(current.snapshot(), false);
            }

            admitted = new JobRecord(syncIdGenerator.get(), key, clock.nowNanos(), wallClock.now());
            if (current != null) {
                jobsById.remove(current.syncId);
            }
            currentByKey.put(key, admitted);
            jobsById.put(admitted.syncId, admitted);
            snapshot = admitted.snapshot();
        }

        publishTransition(admitted, null, SyncState.QUEUED, null);
        dispatch(admitted);
        return new EnqueueResult(snapshot, true);
    }

    /**
     * Non-blocking point read.
     */
    public Optional<SyncJob> get(String syncId) {
        Objects.requireNonNull(syncId, "syncId");
        synchronized (lock) {
            JobRecord record = jobsById.get(syncId);
            return record == null ? Optional.empty() : Optional.of(record.snapshot());
        }
    }

    /**
     * Wait for the named job to become terminal.
     *
     * <p>The returned future completes with the final snapshot when the job
     * finishes, or with {@link Optional#empty()} once {@code timeout} elapses,
     * whichever comes first. Unknown and superseded ids complete empty
     * immediately; already terminal jobs complete immediately.</p>
     */
    public CompletableFuture<Optional<SyncJob>> await(String syncId, Duration timeout) {
        Objects.requireNonNull(syncId, "syncId");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }

        final JobRecord record;
        final Waiter waiter = new Waiter();
        synchronized (lock) {
            record = jobsById.get(syncId);
            if (record == null) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            if (record.state.isTerminal()) {
                return CompletableFuture.completedFuture(Optional.of(record.snapshot()));
            }
            record.waiters.add(waiter);
        }

        waiter.arm(scheduler.scheduleAfter(timeout, clock, () -> expire(record, waiter)));
        return waiter.result;
    }

    /**
     * Number of callers currently parked on {@code syncId}.
     */
    int waiterCount(String syncId) {
        synchronized (lock) {
            JobRecord record = jobsById.get(syncId);
            return record == null ? 0 : record.waiters.size();
        }
    }

    /**
     * One entry per key ever enqueued, in first-enqueue order, describing that
     * key's most recent job.
     */
    public List<QueueSummary> listQueues() {
        synchronized (lock) {
            long now = clock.nowNanos();
            List<QueueSummary> summaries = new ArrayList<>(currentByKey.size());
            for (JobRecord record : currentByKey.values()) {
                summaries.add(new QueueSummary(
                        record.key,
                        record.syncId,
                        record.state,
                        Duration.ofNanos(Math.max(0, now - record.queuedAtNanos))));
            }
            return summaries;
        }
    }

    // -------------------------------------------------------------------------
    // Execution
    // -------------------------------------------------------------------------

    private void dispatch(JobRecord record) {
        try {
            workers.execute(() -> run(record));
        } catch (RejectedExecutionException e) {
            observabilitySink.onError(new DaemonErrorEvent(
                    wallClock.now(),
                    "Sync worker pool rejected " + record.syncId,
                    e));
            markTerminal(record, SyncState.FAILED, null, "Sync worker pool rejected job");
        }
    }

    private void run(JobRecord record) {
        if (!markRunning(record)) {
            return;
        }

        long startedNanos = clock.nowNanos();
        try {
            SyncStats stats = syncExecutor.execute(record.key);
            if (stats == null) {
                stats = SyncStats.ofDuration(elapsedMillis(startedNanos));
            }
            markTerminal(record, SyncState.SUCCEEDED, stats, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markTerminal(record, SyncState.FAILED, null, "Sync interrupted");
        } catch (Exception e) {
            markTerminal(record, SyncState.FAILED, null, describe(e));
        } catch (Error e) {
            markTerminal(record, SyncState.FAILED, null, describe(e));
            throw e;
        }
    }

    private boolean markRunning(JobRecord record) {
        synchronized (lock) {
            if (record.state != SyncState.QUEUED) {
                return false;
            }
            record.state = SyncState.RUNNING;
        }
        publishTransition(record, SyncState.QUEUED, SyncState.RUNNING, null);
        return true;
    }

    /**
     * Move a job to its terminal state and release every waiter.
     * Later calls for the same job are ignored.
     */
    private void markTerminal(JobRecord record, SyncState terminal, SyncStats stats, String error) {
        final SyncState previous;
        final SyncJob snapshot;
        final List<Waiter> released;

        synchronized (lock) {
            if (record.state.isTerminal()) {
                return;
            }
            previous = record.state;
            record.state = terminal;
            record.stats = stats;
            record.error = error;
            snapshot = record.snapshot();
            released = new ArrayList<>(record.waiters);
            record.waiters.clear();
        }

        publishTransition(record, previous, terminal, error);
        for (Waiter waiter : released) {
            waiter.release(snapshot);
        }
    }

    private void expire(JobRecord record, Waiter waiter) {
        synchronized (lock) {
            record.waiters.remove(waiter);
        }
        waiter.result.complete(Optional.empty());
    }

    private void publishTransition(JobRecord record, SyncState from, SyncState to, String detail) {
        observabilitySink.onJobTransition(new JobTransitionEvent(
                wallClock.now(), record.syncId, record.key, from, to, detail));
    }

    private long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, clock.nowNanos() - startedNanos));
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    /**
     * Mutable job state, guarded by the queue monitor.
     */
    private static final class JobRecord {
        private final String syncId;
        private final QueueKey key;
        private final long queuedAtNanos;
        private final Instant queuedAt;
        private final List<Waiter> waiters = new ArrayList<>();

        private SyncState state = SyncState.QUEUED;
        private SyncStats stats;
        private String error;

        private JobRecord(String syncId, QueueKey key, long queuedAtNanos, Instant queuedAt) {
            this.syncId = Objects.requireNonNull(syncId, "syncId");
            this.key = key;
            this.queuedAtNanos = queuedAtNanos;
            this.queuedAt = queuedAt;
        }

        private SyncJob snapshot() {
            return new SyncJob(syncId, key, state, queuedAtNanos, queuedAt, stats, error);
        }
    }

    /**
     * One pending {@link #await} call. Whichever of release or timeout happens
     * first completes {@code result}; the timer is cancelled on release.
     */
    private static final class Waiter {
        private final CompletableFuture<Optional<SyncJob>> result = new CompletableFuture<>();
        private volatile Cancellable timer;

        private void arm(Cancellable timer) {
            this.timer = timer;
            if (result.isDone()) {
                timer.cancel();
            }
        }

        private void release(SyncJob job) {
            result.complete(Optional.of(job));
            Cancellable armed = timer;
            if (armed != null) {
                armed.cancel();
            }
        }
    }
}
