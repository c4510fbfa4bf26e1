package com.questrail.helixd.queue;

import com.questrail.helixd.observability.DaemonErrorEvent;
import com.questrail.helixd.observability.JobTransitionEvent;
import com.questrail.helixd.observability.RecordingObservabilitySink;
import com.questrail.helixd.protocol.model.SyncState;
import com.questrail.helixd.protocol.model.SyncStats;
import com.questrail.helixd.time.DeterministicScheduler;
import com.questrail.helixd.time.ManualMonotonicClock;
import com.questrail.helixd.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyncQueueTest
 * -----------------------------------------------------------------------------
 * Admission, supersession and waiting, driven by a manual worker executor and
 * a deterministic timeout scheduler so every interleaving is explicit.
 */
class SyncQueueTest {

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private DeterministicScheduler scheduler;
    private ManualExecutor workers;
    private RecordingObservabilitySink sink;
    private AtomicReference<SyncExecutor> behaviour;
    private AtomicInteger ids;
    private SyncQueue queue;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        wallClock = new ManualWallClock();
        scheduler = new DeterministicScheduler(clock);
        workers = new ManualExecutor();
        sink = new RecordingObservabilitySink();
        behaviour = new AtomicReference<>(key -> new SyncStats(3, 1, 0, 12));
        ids = new AtomicInteger();
        queue = new SyncQueue(
                key -> behaviour.get().execute(key),
                workers,
                clock,
                wallClock,
                scheduler,
                sink,
                () -> "sync-" + ids.incrementAndGet());
    }

    @Test
    void firstEnqueueAdmitsQueuedJob() {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);

        assertTrue(result.isNew());
        assertEquals("sync-1", result.syncId());
        assertEquals(SyncState.QUEUED, result.job().state());
        assertEquals(wallClock.now().toEpochMilli(), result.job().queuedAtMs());
        assertEquals(1, workers.pending());
    }

    @Test
    void enqueueWhileActiveReturnsSameJob() {
        EnqueueResult first = queue.enqueue("/repo", "hbd", "docs", false);
        EnqueueResult second = queue.enqueue("/repo", "hbd", "docs", false);

        assertFalse(second.isNew());
        assertEquals(first.syncId(), second.syncId());
        assertEquals(1, workers.pending(), "only one execution is scheduled");

        workers.runNext();
        assertEquals(SyncState.SUCCEEDED, queue.get(first.syncId()).orElseThrow().state());
    }

    @Test
    void enqueueWhileRunningAlsoCollapses() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        behaviour.set(key -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        });
        EnqueueResult first = queue.enqueue("/repo", "hbd", "docs", false);
        Thread worker = new Thread(workers::runNext);
        worker.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(SyncState.RUNNING, queue.get(first.syncId()).orElseThrow().state());
        EnqueueResult second = queue.enqueue("/repo", "hbd", "docs", false);
        assertFalse(second.isNew());
        assertEquals(first.syncId(), second.syncId());

        release.countDown();
        worker.join(5000);
    }

    @Test
    void differentKeysAreIndependent() {
        EnqueueResult docs = queue.enqueue("/repo", "hbd", "docs", false);
        EnqueueResult other = queue.enqueue("/repo", "hbd", "notes", false);
        EnqueueResult otherTool = queue.enqueue("/repo", "ix", "docs", false);
        EnqueueResult otherRepo = queue.enqueue("/other", "hbd", "docs", false);

        Set<String> ids = new HashSet<>(List.of(docs.syncId(), other.syncId(), otherTool.syncId(), otherRepo.syncId()));
        assertEquals(4, ids.size());
        assertEquals(4, workers.pending());
    }

    @Test
    void enqueueAfterCompletionAdmitsNewJob() {
        EnqueueResult first = queue.enqueue("/repo", "hbd", "docs", false);
        workers.runAll();

        EnqueueResult second = queue.enqueue("/repo", "hbd", "docs", false);

        assertTrue(second.isNew());
        assertNotEquals(first.syncId(), second.syncId());
    }

    @Test
    void forceSupersedesActiveJob() {
        EnqueueResult first = queue.enqueue("/repo", "hbd", "docs", false);
        EnqueueResult forced = queue.enqueue("/repo", "hbd", "docs", true);

        assertTrue(forced.isNew());
        assertNotEquals(first.syncId(), forced.syncId());
        assertTrue(queue.get(first.syncId()).isEmpty(), "superseded id is no longer reachable");
        assertEquals(SyncState.QUEUED, queue.get(forced.syncId()).orElseThrow().state());
        assertEquals(2, workers.pending());
    }

    @Test
    void successfulJobCarriesExecutorStats() {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        workers.runNext();

        SyncJob job = queue.get(result.syncId()).orElseThrow();
        assertEquals(SyncState.SUCCEEDED, job.state());
        assertTrue(job.isTerminal());
        assertEquals(new SyncStats(3, 1, 0, 12), job.stats());
        assertNull(job.error());
    }

    @Test
    void nullStatsBecomeDurationOnly() {
        behaviour.set(key -> {
            clock.advanceMillis(25);
            return null;
        });
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        workers.runNext();

        assertEquals(SyncStats.ofDuration(25), queue.get(result.syncId()).orElseThrow().stats());
    }

    @Test
    void executorFailureMarksJobFailed() {
        behaviour.set(key -> {
            throw new IllegalStateException("index locked");
        });
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        workers.runNext();

        SyncJob job = queue.get(result.syncId()).orElseThrow();
        assertEquals(SyncState.FAILED, job.state());
        assertEquals("index locked", job.error());
        assertNull(job.stats());
    }

    @Test
    void transitionsArePublishedInOrder() {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        workers.runNext();

        List<JobTransitionEvent> transitions = sink.getJobTransitions();
        assertEquals(3, transitions.size());
        assertTrue(transitions.get(0).isAdmission());
        assertEquals(SyncState.QUEUED, transitions.get(0).to());
        assertEquals(SyncState.RUNNING, transitions.get(1).to());
        assertEquals(SyncState.SUCCEEDED, transitions.get(2).to());
        transitions.forEach(t -> assertEquals(result.syncId(), t.syncId()));
    }

    @Test
    void rejectedDispatchFailsJob() {
        SyncQueue rejecting = new SyncQueue(
                key -> null,
                task -> { throw new RejectedExecutionException("pool closed"); },
                clock, wallClock, scheduler, sink);

        EnqueueResult result = rejecting.enqueue("/repo", "hbd", "docs", false);

        assertEquals(SyncState.FAILED, rejecting.get(result.syncId()).orElseThrow().state());
        assertTrue(sink.hasEventOfType(DaemonErrorEvent.class));
    }

    @Test
    void awaitCompletesWhenJobFinishes() throws Exception {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        CompletableFuture<Optional<SyncJob>> waiter = queue.await(result.syncId(), Duration.ofSeconds(5));
        assertFalse(waiter.isDone());

        workers.runNext();

        SyncJob job = waiter.get(1, TimeUnit.SECONDS).orElseThrow();
        assertEquals(SyncState.SUCCEEDED, job.state());
        assertEquals(0, scheduler.pendingCount(), "timeout is disarmed on completion");
    }

    @Test
    void awaitTimesOutWithEmptyResult() throws Exception {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        CompletableFuture<Optional<SyncJob>> waiter = queue.await(result.syncId(), Duration.ofMillis(100));

        clock.advanceMillis(99);
        scheduler.runDueTasks();
        assertFalse(waiter.isDone());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertTrue(waiter.get(1, TimeUnit.SECONDS).isEmpty());

        // the job itself is unaffected by the waiter giving up
        assertEquals(SyncState.QUEUED, queue.get(result.syncId()).orElseThrow().state());
    }

    @Test
    void awaitWithUnboundedTimeoutWaitsForCompletion() throws Exception {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        CompletableFuture<Optional<SyncJob>> waiter =
                queue.await(result.syncId(), Duration.ofMillis(Long.MAX_VALUE));

        assertEquals(Long.MAX_VALUE, scheduler.nextDeadlineNanos().orElseThrow(),
                "deadline saturates instead of wrapping into the past");
        clock.advance(Duration.ofDays(365));
        scheduler.runDueTasks();
        assertFalse(waiter.isDone());

        workers.runNext();

        assertEquals(SyncState.SUCCEEDED, waiter.get(1, TimeUnit.SECONDS).orElseThrow().state());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void timeoutSaturatesNearTopOfClockRange() throws Exception {
        ManualMonotonicClock lateClock = new ManualMonotonicClock(Long.MAX_VALUE - 1_000);
        DeterministicScheduler lateScheduler = new DeterministicScheduler(lateClock);
        SyncQueue late = new SyncQueue(key -> null, workers, lateClock, wallClock, lateScheduler, sink);

        EnqueueResult result = late.enqueue("/repo", "hbd", "docs", false);
        CompletableFuture<Optional<SyncJob>> waiter = late.await(result.syncId(), Duration.ofSeconds(1));
        lateScheduler.runDueTasks();

        assertFalse(waiter.isDone(), "a wrapped deadline would have fired at once");
        assertEquals(Long.MAX_VALUE, lateScheduler.nextDeadlineNanos().orElseThrow());
    }

    @Test
    void expiredWaitersAreDetachedFromUnfinishedJob() throws Exception {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);

        for (int poll = 0; poll < 50; poll++) {
            CompletableFuture<Optional<SyncJob>> waiter = queue.await(result.syncId(), Duration.ofMillis(10));
            assertEquals(1, queue.waiterCount(result.syncId()));
            clock.advanceMillis(10);
            scheduler.runDueTasks();
            assertTrue(waiter.get(1, TimeUnit.SECONDS).isEmpty());
        }
        assertEquals(0, queue.waiterCount(result.syncId()));

        CompletableFuture<Optional<SyncJob>> patient = queue.await(result.syncId(), Duration.ofMinutes(1));
        workers.runNext();

        assertEquals(SyncState.SUCCEEDED, patient.get(1, TimeUnit.SECONDS).orElseThrow().state());
        assertEquals(0, queue.waiterCount(result.syncId()));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void awaitOnTerminalJobCompletesImmediately() throws Exception {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        workers.runNext();

        CompletableFuture<Optional<SyncJob>> waiter = queue.await(result.syncId(), Duration.ZERO);

        assertTrue(waiter.isDone());
        assertEquals(SyncState.SUCCEEDED, waiter.get().orElseThrow().state());
    }

    @Test
    void awaitUnknownIdCompletesEmptyImmediately() throws Exception {
        CompletableFuture<Optional<SyncJob>> waiter = queue.await("nope", Duration.ofSeconds(30));

        assertTrue(waiter.isDone());
        assertTrue(waiter.get().isEmpty());
    }

    @Test
    void awaitSupersededIdCompletesEmpty() throws Exception {
        EnqueueResult first = queue.enqueue("/repo", "hbd", "docs", false);
        queue.enqueue("/repo", "hbd", "docs", true);

        assertTrue(queue.await(first.syncId(), Duration.ofSeconds(30)).get().isEmpty());
    }

    @Test
    void waiterHoldingSupersededJobIsStillReleased() throws Exception {
        EnqueueResult first = queue.enqueue("/repo", "hbd", "docs", false);
        CompletableFuture<Optional<SyncJob>> waiter = queue.await(first.syncId(), Duration.ofSeconds(30));

        queue.enqueue("/repo", "hbd", "docs", true);
        workers.runNext();

        SyncJob job = waiter.get(1, TimeUnit.SECONDS).orElseThrow();
        assertEquals(first.syncId(), job.syncId());
        assertEquals(SyncState.SUCCEEDED, job.state());
    }

    @Test
    void allWaitersAreReleased() throws Exception {
        EnqueueResult result = queue.enqueue("/repo", "hbd", "docs", false);
        List<CompletableFuture<Optional<SyncJob>>> waiters = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            waiters.add(queue.await(result.syncId(), Duration.ofSeconds(30)));
        }

        workers.runNext();

        for (CompletableFuture<Optional<SyncJob>> waiter : waiters) {
            assertEquals(SyncState.SUCCEEDED, waiter.get(1, TimeUnit.SECONDS).orElseThrow().state());
        }
    }

    @Test
    void listQueuesReportsLatestJobPerKeyInFirstEnqueueOrder() {
        EnqueueResult docs = queue.enqueue("/repo", "hbd", "docs", false);
        clock.advanceMillis(40);
        queue.enqueue("/repo", "hbd", "notes", false);
        clock.advanceMillis(10);
        EnqueueResult forced = queue.enqueue("/repo", "hbd", "docs", true);

        List<QueueSummary> summaries = queue.listQueues();

        assertEquals(2, summaries.size());
        assertEquals("docs", summaries.get(0).key().directory());
        assertEquals(forced.syncId(), summaries.get(0).syncId());
        assertEquals(Duration.ZERO, summaries.get(0).age());
        assertEquals("notes", summaries.get(1).key().directory());
        assertEquals(Duration.ofMillis(10), summaries.get(1).age());
        assertNotEquals(docs.syncId(), summaries.get(0).syncId());
    }

    @Test
    void listQueuesIsEmptyInitially() {
        assertTrue(queue.listQueues().isEmpty());
    }

    @Test
    void concurrentEnqueuesForOneKeyCollapseOntoOneJob() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<EnqueueResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return queue.enqueue("/repo", "hbd", "docs", false);
                }));
            }
            go.countDown();

            Set<String> syncIds = new HashSet<>();
            int admitted = 0;
            for (Future<EnqueueResult> f : results) {
                EnqueueResult r = f.get(5, TimeUnit.SECONDS);
                syncIds.add(r.syncId());
                if (r.isNew()) {
                    admitted++;
                }
            }

            assertEquals(1, syncIds.size());
            assertEquals(1, admitted);
            assertEquals(1, workers.pending());
        } finally {
            pool.shutdownNow();
        }
    }
}
