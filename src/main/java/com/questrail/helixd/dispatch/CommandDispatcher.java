package com.questrail.helixd.dispatch;

import com.questrail.helixd.internal.lifecycle.ShutdownSignal;
import com.questrail.helixd.internal.time.MonotonicClock;
import com.questrail.helixd.internal.time.WallClock;
import com.questrail.helixd.observability.DaemonErrorEvent;
import com.questrail.helixd.observability.DaemonObservabilitySink;
import com.questrail.helixd.observability.LifecycleEvent;
import com.questrail.helixd.observability.NullObservabilitySink;
import com.questrail.helixd.protocol.model.Command;
import com.questrail.helixd.protocol.model.ErrorCode;
import com.questrail.helixd.protocol.model.QueueStatus;
import com.questrail.helixd.protocol.model.Request;
import com.questrail.helixd.protocol.model.Response;
import com.questrail.helixd.protocol.model.ResponsePayload;
import com.questrail.helixd.queue.EnqueueResult;
import com.questrail.helixd.queue.QueueSummary;
import com.questrail.helixd.queue.SyncJob;
import com.questrail.helixd.queue.SyncQueue;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * CommandDispatcher
 * =============================================================================
 * Maps a decoded, version-checked {@link Request} onto exactly one
 * {@link SyncQueue} operation and builds the response.
 *
 * <pre>
 *   ping          → daemon version, no queue access
 *   enqueue_sync  → SyncQueue.enqueue
 *   wait_sync     → SyncQueue.await, TIMEOUT error when it resolves empty
 *   status        → SyncQueue.listQueues + uptime
 *   shutdown      → ShutdownSignal.trigger, answered immediately
 * </pre>
 *
 * <p>Only {@code wait_sync} completes asynchronously. The returned future never
 * completes exceptionally: unexpected failures become {@code INTERNAL_ERROR}
 * responses on the caller's correlation id.</p>
 */
public final class CommandDispatcher {

    private final SyncQueue queue;
    private final ShutdownSignal shutdownSignal;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final String daemonVersion;
    private final DaemonObservabilitySink observabilitySink;
    private final long startedAtNanos;

    public CommandDispatcher(SyncQueue queue,
                             ShutdownSignal shutdownSignal,
                             MonotonicClock clock,
                             WallClock wallClock,
                             String daemonVersion,
                             DaemonObservabilitySink observabilitySink)
    {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.daemonVersion = Objects.requireNonNull(daemonVersion, "daemonVersion");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.startedAtNanos = clock.nowNanos();
    }

    public CompletableFuture<Response> dispatch(Request request) {
        Objects.requireNonNull(request, "request");
        try {
            Command command = request.command();
            if (command instanceof Command.WaitSync waitSync) {
                return waitSync(request, waitSync)
                        .exceptionally(failure -> internalError(request, failure));
            }
            return CompletableFuture.completedFuture(handleImmediate(request, command));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(internalError(request, e));
        }
    }

    private Response handleImmediate(Request request, Command command) {
        if (command instanceof Command.Ping) {
            return Response.ok(request.id(), new ResponsePayload.Ping(daemonVersion));
        }
        if (command instanceof Command.EnqueueSync enqueue) {
            EnqueueResult result = queue.enqueue(request.repoRoot(), request.tool(), enqueue.directory(), enqueue.force());
            return Response.ok(request.id(), new ResponsePayload.EnqueueSync(
                    result.syncId(),
                    result.job().queuedAtMs(),
                    result.isNew()));
        }
        if (command instanceof Command.Status) {
            List<QueueStatus> queues = queue.listQueues().stream()
                    .map(CommandDispatcher::toQueueStatus)
                    .toList();
            return Response.ok(request.id(), new ResponsePayload.Status(queues, uptimeMillis()));
        }
        if (command instanceof Command.Shutdown shutdown) {
            observabilitySink.onLifecycleEvent(new LifecycleEvent(
                    wallClock.now(), LifecycleEvent.Kind.SHUTDOWN_REQUESTED, shutdown.reason()));
            shutdownSignal.trigger(shutdown.reason());
            return Response.ok(request.id(), new ResponsePayload.Shutdown());
        }
        throw new IllegalStateException("Unhandled command " + command.getClass().getSimpleName());
    }

    private CompletableFuture<Response> waitSync(Request request, Command.WaitSync command) {
        String syncId = command.syncId();
        return queue.await(syncId, Duration.ofMillis(command.timeoutMs()))
                .thenApply(resolved -> toWaitResponse(request, syncId, resolved));
    }

    private static Response toWaitResponse(Request request, String syncId, Optional<SyncJob> resolved) {
        if (resolved.isEmpty()) {
            return Response.error(request.id(), ErrorCode.TIMEOUT, "Timeout waiting for sync " + syncId);
        }
        SyncJob job = resolved.get();
        return Response.ok(request.id(), new ResponsePayload.WaitSync(
                job.syncId(), job.state(), job.stats(), job.error()));
    }

    private Response internalError(Request request, Throwable failure) {
        observabilitySink.onError(new DaemonErrorEvent(
                wallClock.now(),
                "Failed to handle " + request.command().getClass().getSimpleName() + " request " + request.id(),
                failure));
        String detail = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        return Response.error(request.id(), ErrorCode.INTERNAL_ERROR, "Internal error: " + detail);
    }

    private long uptimeMillis() {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, clock.nowNanos() - startedAtNanos));
    }

    private static QueueStatus toQueueStatus(QueueSummary summary) {
        return new QueueStatus(
                summary.key().repoRoot(),
                summary.key().tool(),
                summary.key().directory(),
                summary.syncId(),
                summary.state(),
                summary.age().toMillis());
    }
}
