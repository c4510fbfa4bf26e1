package com.questrail.helixd.runtime;

import com.questrail.helixd.config.DaemonConfig;
import com.questrail.helixd.dispatch.CommandDispatcher;
import com.questrail.helixd.exec.ProcessSyncExecutor;
import com.questrail.helixd.internal.lifecycle.ShutdownSignal;
import com.questrail.helixd.internal.time.MonotonicClock;
import com.questrail.helixd.internal.time.MonotonicScheduler;
import com.questrail.helixd.internal.time.ScheduledExecutorScheduler;
import com.questrail.helixd.internal.time.SystemMonotonicClock;
import com.questrail.helixd.internal.time.SystemWallClock;
import com.questrail.helixd.internal.time.WallClock;
import com.questrail.helixd.observability.DaemonObservabilitySink;
import com.questrail.helixd.observability.NullObservabilitySink;
import com.questrail.helixd.protocol.HelixProtocol;
import com.questrail.helixd.protocol.codec.impl.JsonRequestDecoder;
import com.questrail.helixd.protocol.codec.impl.JsonResponseEncoder;
import com.questrail.helixd.queue.SyncExecutor;
import com.questrail.helixd.queue.SyncQueue;
import com.questrail.helixd.server.HelixDaemonServer;
import com.questrail.helixd.server.RequestPipeline;
import com.questrail.helixd.transport.LineEndpoint;
import com.questrail.helixd.transport.netty.NettyDomainSocketEndpoint;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HelixDaemonRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one daemon instance.
 *
 * <p>Owns the sync queue, the shutdown signal, the timer and worker pools and
 * the listening server. Everything is created by {@link Builder#build()}; no
 * state is shared between runtime instances.</p>
 */
public final class HelixDaemonRuntime implements AutoCloseable {
    private final HelixDaemonServer server;
    private final SyncQueue queue;
    private final ShutdownSignal shutdownSignal;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService syncWorkers;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    private HelixDaemonRuntime(
            HelixDaemonServer server,
            SyncQueue queue,
            ShutdownSignal shutdownSignal,
            ScheduledExecutorService timerExecutor,
            ExecutorService syncWorkers) {
        this.server = server;
        this.queue = queue;
        this.shutdownSignal = shutdownSignal;
        this.timerExecutor = timerExecutor;
        this.syncWorkers = syncWorkers;
    }

    /**
     * Bind the socket and begin serving.
     *
     * @throws com.questrail.helixd.server.DaemonStartupException if binding fails
     */
    public void start() {
        server.start();
    }

    /**
     * Block until a shutdown is requested, then stop accepting connections and
     * remove the socket file.
     */
    public void awaitShutdown() throws InterruptedException {
        server.awaitShutdown();
    }

    /**
     * Request shutdown. Idempotent; the first reason wins.
     */
    public boolean shutdown(String reason) {
        return shutdownSignal.trigger(reason);
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public Path socketPath() {
        return server.socketPath();
    }

    public SyncQueue queue() {
        return queue;
    }

    public ShutdownSignal shutdownSignal() {
        return shutdownSignal;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            shutdownSignal.trigger("closed");
            server.close();
            terminate(syncWorkers);
            terminate(timerExecutor);
        } finally {
            closedLatch.countDown();
        }
    }

    private static void terminate(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DaemonConfig config = DaemonConfig.defaults();
        private SyncExecutor syncExecutor;
        private DaemonObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private String daemonVersion = HelixProtocol.daemonVersion();
        private LineEndpoint endpoint;

        public Builder withConfig(DaemonConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSyncExecutor(SyncExecutor syncExecutor) {
            this.syncExecutor = syncExecutor;
            return this;
        }

        public Builder withObservabilitySink(DaemonObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withDaemonVersion(String daemonVersion) {
            this.daemonVersion = daemonVersion;
            return this;
        }

        /**
         * Replaces the Unix domain socket transport, mainly for tests.
         */
        public Builder withEndpoint(LineEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public HelixDaemonRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(daemonVersion, "daemonVersion");

            // 1. Clocks and timers
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService timerExec =
                    Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("helixd-timer"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(timerExec, clock);

            // 2. Job table and its workers
            ExecutorService workers =
                    Executors.newFixedThreadPool(config.syncWorkers(), namedDaemonThreads("helixd-sync"));
            SyncExecutor executor = syncExecutor != null
                    ? syncExecutor
                    : new ProcessSyncExecutor(config.syncCommand(), clock);
            SyncQueue queue = new SyncQueue(executor, workers, clock, wallClock, scheduler, observabilitySink);

            // 3. Command handling
            ShutdownSignal signal = new ShutdownSignal();
            CommandDispatcher dispatcher =
                    new CommandDispatcher(queue, signal, clock, wallClock, daemonVersion, observabilitySink);
            RequestPipeline pipeline = new RequestPipeline(
                    new JsonRequestDecoder(),
                    new JsonResponseEncoder(),
                    dispatcher,
                    wallClock,
                    observabilitySink);

            // 4. Transport and server
            LineEndpoint lineEndpoint = endpoint != null
                    ? endpoint
                    : new NettyDomainSocketEndpoint(config.socketPath(), config.ioThreads(), HelixProtocol.MAX_MESSAGE_SIZE);
            HelixDaemonServer server = new HelixDaemonServer(
                    config.socketPath(), lineEndpoint, pipeline, signal, wallClock, observabilitySink);

            return new HelixDaemonRuntime(server, queue, signal, timerExec, workers);
        }

        private static ThreadFactory namedDaemonThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
