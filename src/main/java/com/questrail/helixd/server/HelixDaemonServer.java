package com.questrail.helixd.server;

import com.questrail.helixd.internal.lifecycle.ShutdownSignal;
import com.questrail.helixd.internal.time.WallClock;
import com.questrail.helixd.observability.DaemonErrorEvent;
import com.questrail.helixd.observability.DaemonObservabilitySink;
import com.questrail.helixd.observability.LifecycleEvent;
import com.questrail.helixd.observability.NullObservabilitySink;
import com.questrail.helixd.transport.LineEndpoint;
import com.questrail.helixd.transport.LineEndpointListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HelixDaemonServer
 * =============================================================================
 * Owns the lifecycle of the daemon's listening endpoint.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start()          prepare path → bind → LISTENING
 *   awaitShutdown()  block on ShutdownSignal → stop accepting → remove path → STOPPED
 *   close()          release transport resources (closes open connections)
 * </pre>
 *
 * <p>Connections that are already open when the signal fires are left to end
 * on their own; only {@link #close()} tears them down.</p>
 */
public final class HelixDaemonServer implements AutoCloseable
{
    private final Path socketPath;
    private final LineEndpoint endpoint;
    private final LineEndpointListener listener;
    private final ShutdownSignal shutdownSignal;
    private final WallClock wallClock;
    private final DaemonObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean drained = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HelixDaemonServer(Path socketPath,
                             LineEndpoint endpoint,
                             LineEndpointListener listener,
                             ShutdownSignal shutdownSignal,
                             WallClock wallClock,
                             DaemonObservabilitySink observabilitySink)
    {
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Prepare the socket path and begin accepting connections.
     *
     * @throws DaemonStartupException if the path cannot be prepared or bound
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }

        try {
            SocketPaths.prepare(socketPath);
        }
        catch (IOException e) {
            throw new DaemonStartupException("Cannot prepare socket path " + socketPath, e);
        }

        endpoint.setListener(listener);
        try {
            endpoint.start();
        }
        catch (IOException e) {
            endpoint.stop();
            throw new DaemonStartupException("Cannot listen on " + socketPath, e);
        }

        observabilitySink.onLifecycleEvent(new LifecycleEvent(
                wallClock.now(), LifecycleEvent.Kind.LISTENING, socketPath.toString()));
    }

    /**
     * Block until the shutdown signal fires, then stop accepting and remove the
     * socket file.
     */
    public void awaitShutdown() throws InterruptedException
    {
        String reason = shutdownSignal.await();
        drain(reason);
    }

    /**
     * {@link #start()} followed by {@link #awaitShutdown()}.
     */
    public void run() throws InterruptedException
    {
        start();
        awaitShutdown();
    }

    public Path socketPath()
    {
        return socketPath;
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        drain(shutdownSignal.reason().orElse("closed"));
        endpoint.stop();
    }

    private void drain(String reason)
    {
        if (!drained.compareAndSet(false, true)) {
            return;
        }

        endpoint.stopAccepting();
        try {
            SocketPaths.remove(socketPath);
        }
        catch (IOException e) {
            observabilitySink.onError(new DaemonErrorEvent(
                    wallClock.now(), "Cannot remove socket file " + socketPath, e));
        }

        observabilitySink.onLifecycleEvent(new LifecycleEvent(
                wallClock.now(), LifecycleEvent.Kind.STOPPED, reason));
    }
}
