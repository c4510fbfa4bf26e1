package com.questrail.helixd.transport;

import java.io.IOException;

/**
 * LineEndpoint
 * -----------------------------------------------------------------------------
 * Port for a connection-oriented, line-delimited local transport.
 *
 * <p>The endpoint accepts any number of connections, splits each inbound byte
 * stream into lines, hands every line to its {@link LineEndpointListener} and
 * writes the listener's replies back on the same connection in arrival
 * order. When a peer stops sending, any trailing bytes without a delimiter are
 * delivered as a final line.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface LineEndpoint
{
    /**
     * Register the listener that handles lines and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(LineEndpointListener listener);

    /**
     * Bind and begin accepting connections.
     *
     * @throws IOException if the endpoint cannot be bound
     */
    void start() throws IOException;

    /**
     * Stop accepting new connections. Connections that are already open keep
     * being served until their peer disconnects. Idempotent.
     */
    void stopAccepting();

    /**
     * Release all transport resources, closing any remaining connections.
     * Idempotent.
     */
    void stop();
}
