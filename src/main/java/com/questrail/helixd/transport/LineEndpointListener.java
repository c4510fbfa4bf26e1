package com.questrail.helixd.transport;

import java.util.concurrent.CompletableFuture;

/**
 * LineEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link LineEndpoint}.
 *
 * <p>Each connection is identified by a process-unique {@code connectionId}.
 * For a given connection, {@link #onLine} is not invoked for the next line
 * until the reply to the previous one has been written.</p>
 */
public interface LineEndpointListener
{
    void onConnectionOpened(long connectionId);

    void onConnectionClosed(long connectionId);

    /**
     * Handle one inbound line, delimiter removed.
     *
     * @return the complete reply line (delimiter included) to write back
     */
    CompletableFuture<byte[]> onLine(long connectionId, byte[] line);

    /**
     * Called instead of {@link #onLine} when a line exceeded the endpoint's
     * maximum length. The oversized content has already been discarded.
     *
     * @return the complete reply line to write back
     */
    byte[] onOversizedLine(long connectionId);

    /**
     * Called when a connection fails. The connection is closed afterwards;
     * other connections are unaffected.
     */
    void onConnectionError(long connectionId, Throwable cause);

    /**
     * Called when accepting a connection fails. The endpoint keeps listening.
     */
    void onAcceptError(Throwable cause);
}
