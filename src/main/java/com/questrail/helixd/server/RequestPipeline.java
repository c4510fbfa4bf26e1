package com.questrail.helixd.server;

import com.questrail.helixd.dispatch.CommandDispatcher;
import com.questrail.helixd.internal.time.WallClock;
import com.questrail.helixd.observability.ConnectionEvent;
import com.questrail.helixd.observability.DaemonErrorEvent;
import com.questrail.helixd.observability.DaemonObservabilitySink;
import com.questrail.helixd.observability.NullObservabilitySink;
import com.questrail.helixd.protocol.codec.ProtocolException;
import com.questrail.helixd.protocol.codec.RequestDecoder;
import com.questrail.helixd.protocol.codec.ResponseEncoder;
import com.questrail.helixd.protocol.model.ErrorCode;
import com.questrail.helixd.protocol.model.Request;
import com.questrail.helixd.protocol.model.Response;
import com.questrail.helixd.transport.LineEndpointListener;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * RequestPipeline
 * =============================================================================
 * Connects a {@link com.questrail.helixd.transport.LineEndpoint} to the
 * codec and the {@link CommandDispatcher}.
 *
 * <h2>Inbound Data Flow (Decode-Before-Dispatch)</h2>
 * <pre>
 *   line bytes
 *        → RequestDecoder
 *            → Request
 *                → CommandDispatcher
 *                    → Response
 *                        → ResponseEncoder
 *                            → reply line
 * </pre>
 *
 * <p>Every line yields exactly one reply. Decoding failures become error
 * responses on the same connection; they never close it.</p>
 */
public final class RequestPipeline implements LineEndpointListener {
    private final RequestDecoder decoder;
    private final ResponseEncoder encoder;
    private final CommandDispatcher dispatcher;
    private final WallClock wallClock;
    private final DaemonObservabilitySink observabilitySink;

    public RequestPipeline(RequestDecoder decoder,
                           ResponseEncoder encoder,
                           CommandDispatcher dispatcher,
                           WallClock wallClock,
                           DaemonObservabilitySink observabilitySink) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public CompletableFuture<byte[]> onLine(long connectionId, byte[] line) {
        final Request request;
        try {
            request = decoder.decode(line);
        } catch (ProtocolException e) {
            return CompletableFuture.completedFuture(encoder.encode(e.toResponse()));
        }
        return dispatcher.dispatch(request).thenApply(encoder::encode);
    }

    @Override
    public byte[] onOversizedLine(long connectionId) {
        return encoder.encode(Response.error("", ErrorCode.INVALID_REQUEST, "Message too large"));
    }

    @Override
    public void onConnectionOpened(long connectionId) {
        observabilitySink.onConnectionEvent(
                new ConnectionEvent(wallClock.now(), connectionId, ConnectionEvent.Kind.OPENED));
    }

    @Override
    public void onConnectionClosed(long connectionId) {
        observabilitySink.onConnectionEvent(
                new ConnectionEvent(wallClock.now(), connectionId, ConnectionEvent.Kind.CLOSED));
    }

    @Override
    public void onConnectionError(long connectionId, Throwable cause) {
        observabilitySink.onError(new DaemonErrorEvent(
                wallClock.now(), "Connection " + connectionId + " failed", cause));
    }

    @Override
    public void onAcceptError(Throwable cause) {
        observabilitySink.onError(new DaemonErrorEvent(wallClock.now(), "Accept failed", cause));
    }
}
