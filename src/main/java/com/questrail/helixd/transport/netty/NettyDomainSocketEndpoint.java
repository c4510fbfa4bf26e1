package com.questrail.helixd.transport.netty;

import com.questrail.helixd.transport.LineEndpoint;
import com.questrail.helixd.transport.LineEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * NettyDomainSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineEndpoint} port over a Unix
 * domain socket (native epoll transport).
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames lines
 * and moves bytes. It MUST NOT decode JSON, interpret commands, or create or
 * delete the socket path beyond what binding requires.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound lines are copied into {@code byte[]};
 * reference-counted buffers are released internally.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>One acceptor event loop owns the listening channel</li>
 *   <li>A bounded group of I/O event loops multiplexes all connections</li>
 *   <li>Per connection, replies are chained: line N+1 is handed to the listener
 *       only after reply N has been written</li>
 *   <li>Half-closure is allowed: after the peer shuts down its output, a final
 *       line without {@code \n} is still served and the connection closes once
 *       all replies are written</li>
 * </ul>
 */
public final class NettyDomainSocketEndpoint implements LineEndpoint
{
    private final Path socketPath;
    private final int ioThreads;
    private final int maxLineLength;

    private final AtomicLong connectionIds = new AtomicLong();
    private final AtomicBoolean accepting = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile LineEndpointListener listener;
    private volatile EventLoopGroup acceptGroup;
    private volatile EventLoopGroup ioGroup;
    private volatile Channel serverChannel;

    /**
     * @param socketPath    filesystem path to bind; the parent must exist
     * @param ioThreads     number of I/O event loops; {@code 0} for Netty's default
     * @param maxLineLength longest accepted line, excluding the delimiter
     */
    public NettyDomainSocketEndpoint(Path socketPath, int ioThreads, int maxLineLength)
    {
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
        if (ioThreads < 0) {
            throw new IllegalArgumentException("ioThreads must be >= 0");
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be > 0");
        }
        this.ioThreads = ioThreads;
        this.maxLineLength = maxLineLength;
    }

    /**
     * Whether the native transport needed for Unix domain sockets is usable
     * on this platform.
     */
    public static boolean isSupported()
    {
        return Epoll.isAvailable();
    }

    @Override
    public void setListener(LineEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() throws IOException
    {
        requireListener();
        if (!Epoll.isAvailable()) {
            throw new IOException("Unix domain sockets require the native epoll transport",
                    Epoll.unavailabilityCause());
        }

        acceptGroup = new EpollEventLoopGroup(1, new DefaultThreadFactory("helixd-accept"));
        ioGroup = new EpollEventLoopGroup(ioThreads, new DefaultThreadFactory("helixd-io"));

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(acceptGroup, ioGroup)
                .channel(EpollServerDomainSocketChannel.class)
                .handler(new AcceptErrorHandler())
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("framer", new TrailingLineFrameDecoder(maxLineLength));
                        p.addLast("session", new ConnectionHandler(connectionIds.incrementAndGet()));
                    }
                });

        ChannelFuture bound = bootstrap.bind(new DomainSocketAddress(socketPath.toFile())).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            releaseGroups();
            throw new IOException("Failed to bind " + socketPath, bound.cause());
        }

        serverChannel = bound.channel();
        accepting.set(true);
    }

    @Override
    public void stopAccepting()
    {
        if (accepting.compareAndSet(true, false)) {
            Channel ch = serverChannel;
            if (ch != null) {
                ch.close().awaitUninterruptibly();
            }
        }
    }

    @Override
    public void stop()
    {
        if (stopped.compareAndSet(false, true)) {
            stopAccepting();
            releaseGroups();
        }
    }

    private void releaseGroups()
    {
        EventLoopGroup accept = acceptGroup;
        EventLoopGroup io = ioGroup;
        if (accept != null) {
            accept.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
        if (io != null) {
            io.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
    }

    private LineEndpointListener requireListener()
    {
        LineEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * Reports accept failures and keeps the listening channel open.
     */
    private final class AcceptErrorHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            requireListener().onAcceptError(cause);
        }
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * Owns one connection. All handler callbacks run on the connection's event
     * loop, so {@code tail} is only touched from that thread.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final long connectionId;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private ConnectionHandler(long connectionId)
        {
            this.connectionId = connectionId;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            requireListener().onConnectionOpened(connectionId);
            super.channelActive(ctx);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            requireListener().onConnectionClosed(connectionId);
            super.channelInactive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            byte[] line = ByteBufUtil.getBytes(frame);
            respondInOrder(ctx, () -> requireListener().onLine(connectionId, line));
        }

        /**
         * The peer finished sending. The framer has already delivered any
         * unterminated final line, so close once every pending reply is out.
         */
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof ChannelInputShutdownEvent) {
                tail.whenComplete((ignored, failure) -> ctx.close());
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                respondInOrder(ctx, () -> CompletableFuture.completedFuture(
                        requireListener().onOversizedLine(connectionId)));
                return;
            }
            requireListener().onConnectionError(connectionId, cause);
            ctx.close();
        }

        private void respondInOrder(ChannelHandlerContext ctx, Supplier<CompletableFuture<byte[]>> exchange)
        {
            tail = tail
                    .thenCompose(ignored -> exchange.get())
                    .thenCompose(reply -> write(ctx, reply))
                    .exceptionally(failure -> {
                        if (ctx.channel().isActive()) {
                            requireListener().onConnectionError(connectionId, unwrap(failure));
                            ctx.close();
                        }
                        return null;
                    });
        }

        private CompletableFuture<Void> write(ChannelHandlerContext ctx, byte[] reply)
        {
            CompletableFuture<Void> written = new CompletableFuture<>();
            ctx.writeAndFlush(Unpooled.wrappedBuffer(reply)).addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    written.complete(null);
                }
                else {
                    written.completeExceptionally(f.cause());
                }
            });
            return written;
        }
    }

    private static Throwable unwrap(Throwable failure)
    {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }
}
