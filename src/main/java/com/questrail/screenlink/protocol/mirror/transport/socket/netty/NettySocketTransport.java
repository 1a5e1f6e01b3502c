package com.questrail.screenlink.protocol.mirror.transport.socket.netty;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.api.TransportKind;
import com.questrail.screenlink.protocol.mirror.config.TransportConfig;
import com.questrail.screenlink.protocol.mirror.transport.Transport;
import com.questrail.screenlink.protocol.mirror.transport.TransportException;
import com.questrail.screenlink.protocol.mirror.transport.socket.SocketTarget;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettySocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link Transport} port over TCP.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * frames, decrypt payloads or retry connects.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound buffers are copied into {@code byte[]} on the event loop and
 * handed to the blocking {@link #receive()} through a queue. All
 * reference-counted buffers are released internally.</p>
 *
 * <h2>Backpressure</h2>
 * Auto-read is off. At most one socket read is outstanding, and one is only
 * requested while fewer than {@value #INBOUND_CHUNKS} chunks of at most
 * {@code receiveBufferSize} bytes wait in the queue. A slow reader therefore
 * leaves excess bytes in the kernel and TCP flow control throttles the peer.
 * The queue keeps one slot beyond that bound for the end-of-stream marker.
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect(String)} resolves and connects, honouring
 *   {@code CONNECT_TIMEOUT_MILLIS}.
 * - {@link #close()} cancels a pending connect, closes the channel, wakes any
 *   blocked reader and shuts down the event loop group.
 */
public final class NettySocketTransport implements Transport
{
    /** Terminal marker placed on the inbound queue once the channel is gone. */
    private static final byte[] END_OF_STREAM = new byte[0];

    /** Received chunks that may wait for {@link #receive()}. */
    static final int INBOUND_CHUNKS = 16;

    private final TransportConfig config;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final BlockingQueue<byte[]> inbound = new ArrayBlockingQueue<>(INBOUND_CHUNKS + 1);
    private final AtomicBoolean endQueued = new AtomicBoolean();
    private final AtomicBoolean readPending = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile ChannelFuture connectFuture;
    private volatile Channel channel;
    private volatile Throwable failure;

    /**
     * Each transport owns a single-threaded {@link NioEventLoopGroup}; a
     * session holds at most one transport, so the group lives exactly as long
     * as the link.
     */
    public NettySocketTransport(TransportConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");

        final int maxChunk = config.receiveBufferSize();
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Math.min(Integer.MAX_VALUE, config.socketConnectTimeout().toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR,
                        new AdaptiveRecvByteBufAllocator(Math.min(64, maxChunk), Math.min(2048, maxChunk), maxChunk))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.WIFI_SOCKET;
    }

    @Override
    public void connect(String target) throws TransportException
    {
        if (closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport closed");
        }

        final SocketTarget parsed;
        try {
            parsed = SocketTarget.parse(target, config.socketPort());
        }
        catch (IllegalArgumentException e) {
            throw new TransportException(ErrorKind.IO_ERROR, e.getMessage(), e);
        }

        ChannelFuture f = bootstrap.connect(InetSocketAddress.createUnresolved(parsed.host(), parsed.port()));
        connectFuture = f;
        if (closed.get()) {
            f.cancel(false);
        }

        try {
            f.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(false);
            throw new TransportException(ErrorKind.IO_ERROR, "interrupted while connecting to " + parsed, e);
        }

        if (f.isSuccess()) {
            channel = f.channel();
            if (closed.get()) {
                // close() ran between completion and publication of the channel.
                channel.close();
                throw new TransportException(ErrorKind.IO_ERROR, "transport closed during connect");
            }
            return;
        }

        if (f.isCancelled() || closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport closed during connect");
        }
        throw classifyConnectFailure(f.cause(), parsed);
    }

    @Override
    public void send(byte[] data) throws TransportException
    {
        Objects.requireNonNull(data, "data");

        Channel ch = channel;
        if (ch == null || closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport not connected");
        }

        ChannelFuture wf = ch.writeAndFlush(Unpooled.wrappedBuffer(data));
        try {
            wf.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(ErrorKind.IO_ERROR, "interrupted while sending", e);
        }

        if (!wf.isSuccess()) {
            throw new TransportException(ErrorKind.IO_ERROR, "send failed: " + describe(wf.cause()), wf.cause());
        }
    }

    @Override
    public byte[] receive() throws TransportException
    {
        final byte[] chunk;
        try {
            chunk = inbound.take();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(ErrorKind.IO_ERROR, "interrupted while receiving", e);
        }

        if (chunk != END_OF_STREAM) {
            requestRead(channel);
            return chunk;
        }

        // Keep the terminal marker visible to any later call.
        inbound.offer(END_OF_STREAM);

        if (closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport closed");
        }
        Throwable cause = failure;
        if (cause != null) {
            throw new TransportException(ErrorKind.IO_ERROR, "connection failed: " + describe(cause), cause);
        }
        throw new TransportException(ErrorKind.PEER_CLOSED, "peer closed the connection");
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        ChannelFuture f = connectFuture;
        if (f != null) {
            f.cancel(false);
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        signalEndOfStream();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /** Chunks currently waiting for {@link #receive()}, the end marker included. */
    int bufferedChunks()
    {
        return inbound.size();
    }

    /**
     * Asks the channel for one more read if none is outstanding and the queue
     * has room for its chunk.
     */
    private void requestRead(Channel ch)
    {
        if (ch == null || endQueued.get() || inbound.size() >= INBOUND_CHUNKS) {
            return;
        }
        if (readPending.compareAndSet(false, true)) {
            ch.read();
        }
    }

    private void signalEndOfStream()
    {
        if (endQueued.compareAndSet(false, true)) {
            inbound.offer(END_OF_STREAM);
        }
    }

    static TransportException classifyConnectFailure(Throwable cause, SocketTarget target)
    {
        // Netty's ConnectTimeoutException is itself a ConnectException; test it first.
        if (cause instanceof ConnectTimeoutException || cause instanceof SocketTimeoutException) {
            return new TransportException(ErrorKind.CONNECT_TIMEOUT, "connect to " + target + " timed out", cause);
        }
        if (cause instanceof ConnectException) {
            return new TransportException(ErrorKind.CONNECT_REFUSED,
                    "connect to " + target + " refused: " + describe(cause), cause);
        }
        return new TransportException(ErrorKind.IO_ERROR,
                "connect to " + target + " failed: " + describe(cause), cause);
    }

    private static String describe(Throwable t)
    {
        if (t == null) {
            return "unknown cause";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received stream bytes onto the inbound queue, requests the next
     * read while there is room, and records how the channel ended.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            int n = content.readableBytes();
            if (n > 0) {
                // Copy the payload into a plain byte[] (Netty containment rule).
                byte[] bytes = new byte[n];
                content.getBytes(content.readerIndex(), bytes);
                if (!inbound.offer(bytes)) {
                    failure = new IllegalStateException("inbound queue overflow");
                    ctx.close();
                    return;
                }
            }

            // Cleared only after the chunk is queued, so a new read always sees it counted.
            readPending.set(false);
            requestRead(ctx.channel());
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            ctx.fireChannelActive();
            requestRead(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            signalEndOfStream();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure = cause;
            ctx.close();
        }
    }
}
