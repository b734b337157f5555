package com.questrail.speech.protocol.sauc.transport.websocket.netty;

import com.questrail.speech.protocol.sauc.config.SaucConnectionConfig;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;
import com.questrail.speech.protocol.sauc.transport.FrameTransport;
import com.questrail.speech.protocol.sauc.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.*;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link FrameTransport} port over a
 * {@code ws://} or {@code wss://} WebSocket.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * SAUC frames, interpret payloads, or schedule protocol timeouts.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound binary messages are copied into
 * {@code byte[]} and queued for the single reader; all reference-counted
 * buffers are released internally.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [SslHandler] → HttpClientCodec → HttpObjectAggregator → [IdleStateHandler]
 *     → WebSocketFrameAggregator → ClientHandler
 * </pre>
 * Fragmented messages are reassembled. A ping is written whenever the
 * connection has been write-idle for the configured ping interval. Text
 * frames are ignored; the protocol is binary only.
 *
 * <h2>Lifecycle</h2>
 * - {@link #open(Duration)} connects and completes the upgrade handshake.
 * - {@link #close()} sends a close frame, closes the channel and shuts down the
 *   event loop group. An instance cannot be reopened.
 */
public final class NettyWebSocketTransport implements FrameTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    /** Queued after the last inbound message once the connection is gone. */
    private static final byte[] END_OF_STREAM = new byte[0];

    private final SaucConnectionConfig config;
    private final Duration sendTimeout;
    private final EventLoopGroup group;

    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile String closeDetail = "connection closed";

    public NettyWebSocketTransport(SaucConnectionConfig config, Duration sendTimeout)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public void open(Duration timeout) throws TransportException, InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (closed.get() || channel != null) {
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED, "transport cannot be reopened");
        }

        URI uri = config.endpoint();
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (config.secure() ? 443 : 80);
        SslContext ssl = config.secure() ? clientSslContext() : null;

        HttpHeaders headers = new DefaultHttpHeaders();
        config.handshakeHeaders().forEach(headers::add);

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, headers, config.maxFramePayloadBytes());
        ClientHandler handler = new ClientHandler(handshaker);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        if (!config.pingInterval().isZero()) {
                            p.addLast(new IdleStateHandler(0, config.pingInterval().toMillis(), 0, TimeUnit.MILLISECONDS));
                        }
                        p.addLast(new WebSocketFrameAggregator(config.maxFramePayloadBytes()));
                        p.addLast(handler);
                    }
                });

        long deadline = System.nanoTime() + timeout.toNanos();

        ChannelFuture connect = bootstrap.connect(host, port);
        if (!connect.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            connect.cancel(false);
            close();
            throw new TransportException(ProtocolErrorReason.CONNECT_TIMEOUT,
                    "connect to " + host + ":" + port + " timed out");
        }
        if (!connect.isSuccess()) {
            close();
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED,
                    "connect to " + host + ":" + port + " failed", connect.cause());
        }
        channel = connect.channel();

        ChannelFuture handshake = handler.handshakeFuture();
        long remaining = Math.max(0, deadline - System.nanoTime());
        if (!handshake.await(remaining, TimeUnit.NANOSECONDS)) {
            close();
            throw new TransportException(ProtocolErrorReason.CONNECT_TIMEOUT, "WebSocket handshake timed out");
        }
        if (!handshake.isSuccess()) {
            close();
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED,
                    "WebSocket handshake failed", handshake.cause());
        }
        log.debug("WebSocket open: {}", uri);
    }

    @Override
    public void send(byte[] frame) throws TransportException, InterruptedException
    {
        Objects.requireNonNull(frame, "frame");

        Channel ch = channel;
        if (ch == null || closed.get() || !ch.isActive()) {
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED, "send on a closed transport");
        }

        ChannelFuture write = ch.writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(frame)));
        if (!write.await(sendTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED,
                    "send did not complete within " + sendTimeout.toMillis() + " ms");
        }
        if (!write.isSuccess()) {
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED, "send failed", write.cause());
        }
    }

    @Override
    public Optional<byte[]> receive(Duration timeout) throws TransportException, InterruptedException
    {
        byte[] next = inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (next == END_OF_STREAM) {
            // leave the marker for any later receive
            inbound.offer(END_OF_STREAM);
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED, closeDetail);
        }
        return Optional.ofNullable(next);
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return ch != null && ch.isActive() && !closed.get();
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                    .addListener(ChannelFutureListener.CLOSE);
        }
        markEndOfStream("closed locally");
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        log.debug("WebSocket closed locally: {}", config.endpoint());
    }

    private void markEndOfStream(String detail)
    {
        if (!inbound.contains(END_OF_STREAM)) {
            closeDetail = detail;
            inbound.offer(END_OF_STREAM);
        }
    }

    private static SslContext clientSslContext() throws TransportException
    {
        try {
            return SslContextBuilder.forClient().build();
        }
        catch (SSLException e) {
            throw new TransportException(ProtocolErrorReason.TRANSPORT_CLOSED, "TLS setup failed", e);
        }
    }

    /**
     * ClientHandler
     * -------------------------------------------------------------------------
     * Completes the upgrade handshake, then forwards binary messages to the
     * inbound queue and answers pings.
     */
    private final class ClientHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;
        private ChannelPromise handshakeFuture;

        ClientHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        ChannelFuture handshakeFuture()
        {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx)
        {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            if (!handshaker.isHandshakeComplete()) {
                try {
                    handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                    handshakeFuture.setSuccess();
                }
                catch (WebSocketHandshakeException e) {
                    handshakeFuture.setFailure(e);
                }
                return;
            }

            if (msg instanceof BinaryWebSocketFrame frame) {
                // Copy the payload into a plain byte[] (Netty containment rule).
                ByteBuf content = frame.content();
                byte[] bytes = new byte[content.readableBytes()];
                content.getBytes(content.readerIndex(), bytes);
                inbound.offer(bytes);
            }
            else if (msg instanceof PingWebSocketFrame ping) {
                ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            }
            else if (msg instanceof CloseWebSocketFrame close) {
                log.debug("WebSocket close received: {} {}", close.statusCode(), close.reasonText());
                markEndOfStream("closed by peer: " + close.statusCode() + " " + close.reasonText());
                ctx.close();
            }
            else if (msg instanceof TextWebSocketFrame text) {
                log.debug("Ignoring text frame of {} chars", text.text().length());
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(new PingWebSocketFrame());
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(new WebSocketHandshakeException("connection closed during handshake"));
            }
            markEndOfStream("connection closed");
            log.debug("WebSocket inactive: {}", config.endpoint());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            markEndOfStream("transport error: " + cause.getMessage());
            ctx.close();
        }
    }
}
