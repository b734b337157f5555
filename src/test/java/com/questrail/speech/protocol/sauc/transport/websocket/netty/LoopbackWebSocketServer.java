package com.questrail.speech.protocol.sauc.transport.websocket.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Minimal WebSocket server on 127.0.0.1 for transport tests.
 *
 * <p>Every binary message received is recorded and passed to a responder,
 * whose replies are written back as binary messages.</p>
 */
public final class LoopbackWebSocketServer implements AutoCloseable {

    private static final String PATH = "/asr";
    private static final int MAX_FRAME = 1 << 20;

    private final EventLoopGroup boss = new NioEventLoopGroup(1);
    private final EventLoopGroup worker = new NioEventLoopGroup(1);
    private final Function<byte[], List<byte[]>> responder;
    private final BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
    private final CountDownLatch handshakeDone = new CountDownLatch(1);
    private final Channel serverChannel;

    private volatile HttpHeaders handshakeHeaders;
    private volatile Channel client;

    public LoopbackWebSocketServer(Function<byte[], List<byte[]>> responder) throws InterruptedException {
        this.responder = responder;
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(65536),
                                new WebSocketServerProtocolHandler(PATH, null, false, MAX_FRAME),
                                new ServerHandler());
                    }
                });
        this.serverChannel = bootstrap.bind(new InetSocketAddress("127.0.0.1", 0)).sync().channel();
    }

    public URI uri() {
        int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        return URI.create("ws://127.0.0.1:" + port + PATH);
    }

    /** Next binary message received from the client, or null on timeout. */
    public byte[] nextReceived(long timeoutMillis) throws InterruptedException {
        return received.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public HttpHeaders awaitHandshakeHeaders(long timeoutMillis) throws InterruptedException {
        if (!handshakeDone.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
            throw new AssertionError("no WebSocket handshake within " + timeoutMillis + " ms");
        }
        return handshakeHeaders;
    }

    /** Close the connected client with a normal close frame. */
    public void closeClient() {
        Channel ch = client;
        if (ch != null) {
            ch.writeAndFlush(new CloseWebSocketFrame(1000, "bye")).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void close() throws InterruptedException {
        serverChannel.close().sync();
        boss.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
        worker.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    private final class ServerHandler extends SimpleChannelInboundHandler<BinaryWebSocketFrame> {

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete complete) {
                handshakeHeaders = complete.requestHeaders();
                client = ctx.channel();
                handshakeDone.countDown();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, BinaryWebSocketFrame frame) {
            ByteBuf content = frame.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            received.offer(bytes);

            for (byte[] reply : responder.apply(bytes)) {
                ctx.writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(reply)));
            }
        }
    }
}
