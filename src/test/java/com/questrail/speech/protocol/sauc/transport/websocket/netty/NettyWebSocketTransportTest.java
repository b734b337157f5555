package com.questrail.speech.protocol.sauc.transport.websocket.netty;

import com.questrail.speech.protocol.sauc.config.SaucConnectionConfig;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;
import com.questrail.speech.protocol.sauc.transport.TransportException;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback integration tests for {@link NettyWebSocketTransport} against a
 * Netty WebSocket server on 127.0.0.1.
 */
final class NettyWebSocketTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private LoopbackWebSocketServer server;
    private NettyWebSocketTransport transport;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (transport != null) {
            transport.close();
        }
        if (server != null) {
            server.close();
        }
    }

    @Test
    void exchangesBinaryMessagesAfterHandshakeWithHeaders() throws Exception {
        server = new LoopbackWebSocketServer(bytes -> List.of(reversed(bytes)));
        transport = new NettyWebSocketTransport(config(server.uri()), TIMEOUT);

        transport.open(TIMEOUT);
        assertTrue(transport.isOpen());

        HttpHeaders headers = server.awaitHandshakeHeaders(TIMEOUT.toMillis());
        assertEquals("resource-1", headers.get(SaucConnectionConfig.HEADER_RESOURCE_ID));
        assertEquals("connect-1", headers.get(SaucConnectionConfig.HEADER_CONNECT_ID));

        transport.send(new byte[] {1, 2, 3});

        assertArrayEquals(new byte[] {1, 2, 3}, server.nextReceived(TIMEOUT.toMillis()));
        Optional<byte[]> reply = transport.receive(TIMEOUT);
        assertArrayEquals(new byte[] {3, 2, 1}, reply.orElseThrow());
    }

    @Test
    void receiveTimesOutQuietlyWhenNothingArrives() throws Exception {
        server = new LoopbackWebSocketServer(bytes -> List.of());
        transport = new NettyWebSocketTransport(config(server.uri()), TIMEOUT);
        transport.open(TIMEOUT);

        assertTrue(transport.receive(Duration.ofMillis(50)).isEmpty());
    }

    @Test
    void peerCloseSurfacesAsTransportClosed() throws Exception {
        server = new LoopbackWebSocketServer(bytes -> List.of());
        transport = new NettyWebSocketTransport(config(server.uri()), TIMEOUT);
        transport.open(TIMEOUT);
        server.awaitHandshakeHeaders(TIMEOUT.toMillis());

        server.closeClient();

        TransportException e = assertThrows(TransportException.class, () -> transport.receive(TIMEOUT));
        assertEquals(ProtocolErrorReason.TRANSPORT_CLOSED, e.reason());
        // every later read reports the same
        assertThrows(TransportException.class, () -> transport.receive(Duration.ofMillis(10)));
    }

    @Test
    void connectionRefusedFailsOpen() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        transport = new NettyWebSocketTransport(config(URI.create("ws://127.0.0.1:" + unusedPort + "/asr")), TIMEOUT);

        TransportException e = assertThrows(TransportException.class, () -> transport.open(TIMEOUT));
        assertEquals(ProtocolErrorReason.TRANSPORT_CLOSED, e.reason());
        assertFalse(transport.isOpen());
    }

    @Test
    void sendAfterLocalCloseFails() throws Exception {
        server = new LoopbackWebSocketServer(bytes -> List.of());
        transport = new NettyWebSocketTransport(config(server.uri()), TIMEOUT);
        transport.open(TIMEOUT);

        transport.close();
        transport.close();

        assertFalse(transport.isOpen());
        assertThrows(TransportException.class, () -> transport.send(new byte[] {1}));
        assertThrows(TransportException.class, () -> transport.receive(Duration.ofMillis(10)));
        assertThrows(TransportException.class, () -> transport.open(TIMEOUT));
    }

    private static SaucConnectionConfig config(URI endpoint) {
        return SaucConnectionConfig.builder()
                .withEndpoint(endpoint)
                .withAppKey("app")
                .withAccessKey("token")
                .withResourceId("resource-1")
                .withConnectId("connect-1")
                .build();
    }

    private static byte[] reversed(byte[] bytes) {
        byte[] out = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            out[i] = bytes[bytes.length - 1 - i];
        }
        return out;
    }
}
