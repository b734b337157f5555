package com.questrail.speech.protocol.sauc.runtime;

import com.questrail.speech.api.SessionOutcome;
import com.questrail.speech.protocol.sauc.codec.impl.DefaultSaucFrameDecoder;
import com.questrail.speech.protocol.sauc.config.SaucConnectionConfig;
import com.questrail.speech.protocol.sauc.model.MessageType;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.observability.Slf4jStreamingObservabilitySink;
import com.questrail.speech.protocol.sauc.transport.ServiceFrames;
import com.questrail.speech.protocol.sauc.transport.websocket.netty.LoopbackWebSocketServer;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end session over a real WebSocket on 127.0.0.1.
 */
final class StreamingEngineLoopbackTest {

    @Test
    void streamsAudioOverWebSocketAndClosesOnFinalResponse() throws Exception {
        DefaultSaucFrameDecoder decoder = new DefaultSaucFrameDecoder();
        List<Integer> serverSequences = new ArrayList<>();

        try (LoopbackWebSocketServer server = new LoopbackWebSocketServer(bytes -> {
            SaucFrame frame = decoder.decode(bytes).value();
            synchronized (serverSequences) {
                serverSequences.add(frame.sequenceNumber());
            }
            if (frame.messageType() == MessageType.FULL_REQUEST) {
                return List.of(ServiceFrames.ack());
            }
            if (frame.lastPacket()) {
                return List.of(ServiceFrames.result(frame.sequenceNumber(), "over the wire", true, true));
            }
            return List.of();
        })) {
            RecordingListener listener = new RecordingListener();
            StreamingEngine engine = StreamingEngine.builder()
                    .withConnectionConfig(SaucConnectionConfig.builder()
                            .withEndpoint(server.uri())
                            .withAppKey("app")
                            .withAccessKey("token")
                            .withResourceId("resource")
                            .build())
                    .withListener(listener)
                    .withObservabilitySink(new Slf4jStreamingObservabilitySink())
                    .build();

            engine.start();
            engine.audioInput().offer(new byte[6400]);
            engine.audioInput().offer(new byte[3200]);
            engine.stop();

            SessionOutcome outcome = engine.awaitOutcome(Duration.ofSeconds(10)).orElseThrow();
            assertTrue(outcome.success(), outcome::toString);
            assertEquals("over the wire", outcome.transcript());
            synchronized (serverSequences) {
                assertEquals(List.of(1, 2, 3, -4), serverSequences);
            }
            engine.close();
        }
    }
}
