package com.questrail.speech.protocol.sauc.runtime;

import com.questrail.speech.api.AudioInput;
import com.questrail.speech.api.InvalidStateException;
import com.questrail.speech.api.RecognitionListener;
import com.questrail.speech.api.RecognitionResult;
import com.questrail.speech.api.SessionOutcome;
import com.questrail.speech.api.SessionState;
import com.questrail.speech.api.StreamingRecognizer;
import com.questrail.speech.protocol.sauc.codec.DecodeResult;
import com.questrail.speech.protocol.sauc.codec.SaucFrameDecoder;
import com.questrail.speech.protocol.sauc.codec.SaucFrameEncoder;
import com.questrail.speech.protocol.sauc.codec.impl.DefaultSaucFrameDecoder;
import com.questrail.speech.protocol.sauc.codec.impl.DefaultSaucFrameEncoder;
import com.questrail.speech.protocol.sauc.config.SaucConnectionConfig;
import com.questrail.speech.protocol.sauc.config.SaucSessionConfig;
import com.questrail.speech.protocol.sauc.internal.audio.AudioCaptureQueue;
import com.questrail.speech.protocol.sauc.internal.audio.AudioSegment;
import com.questrail.speech.protocol.sauc.internal.audio.AudioSegmenter;
import com.questrail.speech.protocol.sauc.internal.audio.SequenceCounter;
import com.questrail.speech.protocol.sauc.internal.decode.InboundMessage;
import com.questrail.speech.protocol.sauc.internal.decode.SaucResponseDecoder;
import com.questrail.speech.protocol.sauc.internal.encode.SaucRequestEncoder;
import com.questrail.speech.protocol.sauc.internal.events.SessionCommandEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionFailureEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionMessageEvent;
import com.questrail.speech.protocol.sauc.internal.events.SessionSendEvent;
import com.questrail.speech.protocol.sauc.internal.exec.SaucTimingPolicy;
import com.questrail.speech.protocol.sauc.internal.exec.SessionTimeouts;
import com.questrail.speech.protocol.sauc.internal.state.SessionIntents;
import com.questrail.speech.protocol.sauc.internal.state.SessionStateMachine;
import com.questrail.speech.protocol.sauc.internal.state.SessionStateReducer;
import com.questrail.speech.protocol.sauc.internal.time.ExecutorTimeoutScheduler;
import com.questrail.speech.protocol.sauc.internal.time.TimeoutScheduler;
import com.questrail.speech.protocol.sauc.model.ProtocolErrorReason;
import com.questrail.speech.protocol.sauc.model.SaucFrame;
import com.questrail.speech.protocol.sauc.observability.ErrorEvent;
import com.questrail.speech.protocol.sauc.observability.NullObservabilitySink;
import com.questrail.speech.protocol.sauc.observability.ProtocolObservabilityEvent;
import com.questrail.speech.protocol.sauc.observability.StreamingObservabilitySink;
import com.questrail.speech.protocol.sauc.observability.TransportObservabilityEvent;
import com.questrail.speech.protocol.sauc.payload.PayloadException;
import com.questrail.speech.protocol.sauc.payload.PayloadTransform;
import com.questrail.speech.protocol.sauc.transport.FrameTransport;
import com.questrail.speech.protocol.sauc.transport.TransportException;
import com.questrail.speech.protocol.sauc.transport.websocket.netty.NettyWebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * StreamingEngine
 * =============================================================================
 * Composition root and lifecycle owner for one streaming recognition session.
 *
 * <h2>Tasks</h2>
 * <ul>
 *   <li><b>producer</b> ({@code sauc-producer}): opens the transport, writes the
 *       initial request, then pulls captured audio, segments it and writes
 *       audio frames, and finally the single terminal frame. It is the only
 *       thread that ever writes to the transport.</li>
 *   <li><b>consumer</b> ({@code sauc-consumer}): reads inbound frames in
 *       arrival order, decodes them and reports them to the state machine.
 *       Frames that fail to decode are reported to the observability sink
 *       and dropped.</li>
 *   <li><b>timer</b>: fires connect, acknowledgement and final-acknowledgement
 *       timeouts.</li>
 * </ul>
 *
 * <h2>Dispatch</h2>
 * Every event goes through {@link #dispatch(SessionEvent)}: the reducer step
 * and the execution of its intents run under one lock, so listener callbacks
 * are serialized and the outcome is always the last of them.
 *
 * <h2>Backpressure</h2>
 * Capture hands audio over through a bounded {@link AudioCaptureQueue}. The
 * producer holds at most one partial segment and blocks on each write, so
 * nothing is buffered without bound ahead of the network.
 */
public final class StreamingEngine implements StreamingRecognizer
{
    private static final Logger log = LoggerFactory.getLogger(StreamingEngine.class);

    private final SaucTimingPolicy timingPolicy;
    private final FrameTransport transport;
    private final SaucFrameEncoder frameEncoder;
    private final SaucFrameDecoder frameDecoder;
    private final SaucRequestEncoder requestEncoder;
    private final SaucResponseDecoder responseDecoder;
    private final SessionStateMachine machine;
    private final SessionTimeouts timeouts;
    private final AudioCaptureQueue captureQueue;
    private final AudioSegmenter segmenter;
    private final SequenceCounter sequence;
    private final RecognitionListener listener;
    private final StreamingObservabilitySink observabilitySink;
    private final Clock clock;
    private final ScheduledExecutorService ownedTimerExecutor;

    private final Object dispatchLock = new Object();
    private final CompletableFuture<SessionOutcome> outcome = new CompletableFuture<>();
    private final CountDownLatch streamingGate = new CountDownLatch(1);

    private volatile boolean tasksStopped;
    private volatile Thread producerThread;
    private volatile Thread consumerThread;

    private StreamingEngine(Builder b, FrameTransport transport, TimeoutScheduler scheduler,
                            ScheduledExecutorService ownedTimerExecutor)
    {
        this.timingPolicy = b.timingPolicy;
        this.transport = transport;
        this.listener = b.listener;
        this.observabilitySink = b.observabilitySink;
        this.clock = b.clock;
        this.ownedTimerExecutor = ownedTimerExecutor;

        this.frameEncoder = new DefaultSaucFrameEncoder();
        this.frameDecoder = new DefaultSaucFrameDecoder();
        this.requestEncoder = new SaucRequestEncoder(b.sessionConfig, b.payloadTransform);
        this.responseDecoder = new SaucResponseDecoder(b.payloadTransform);

        this.machine = new SessionStateMachine(new SessionStateReducer(), clock, observabilitySink);
        this.timeouts = new SessionTimeouts(scheduler, clock, timingPolicy, this::dispatch);

        this.segmenter = new AudioSegmenter(b.sessionConfig.audioFormat(), b.sessionConfig.segmentDurationMs());
        this.sequence = new SequenceCounter();
        this.captureQueue = new AudioCaptureQueue(
                b.sessionConfig.captureQueueCapacity(),
                timingPolicy.captureOfferTimeout(),
                timingPolicy.maxConsecutiveCaptureTimeouts(),
                machine::state,
                this::stop,
                () -> dispatch(new SessionFailureEvent.CaptureStarved(now(), timingPolicy.maxConsecutiveCaptureTimeouts())));
    }

    // ---------------------------------------------------------------------
    // StreamingRecognizer
    // ---------------------------------------------------------------------

    @Override
    public void start() {
        dispatch(new SessionCommandEvent.ConnectRequested(now()));

        Thread t = new Thread(this::runProducer, "sauc-producer");
        producerThread = t;
        t.start();
    }

    @Override
    public AudioInput audioInput() {
        return captureQueue;
    }

    @Override
    public void stop() {
        SessionIntents intents = dispatch(new SessionCommandEvent.FinalizeRequested(now()));
        if (intents.isEmpty()) {
            observabilitySink.onProtocolEvent(ProtocolObservabilityEvent.of(now(),
                    ProtocolObservabilityEvent.Kind.REQUEST_IGNORED, 0, "finalize in " + machine.state()));
        }
    }

    @Override
    public void abort() {
        dispatch(new SessionCommandEvent.CancelRequested(now()));
        interruptUnlessCurrent(producerThread);
        interruptUnlessCurrent(consumerThread);
    }

    @Override
    public SessionState state() {
        return machine.state();
    }

    @Override
    public Optional<SessionOutcome> awaitOutcome(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(outcome.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        }
        catch (TimeoutException e) {
            return Optional.empty();
        }
        catch (ExecutionException e) {
            // the future is only ever completed normally
            throw new IllegalStateException("outcome future failed", e.getCause());
        }
    }

    @Override
    public void close() {
        if (!machine.state().isTerminal()) {
            abort();
        }
    }

    // ---------------------------------------------------------------------
    // Dispatch and intent execution
    // ---------------------------------------------------------------------

    private SessionIntents dispatch(SessionEvent event) {
        synchronized (dispatchLock) {
            SessionState before = machine.state();
            SessionIntents intents = machine.apply(event);
            SessionState after = machine.state();

            if (!intents.isEmpty()) {
                execute(intents);
            }

            // a final transcript reaches the listener before the state it closed
            intents.result().ifPresent(this::emit);
            if (before != after) {
                notifyListener(() -> listener.onStateChanged(before, after));
            }
            intents.outcome().ifPresent(this::report);
            return intents;
        }
    }

    private void execute(SessionIntents intents) {
        if (intents.contains(SessionIntents.Kind.CANCEL_TIMEOUT)) {
            timeouts.cancel();
        }
        intents.timeout().ifPresent(kind -> {
            timeouts.arm(kind);
            observabilitySink.onProtocolEvent(ProtocolObservabilityEvent.of(now(),
                    ProtocolObservabilityEvent.Kind.TIMEOUT_ARMED, sequence.last(),
                    kind + " in " + timeouts.durationOf(kind).toMillis() + " ms"));
        });

        if (intents.contains(SessionIntents.Kind.CLOSE_INPUT)) {
            captureQueue.closeInput();
        }
        if (intents.contains(SessionIntents.Kind.DISCARD_AUDIO)) {
            captureQueue.discard();
        }
        if (intents.contains(SessionIntents.Kind.STOP_TASKS)) {
            tasksStopped = true;
            streamingGate.countDown();
        }
        if (intents.contains(SessionIntents.Kind.START_CONSUMER)) {
            Thread t = new Thread(this::runConsumer, "sauc-consumer");
            consumerThread = t;
            t.start();
        }
        if (intents.contains(SessionIntents.Kind.START_STREAMING)) {
            streamingGate.countDown();
        }
        if (intents.contains(SessionIntents.Kind.CLOSE_TRANSPORT)) {
            transport.close();
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(now(),
                    TransportObservabilityEvent.Kind.CLOSED, "session " + machine.state()));
        }

    }

    private void emit(RecognitionResult result) {
        notifyListener(() -> listener.onResult(result));
    }

    private void report(SessionOutcome sessionOutcome) {
        notifyListener(() -> listener.onOutcome(sessionOutcome));
        outcome.complete(sessionOutcome);

        if (ownedTimerExecutor != null) {
            ownedTimerExecutor.shutdown();
        }
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        }
        catch (RuntimeException e) {
            // a faulty listener must not take the session down with it
            observabilitySink.onError(new ErrorEvent(now(), "Recognition listener failed", e));
        }
    }

    // ---------------------------------------------------------------------
    // Producer task
    // ---------------------------------------------------------------------

    private void runProducer() {
        try {
            transport.open(timingPolicy.connectTimeout());
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(now(),
                    TransportObservabilityEvent.Kind.OPENED, ""));
            if (tasksStopped) {
                return;
            }

            int initialSequence = sequence.next();
            write(requestEncoder.fullRequest(initialSequence));
            dispatch(new SessionSendEvent.InitialRequestSent(now(), initialSequence));

            if (awaitStreaming()) {
                streamAudio();
            }
        }
        catch (TransportException e) {
            reportTransportFailure(e);
        }
        catch (PayloadException e) {
            dispatch(new SessionFailureEvent.TaskFailed(now(), e.reason(), "initial request could not be encoded"));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (InvalidStateException e) {
            producerRefused(e);
        }
        catch (RuntimeException e) {
            taskFailed("Producer task failed", e);
        }
    }

    private boolean awaitStreaming() throws InterruptedException {
        while (!tasksStopped) {
            if (streamingGate.await(timingPolicy.producerPollInterval().toNanos(), TimeUnit.NANOSECONDS)) {
                return !tasksStopped;
            }
        }
        return false;
    }

    private void streamAudio() throws TransportException, InterruptedException {
        while (!tasksStopped) {
            Optional<byte[]> chunk = captureQueue.poll(timingPolicy.producerPollInterval());
            if (chunk.isPresent()) {
                for (AudioSegment segment : segmenter.append(chunk.get())) {
                    writeAudio(segment);
                }
            }
            else if (captureQueue.isDrained()) {
                Optional<AudioSegment> remainder = segmenter.flush();
                if (remainder.isPresent()) {
                    writeAudio(remainder.get());
                }
                writeTerminal();
                return;
            }
        }
    }

    private void writeAudio(AudioSegment segment) throws TransportException, InterruptedException {
        if (tasksStopped) {
            return;
        }
        int seq = sequence.next();
        dispatch(new SessionSendEvent.AudioDispatched(now(), seq));
        write(requestEncoder.audioRequest(seq, segment.pcm()));
    }

    private void writeTerminal() throws TransportException, InterruptedException {
        int seq = sequence.finish();
        dispatch(new SessionSendEvent.TerminalDispatched(now(), seq));
        write(requestEncoder.terminalRequest(seq));
    }

    private void write(SaucFrame frame) throws TransportException, InterruptedException {
        transport.send(frameEncoder.encode(frame));
        observabilitySink.onProtocolEvent(ProtocolObservabilityEvent.of(now(),
                ProtocolObservabilityEvent.Kind.FRAME_SENT, frame.sequenceNumber(),
                frame.messageType() + " " + frame.payloadLength() + " bytes"));
    }

    private void producerRefused(InvalidStateException e) {
        if (e.state().isTerminal()) {
            // the session ended while a frame was being prepared
            log.debug("Producer stopped: {}", e.getMessage());
            return;
        }
        taskFailed("Producer attempted an illegal send", e);
    }

    // ---------------------------------------------------------------------
    // Consumer task
    // ---------------------------------------------------------------------

    private void runConsumer() {
        try {
            while (!tasksStopped) {
                Optional<byte[]> bytes = transport.receive(timingPolicy.receivePollInterval());
                if (bytes.isPresent()) {
                    handleInbound(bytes.get());
                }
            }
        }
        catch (TransportException e) {
            reportTransportFailure(e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (RuntimeException e) {
            taskFailed("Consumer task failed", e);
        }
    }

    private void handleInbound(byte[] bytes) {
        DecodeResult<SaucFrame> frame = frameDecoder.decode(bytes);
        if (frame instanceof DecodeResult.Failure<SaucFrame> failure) {
            observabilitySink.onProtocolEvent(ProtocolObservabilityEvent.skipped(now(), failure.error()));
            return;
        }

        DecodeResult<InboundMessage> message = responseDecoder.decode(frame.value());
        if (message instanceof DecodeResult.Failure<InboundMessage> failure) {
            observabilitySink.onProtocolEvent(ProtocolObservabilityEvent.skipped(now(), failure.error()));
            return;
        }

        observabilitySink.onProtocolEvent(ProtocolObservabilityEvent.of(now(),
                ProtocolObservabilityEvent.Kind.FRAME_RECEIVED, frame.value().sequenceNumber(),
                frame.value().messageType().toString()));
        dispatch(new SessionMessageEvent.MessageReceived(now(), message.value()));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void reportTransportFailure(TransportException e) {
        if (!tasksStopped) {
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(now(),
                    TransportObservabilityEvent.Kind.FAILED, e.reason() + ": " + e.getMessage()));
        }
        dispatch(new SessionFailureEvent.TransportFailed(now(), e.reason(), e.getMessage()));
    }

    private void taskFailed(String message, RuntimeException e) {
        observabilitySink.onError(new ErrorEvent(now(), message, e));
        dispatch(new SessionFailureEvent.TaskFailed(now(), ProtocolErrorReason.INVALID_STATE,
                message + ": " + e.getMessage()));
    }

    private static void interruptUnlessCurrent(Thread t) {
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    private Instant now() {
        return clock.instant();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SaucConnectionConfig connectionConfig;
        private SaucSessionConfig sessionConfig = SaucSessionConfig.defaults();
        private SaucTimingPolicy timingPolicy = SaucTimingPolicy.defaults();
        private RecognitionListener listener;
        private StreamingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private PayloadTransform payloadTransform = new PayloadTransform();
        private FrameTransport transport;
        private TimeoutScheduler scheduler;
        private Clock clock = Clock.systemUTC();

        public Builder withConnectionConfig(SaucConnectionConfig config) {
            this.connectionConfig = config;
            return this;
        }

        public Builder withSessionConfig(SaucSessionConfig config) {
            this.sessionConfig = config;
            return this;
        }

        public Builder withTimingPolicy(SaucTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        public Builder withListener(RecognitionListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder withObservabilitySink(StreamingObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withPayloadTransform(PayloadTransform payloadTransform) {
            this.payloadTransform = payloadTransform;
            return this;
        }

        /**
         * Use the given transport instead of a WebSocket built from the
         * connection config.
         */
        public Builder withTransport(FrameTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Arm timeouts on the given scheduler instead of a private timer thread.
         */
        public Builder withTimeoutScheduler(TimeoutScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /** Clock for event and outcome timestamps; never drives a timeout. */
        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public StreamingEngine build() {
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(sessionConfig, "sessionConfig");
            Objects.requireNonNull(timingPolicy, "timingPolicy");
            Objects.requireNonNull(payloadTransform, "payloadTransform");
            Objects.requireNonNull(clock, "clock");
            observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            FrameTransport effectiveTransport = transport;
            if (effectiveTransport == null) {
                Objects.requireNonNull(connectionConfig, "connectionConfig");
                effectiveTransport = new NettyWebSocketTransport(connectionConfig, timingPolicy.sendTimeout());
            }

            ScheduledExecutorService ownedTimer = null;
            TimeoutScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedTimer = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "sauc-timer");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ExecutorTimeoutScheduler(ownedTimer);
            }

            return new StreamingEngine(this, effectiveTransport, effectiveScheduler, ownedTimer);
        }
    }
}
