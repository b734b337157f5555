package com.questrail.speech.protocol.sauc.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * FrameTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a message-oriented, connection-based transport carrying
 * one encoded SAUC frame per message.
 *
 * <h2>Threading contract</h2>
 * <ul>
 *   <li>{@link #open(Duration)} and {@link #send(byte[])} are called by a single
 *       writer thread; sends are written in call order.</li>
 *   <li>{@link #receive(Duration)} is called by a single reader thread and
 *       returns messages in arrival order.</li>
 *   <li>{@link #close()} may be called from any thread, any number of times.
 *       It unblocks a pending receive, which then reports
 *       {@code TRANSPORT_CLOSED}.</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, another WebSocket client, or a
 * test double.</p>
 */
public interface FrameTransport
{
    /**
     * Open the connection, completing any handshake.
     *
     * @throws TransportException with {@code CONNECT_TIMEOUT} if the handshake did
     *         not complete in time, or {@code TRANSPORT_CLOSED} if it failed
     */
    void open(Duration timeout) throws TransportException, InterruptedException;

    /**
     * Write one frame, blocking until it is handed to the network or the
     * transport's send timeout expires.
     */
    void send(byte[] frame) throws TransportException, InterruptedException;

    /**
     * Wait up to {@code timeout} for the next inbound frame.
     *
     * @return the frame, or empty if none arrived in time
     * @throws TransportException once the connection is closed or has failed
     */
    Optional<byte[]> receive(Duration timeout) throws TransportException, InterruptedException;

    boolean isOpen();

    void close();
}
