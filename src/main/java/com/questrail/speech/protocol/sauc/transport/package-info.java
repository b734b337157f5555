/**
 * SAUC Transport Port
 * =============================================================================
 *
 * The <em>framework-agnostic transport boundary</em> between a concrete
 * WebSocket client and the streaming engine.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>encoded frames as {@code byte[]}</li>
 *   <li>{@link com.questrail.speech.protocol.sauc.transport.TransportException}
 *       for open, write and read failures</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of the port MUST:
 * <ul>
 *   <li>perform transport I/O only</li>
 *   <li>not decode frames or interpret payloads</li>
 *   <li>not schedule protocol timeouts or reconnect</li>
 *   <li>pass handshake headers through without interpreting them</li>
 * </ul>
 */
package com.questrail.speech.protocol.sauc.transport;
