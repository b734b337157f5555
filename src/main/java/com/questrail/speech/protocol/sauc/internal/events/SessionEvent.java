package com.questrail.speech.protocol.sauc.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every input to the session state reducer.
 *
 * <h2>Role in the architecture</h2>
 * A session changes state only in response to events, applied one at a time.
 * Events come from:
 * <ul>
 *   <li>caller commands (start, finalize, abort)</li>
 *   <li>the producer task reporting what it wrote</li>
 *   <li>the consumer task reporting what it read</li>
 *   <li>timeouts and transport or capture failures</li>
 * </ul>
 *
 * Events are immutable and carry only what is needed to advance state.
 */
public interface SessionEvent
{
    /**
     * Time at which the event was generated. Observational only; timeouts
     * never read it.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements SessionEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
