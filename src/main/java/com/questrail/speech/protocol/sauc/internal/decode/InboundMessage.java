package com.questrail.speech.protocol.sauc.internal.decode;

import com.questrail.speech.api.RecognitionResult;

import java.util.Objects;
import java.util.Optional;

/**
 * InboundMessage
 * -----------------------------------------------------------------------------
 * Semantic view of one decoded service frame.
 *
 * <p>Whether a {@link Response} means acceptance or a recognition update
 * depends on the session state it arrives in; that decision belongs to the
 * state reducer, not to the decoder.</p>
 */
public sealed interface InboundMessage permits InboundMessage.Response, InboundMessage.ServerError
{
    /**
     * A full server response.
     *
     * @param result     recognition content, {@code null} if the response carried no text
     * @param lastPacket the service flagged this as the last response of the stream
     * @param rejection  reason the service declined the request, {@code null} if it did not
     * @param sequence   service sequence number, 0 if absent
     */
    record Response(RecognitionResult result, boolean lastPacket, String rejection, int sequence)
            implements InboundMessage
    {
        public Optional<RecognitionResult> recognition() {
            return Optional.ofNullable(result);
        }

        public Optional<String> rejectionReason() {
            return Optional.ofNullable(rejection);
        }

        public boolean isRejection() {
            return rejection != null;
        }
    }

    /**
     * An error response frame.
     */
    record ServerError(int code, String message) implements InboundMessage
    {
        public ServerError {
            Objects.requireNonNull(message, "message");
        }
    }
}
