package com.questrail.speech.api;

import java.util.List;
import java.util.Objects;

/**
 * RecognitionResult
 * -----------------------------------------------------------------------------
 * One recognition hypothesis returned by the service.
 *
 * <p>Results are immutable. A later result supersedes an earlier one; it never
 * edits it. A temporary result ({@code isFinal == false}) may still change as
 * more audio arrives; a final result will not be revised for its utterance.</p>
 *
 * @param text        recognized text
 * @param isFinal     whether the service will revise this text further
 * @param utterances  sentence spans, empty when the service did not report them
 * @param sequence    service sequence number of the carrying frame, 0 if absent
 */
public record RecognitionResult(String text, boolean isFinal, List<Utterance> utterances, int sequence)
{
    public RecognitionResult {
        Objects.requireNonNull(text, "text");
        utterances = List.copyOf(utterances == null ? List.of() : utterances);
    }
}
