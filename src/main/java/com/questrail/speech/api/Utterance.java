package com.questrail.speech.api;

import java.util.Objects;

/**
 * One sentence span within a recognition result.
 *
 * @param text        utterance text
 * @param startTimeMs start offset in the audio stream, or -1 if not reported
 * @param endTimeMs   end offset in the audio stream, or -1 if not reported
 * @param definite    true once the service will no longer revise this utterance
 */
public record Utterance(String text, long startTimeMs, long endTimeMs, boolean definite)
{
    public Utterance {
        Objects.requireNonNull(text, "text");
    }
}
