package com.phillippitts.talkback.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Partial or final result emitted by a streaming speech-to-text provider.
 *
 * @param transcript       transcript so far for the current utterance (must not be null, may be empty)
 * @param isFinal          whether the provider will not revise this transcript
 * @param isEndOfUtterance whether the provider detected the end of the utterance
 * @param latency          provider-reported emission latency
 */
public record SttResult(
        String transcript,
        boolean isFinal,
        boolean isEndOfUtterance,
        Duration latency
) {

    public SttResult {
        Objects.requireNonNull(transcript, "Transcript must not be null");
        if (latency == null || latency.isNegative()) {
            latency = Duration.ZERO;
        }
    }

    public static SttResult partial(String transcript) {
        return new SttResult(transcript, false, false, Duration.ZERO);
    }

    public static SttResult endOfUtterance(String transcript) {
        return new SttResult(transcript, true, true, Duration.ZERO);
    }
}
