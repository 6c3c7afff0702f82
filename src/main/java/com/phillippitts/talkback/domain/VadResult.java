package com.phillippitts.talkback.domain;

/**
 * Per-frame voice activity classification.
 *
 * @param isSpeech   whether the frame contains speech
 * @param confidence classifier confidence between 0.0 and 1.0
 */
public record VadResult(boolean isSpeech, float confidence) {

    public VadResult {
        if (confidence < 0.0f || confidence > 1.0f) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static VadResult speech(float confidence) {
        return new VadResult(true, confidence);
    }

    public static VadResult silence() {
        return new VadResult(false, 0.0f);
    }
}
