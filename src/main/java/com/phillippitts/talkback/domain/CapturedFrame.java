package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * Microphone frame delivered together with its voice activity classification.
 *
 * @param pcm raw PCM bytes in the session's configured audio format
 * @param vad voice activity result for this frame
 */
public record CapturedFrame(byte[] pcm, VadResult vad) {

    public CapturedFrame {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(vad, "vad must not be null");
    }
}
