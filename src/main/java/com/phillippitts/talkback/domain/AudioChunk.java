package com.phillippitts.talkback.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Chunk of synthesized speech audio.
 *
 * @param data            encoded audio bytes (must not be null)
 * @param isFirst         first chunk of a synthesis
 * @param isLast          last chunk of a synthesis
 * @param timeToFirstByte provider-reported latency, set on the first chunk only (nullable)
 */
public record AudioChunk(byte[] data, boolean isFirst, boolean isLast, Duration timeToFirstByte) {

    public AudioChunk {
        Objects.requireNonNull(data, "data must not be null");
    }

    /**
     * Creates a chunk that is both first and last, i.e. a complete synthesis in one piece.
     */
    public static AudioChunk single(byte[] data) {
        return new AudioChunk(data, true, true, null);
    }

    public boolean hasTimeToFirstByte() {
        return timeToFirstByte != null;
    }
}
