package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.AudioChunk;

import java.util.List;
import java.util.Objects;

/**
 * Complete synthesized audio for one sentence, as collected by a prefetch.
 *
 * @param chunks audio chunks in playback order (never empty)
 */
public record SynthesizedSpeech(List<AudioChunk> chunks) {

    public SynthesizedSpeech {
        Objects.requireNonNull(chunks, "chunks must not be null");
        if (chunks.isEmpty()) {
            throw new IllegalArgumentException("chunks must not be empty");
        }
        chunks = List.copyOf(chunks);
    }

    public int totalBytes() {
        return chunks.stream().mapToInt(c -> c.data().length).sum();
    }
}
