package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.service.stream.ProviderStream;

/**
 * Contract for streaming Text-to-Speech (TTS) providers.
 *
 * <p>{@link #synthesize(String)} may be called concurrently for different sentences; each call
 * yields its own chunk stream ending with a chunk flagged {@link AudioChunk#isLast()}.
 */
public interface SpeechSynthesisService {

    ProviderStream<AudioChunk> synthesize(String text);

    /**
     * Discards any audio buffered inside the provider (used after a confirmed interruption).
     */
    void flush();
}
