package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.SttResult;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.stream.ProviderStream;

/**
 * Contract for streaming Speech-to-Text (STT) providers.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #startStreaming(AudioFormat)} opens a recognition stream and returns its results</li>
 *   <li>{@link #sendAudio(byte[])} feeds captured PCM while the user has the floor</li>
 *   <li>{@link #stopStreaming()} ends recognition and releases resources</li>
 * </ol>
 *
 * <p>Results carry the transcript of the current utterance so far; a result that is both final and
 * end-of-utterance concludes it.
 *
 * @see SttResult
 */
public interface SpeechToTextService {

    ProviderStream<SttResult> startStreaming(AudioFormat format);

    /**
     * Sends captured audio to the recognizer.
     *
     * @param pcm raw PCM in the format passed to {@link #startStreaming(AudioFormat)}
     */
    void sendAudio(byte[] pcm);

    void stopStreaming();
}
