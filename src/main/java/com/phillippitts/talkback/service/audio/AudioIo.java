package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.domain.CapturedFrame;
import com.phillippitts.talkback.service.stream.ProviderStream;

/**
 * Microphone capture and speaker playback for one session.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #configure(AudioFormat)} is called once before {@link #start()}</li>
 *   <li>{@link #frames()} yields captured frames already classified by voice activity detection</li>
 *   <li>{@link #playAudio(AudioChunk)} enqueues audio for playback in call order</li>
 *   <li>Pause keeps the playback position; resume continues from it; stop discards pending audio</li>
 * </ul>
 *
 * <p>Implementations are external to the orchestrator (platform audio engines).
 */
public interface AudioIo {

    void configure(AudioFormat format);

    void start();

    void stop();

    /**
     * Plays one chunk of synthesized audio. May block while the output buffer is full.
     *
     * @throws InterruptedException if the calling thread is interrupted while blocked
     */
    void playAudio(AudioChunk chunk) throws InterruptedException;

    /** @return {@code true} if playback was running and is now paused */
    boolean pausePlayback();

    /** @return {@code true} if paused playback was resumed */
    boolean resumePlayback();

    void stopPlayback();

    /**
     * Stream of captured frames paired with their VAD result. Valid after {@link #start()}.
     */
    ProviderStream<CapturedFrame> frames();
}
