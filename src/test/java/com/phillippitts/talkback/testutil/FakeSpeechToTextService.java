package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.domain.SttResult;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.stream.ProviderStream;
import com.phillippitts.talkback.service.stt.SpeechToTextService;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for {@link SpeechToTextService}; the test emits results through {@link #emit(SttResult)}.
 */
public class FakeSpeechToTextService implements SpeechToTextService {

    public final AtomicInteger startCount = new AtomicInteger();
    public final AtomicInteger sendCount = new AtomicInteger();
    public final AtomicInteger stopCount = new AtomicInteger();
    public volatile RuntimeException startException;
    public volatile RuntimeException sendException;

    private final QueueProviderStream<SttResult> results = new QueueProviderStream<>();

    @Override
    public ProviderStream<SttResult> startStreaming(AudioFormat format) {
        startCount.incrementAndGet();
        if (startException != null) {
            throw startException;
        }
        return results;
    }

    @Override
    public void sendAudio(byte[] pcm) {
        sendCount.incrementAndGet();
        if (sendException != null) {
            throw sendException;
        }
    }

    @Override
    public void stopStreaming() {
        stopCount.incrementAndGet();
    }

    public void emit(SttResult result) {
        results.emit(result);
    }
}
