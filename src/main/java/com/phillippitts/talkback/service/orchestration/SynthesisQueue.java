package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.service.tts.SpeechSynthesisService;
import com.phillippitts.talkback.service.tts.SynthesizedSpeech;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Future;

/**
 * FIFO of sentences awaiting playback, paired with the prefetch cache that synthesizes them early.
 *
 * <p>Queue order is playback order. Each {@link #nextStep} dequeues the head, starts prefetching for
 * up to {@code prefetchDepth} of the sentences still queued behind it, and resolves the head's audio
 * from the cache, an in-flight task, or cold synthesis.
 *
 * <p>Confined to the session loop.
 */
final class SynthesisQueue {

    private final Deque<QueuedSentence> pending = new ArrayDeque<>();
    private final PrefetchCache prefetch;
    private final int prefetchDepth;
    private long nextSequence;
    private boolean generationComplete;

    SynthesisQueue(PrefetchCache prefetch, int prefetchDepth) {
        this.prefetch = prefetch;
        this.prefetchDepth = Math.max(0, prefetchDepth);
    }

    QueuedSentence enqueue(String text) {
        QueuedSentence sentence = new QueuedSentence(nextSequence++, text);
        pending.addLast(sentence);
        return sentence;
    }

    /**
     * Starts synthesis for a freshly segmented sentence.
     */
    void prefetchNow(QueuedSentence sentence, SpeechSynthesisService tts, CancellationScope scope) {
        prefetch.start(sentence, tts, scope);
    }

    void markGenerationComplete() {
        generationComplete = true;
    }

    boolean isGenerationComplete() {
        return generationComplete;
    }

    PlaybackStep nextStep(SpeechSynthesisService tts, CancellationScope scope) {
        QueuedSentence head = pending.pollFirst();
        if (head == null) {
            return generationComplete ? PlaybackStep.done() : PlaybackStep.waiting();
        }

        int started = 0;
        Iterator<QueuedSentence> upcoming = pending.iterator();
        while (started < prefetchDepth && upcoming.hasNext()) {
            QueuedSentence next = upcoming.next();
            if (!prefetch.contains(next)) {
                prefetch.start(next, tts, scope);
            }
            started++;
        }

        SynthesizedSpeech cached = prefetch.take(head);
        if (cached != null) {
            return PlaybackStep.cached(head, cached);
        }
        Future<SynthesizedSpeech> inFlight = prefetch.claim(head);
        if (inFlight != null) {
            return PlaybackStep.await(head, inFlight);
        }
        return PlaybackStep.cold(head);
    }

    /**
     * Drops queued sentences and all prefetch state. Generation is considered not complete again.
     */
    void clear() {
        pending.clear();
        prefetch.clear();
        generationComplete = false;
    }

    void clearPrefetch() {
        prefetch.clear();
    }

    int size() {
        return pending.size();
    }

    boolean isEmpty() {
        return pending.isEmpty();
    }

    List<String> pendingTexts() {
        return pending.stream().map(QueuedSentence::text).toList();
    }

    PrefetchCache prefetch() {
        return prefetch;
    }
}
