package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.stream.ProviderStream;
import com.phillippitts.talkback.service.tts.SpeechSynthesisService;
import com.phillippitts.talkback.service.tts.SynthesizedSpeech;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Speculative synthesis of queued sentences ahead of their playback.
 *
 * <p>Two maps keyed by {@link QueuedSentence}: completed audio waiting to be played, and synthesis
 * still in flight. A sentence is in at most one of them. Both maps are only touched on the session
 * loop; the synthesis itself runs on the worker executor and reports back through the loop.
 *
 * <p>A completed task is cached only if it is still registered as in flight, so audio for a
 * sentence that was already claimed for playback, or discarded by {@link #clear()}, never lands
 * in the cache.
 */
final class PrefetchCache {

    private static final Logger LOG = LogManager.getLogger(PrefetchCache.class);

    private final SessionLoop loop;
    private final Executor executor;
    private final Map<QueuedSentence, SynthesizedSpeech> cache = new HashMap<>();
    private final Map<QueuedSentence, PrefetchTask> inFlight = new HashMap<>();

    PrefetchCache(SessionLoop loop, Executor executor) {
        this.loop = loop;
        this.executor = executor;
    }

    boolean contains(QueuedSentence sentence) {
        return cache.containsKey(sentence) || inFlight.containsKey(sentence);
    }

    /**
     * Starts synthesis for a sentence unless it is already cached or in flight.
     *
     * @return {@code true} if a new synthesis task was started
     */
    boolean start(QueuedSentence sentence, SpeechSynthesisService tts, CancellationScope scope) {
        if (contains(sentence) || scope.isCancelled()) {
            return false;
        }
        PrefetchTask task = new PrefetchTask(sentence, tts, scope);
        inFlight.put(sentence, task);
        scope.track(task);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(sentence);
            scope.untrack(task);
            LOG.warn("Prefetch rejected by worker pool; sentence will be synthesized on demand");
            return false;
        }
        LOG.debug("Prefetch started for sentence #{}", sentence.sequence());
        return true;
    }

    /**
     * Removes and returns completed audio for the sentence, or {@code null}.
     */
    SynthesizedSpeech take(QueuedSentence sentence) {
        return cache.remove(sentence);
    }

    /**
     * Removes and returns the in-flight synthesis of the sentence, or {@code null}.
     * The caller awaits the result itself.
     */
    Future<SynthesizedSpeech> claim(QueuedSentence sentence) {
        return inFlight.remove(sentence);
    }

    /**
     * Cancels all in-flight synthesis and drops cached audio.
     */
    void clear() {
        for (PrefetchTask task : inFlight.values()) {
            task.cancel(true);
        }
        inFlight.clear();
        cache.clear();
    }

    int cachedCount() {
        return cache.size();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void onTaskDone(PrefetchTask task) {
        if (!inFlight.remove(task.sentence, task)) {
            return;
        }
        if (task.isCancelled()) {
            return;
        }
        try {
            cache.put(task.sentence, task.get());
            LOG.debug("Prefetch cached for sentence #{}", task.sentence.sequence());
        } catch (ExecutionException e) {
            LOG.warn("Prefetch failed for sentence #{}; it will be synthesized on demand: {}",
                    task.sentence.sequence(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Synthesizes a sentence completely and collects its chunks.
     *
     * @throws SynthesisException if the provider produced no audio
     * @throws InterruptedException if cancelled while reading the provider stream
     */
    static SynthesizedSpeech collect(SpeechSynthesisService tts, String text, CancellationScope scope)
            throws InterruptedException {
        ProviderStream<AudioChunk> stream = scope.track(tts.synthesize(text));
        try {
            List<AudioChunk> chunks = new ArrayList<>();
            AudioChunk chunk;
            while (!scope.isCancelled() && (chunk = stream.next()) != null) {
                chunks.add(chunk);
                if (chunk.isLast()) {
                    break;
                }
            }
            if (scope.isCancelled()) {
                throw new InterruptedException("Synthesis cancelled");
            }
            if (chunks.isEmpty()) {
                throw new SynthesisException("Speech synthesis produced no audio", LogSanitizer.preview(text));
            }
            return new SynthesizedSpeech(chunks);
        } finally {
            scope.release(stream);
        }
    }

    private final class PrefetchTask extends FutureTask<SynthesizedSpeech> {

        private final QueuedSentence sentence;
        private final CancellationScope scope;

        PrefetchTask(QueuedSentence sentence, SpeechSynthesisService tts, CancellationScope scope) {
            super(() -> collect(tts, sentence.text(), scope));
            this.sentence = sentence;
            this.scope = scope;
        }

        @Override
        protected void done() {
            scope.untrack(this);
            loop.execute(() -> onTaskDone(this));
        }
    }
}
