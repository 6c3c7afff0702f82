package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.service.tts.SynthesizedSpeech;

import java.util.concurrent.Future;

/**
 * What the playback worker should do next, as decided on the session loop.
 *
 * @param kind     step kind
 * @param sentence sentence to play ({@code null} for WAIT and DONE)
 * @param speech   prefetched audio for PLAY_CACHED
 * @param pending  in-flight synthesis for AWAIT
 */
record PlaybackStep(Kind kind, QueuedSentence sentence, SynthesizedSpeech speech, Future<SynthesizedSpeech> pending) {

    enum Kind {
        /** Queue empty, more sentences may come. */
        WAIT,
        /** Queue empty and generation complete. */
        DONE,
        /** Play audio taken from the prefetch cache. */
        PLAY_CACHED,
        /** Wait for an in-flight prefetch, then play. */
        AWAIT,
        /** Nothing prefetched; synthesize and stream directly. */
        COLD
    }

    private static final PlaybackStep WAIT = new PlaybackStep(Kind.WAIT, null, null, null);
    private static final PlaybackStep DONE = new PlaybackStep(Kind.DONE, null, null, null);

    static PlaybackStep waiting() {
        return WAIT;
    }

    static PlaybackStep done() {
        return DONE;
    }

    static PlaybackStep cached(QueuedSentence sentence, SynthesizedSpeech speech) {
        return new PlaybackStep(Kind.PLAY_CACHED, sentence, speech, null);
    }

    static PlaybackStep await(QueuedSentence sentence, Future<SynthesizedSpeech> pending) {
        return new PlaybackStep(Kind.AWAIT, sentence, null, pending);
    }

    static PlaybackStep cold(QueuedSentence sentence) {
        return new PlaybackStep(Kind.COLD, sentence, null, null);
    }
}
