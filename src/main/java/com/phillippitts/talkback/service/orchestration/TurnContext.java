package com.phillippitts.talkback.service.orchestration;

/**
 * One assistant turn: from the moment it starts (user utterance finalized, or session start in
 * lecture mode) until the next turn replaces it.
 *
 * <p>Callbacks posted by the turn's workers carry their {@code TurnContext}; the orchestrator drops
 * any callback whose turn is cancelled or no longer current.
 */
final class TurnContext {

    private final long id;
    private final long startNanos;
    private final CancellationScope scope = new CancellationScope();

    // Mutated on the session loop only
    private boolean firstTokenSeen;
    private boolean playbackFinished;
    private int sentenceCount;

    TurnContext(long id, long startNanos) {
        this.id = id;
        this.startNanos = startNanos;
    }

    long id() {
        return id;
    }

    long startNanos() {
        return startNanos;
    }

    CancellationScope scope() {
        return scope;
    }

    boolean isCancelled() {
        return scope.isCancelled();
    }

    void cancel() {
        scope.cancel();
    }

    /**
     * @return {@code true} the first time it is called for this turn
     */
    boolean markFirstToken() {
        if (firstTokenSeen) {
            return false;
        }
        firstTokenSeen = true;
        return true;
    }

    boolean isPlaybackFinished() {
        return playbackFinished;
    }

    void markPlaybackFinished() {
        playbackFinished = true;
    }

    int incrementSentenceCount() {
        return ++sentenceCount;
    }

    int sentenceCount() {
        return sentenceCount;
    }
}
