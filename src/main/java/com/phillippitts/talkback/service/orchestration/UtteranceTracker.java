package com.phillippitts.talkback.service.orchestration;

import java.time.Duration;

/**
 * Silence tracking for utterance completion while the user has the floor.
 *
 * <p>Holds the has-detected-speech flag, the start of the current silence run and the single
 * silence timer. Confined to the session loop.
 */
final class UtteranceTracker {

    private final TimerSlot silenceTimer;
    private boolean speechDetected;
    private Long silenceStartNanos;

    UtteranceTracker(TimerSlot silenceTimer) {
        this.silenceTimer = silenceTimer;
    }

    /**
     * Records a speech frame: marks speech as detected and cancels a running silence timer.
     */
    void onSpeech() {
        speechDetected = true;
        silenceStartNanos = null;
        silenceTimer.cancel();
    }

    /**
     * @return {@code true} if a non-speech frame should start the silence timer now
     */
    boolean shouldStartSilenceTimer() {
        return speechDetected && !silenceTimer.isArmed();
    }

    void startSilence(long nowNanos, Duration timeout, Runnable onTimeout) {
        silenceStartNanos = nowNanos;
        silenceTimer.arm(timeout, onTimeout);
    }

    /**
     * @return length of the current silence run, or zero when no silence run is being timed
     */
    Duration silenceDuration(long nowNanos) {
        if (silenceStartNanos == null) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(Math.max(0L, nowNanos - silenceStartNanos));
    }

    void reset() {
        speechDetected = false;
        silenceStartNanos = null;
        silenceTimer.cancel();
    }
}
