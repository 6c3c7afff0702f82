package com.phillippitts.talkback.service.orchestration;

import java.time.Duration;

/**
 * Two-phase barge-in state: the tentative-pause flag and the single confirmation timer.
 *
 * <p>While a tentative pause is active, further qualifying speech is the confirmation signal and
 * never starts a second pause. Confined to the session loop.
 */
final class BargeInTracker {

    private final TimerSlot confirmationTimer;
    private boolean tentative;

    BargeInTracker(TimerSlot confirmationTimer) {
        this.confirmationTimer = confirmationTimer;
    }

    boolean isTentative() {
        return tentative;
    }

    void beginTentative(Duration window, Runnable onWindowElapsed) {
        tentative = true;
        confirmationTimer.arm(window, onWindowElapsed);
    }

    void clear() {
        tentative = false;
        confirmationTimer.cancel();
    }
}
