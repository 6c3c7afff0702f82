package com.phillippitts.talkback.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Holder for at most one pending timer of a given kind.
 *
 * <p>Arming replaces and cancels the previous timer. A callback that was already queued when it got
 * replaced or cancelled recognizes itself as superseded and does nothing.
 *
 * <p>Confined to the {@link SessionLoop} thread.
 */
final class TimerSlot {

    private static final Logger LOG = LogManager.getLogger(TimerSlot.class);

    private final String name;
    private final SessionLoop loop;
    private ScheduledFuture<?> handle;
    private long generation;

    TimerSlot(String name, SessionLoop loop) {
        this.name = name;
        this.loop = loop;
    }

    void arm(Duration delay, Runnable action) {
        cancel();
        long armedGeneration = generation;
        handle = loop.schedule(() -> {
            if (armedGeneration != generation) {
                return;
            }
            handle = null;
            generation++;
            LOG.debug("{} timer fired", name);
            action.run();
        }, delay);
    }

    boolean isArmed() {
        return handle != null;
    }

    void cancel() {
        generation++;
        if (handle != null) {
            handle.cancel(false);
            handle = null;
        }
    }
}
