package com.phillippitts.talkback.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Copies the Log4j2 {@link ThreadContext} of the submitting thread onto the worker thread.
 *
 * <p>Keeps the {@code sessionId} correlation key on log lines written by conversation workers.
 * The worker's previous context is restored afterwards.
 */
public class ThreadContextTaskDecorator implements TaskDecorator {

    /** ThreadContext key carrying the active session id. */
    public static final String SESSION_ID_KEY = "sessionId";

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
