package com.phillippitts.talkback.service.orchestration.event;

import java.time.Instant;
import java.util.Objects;

/**
 * User-visible failure shown while a session is in the error state.
 *
 * @param sessionId session that failed
 * @param message   human-readable failure message
 * @param at        when the failure was observed
 */
public record SessionErrorEvent(String sessionId, String message, Instant at) {

    public SessionErrorEvent {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
