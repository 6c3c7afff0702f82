package com.phillippitts.talkback.service.orchestration.event;

import com.phillippitts.talkback.domain.SessionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Published on every accepted turn-taking transition.
 *
 * @param sessionId session the transition belongs to ({@code null} before the first session)
 * @param previous  state before the transition
 * @param current   state after the transition
 * @param at        when the transition happened
 */
public record SessionStateChangedEvent(String sessionId, SessionState previous, SessionState current, Instant at) {

    public SessionStateChangedEvent {
        Objects.requireNonNull(previous, "previous must not be null");
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
