package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.SessionState;
import com.phillippitts.talkback.service.orchestration.event.SessionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Sole mutator of {@link SessionState} for one orchestrator.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE                      → USER_SPEAKING | AI_THINKING
 * USER_SPEAKING             → PROCESSING_USER_UTTERANCE
 * PROCESSING_USER_UTTERANCE → AI_THINKING
 * AI_THINKING               → AI_SPEAKING | USER_SPEAKING
 * AI_SPEAKING               → INTERRUPTED | USER_SPEAKING
 * INTERRUPTED               → AI_SPEAKING | USER_SPEAKING
 * ERROR                     → USER_SPEAKING
 * any                       → IDLE | ERROR
 * </pre>
 *
 * <p>Rejected transitions are logged and leave the state unchanged. A transition to the current
 * state is a no-op.
 *
 * <p><b>Thread Safety:</b> transitions are performed on the session loop only; {@link #current()}
 * may be read from any thread.
 *
 * @since 1.0
 */
final class TurnStateMachine {

    private static final Logger LOG = LogManager.getLogger(TurnStateMachine.class);

    private static final Map<SessionState, Set<SessionState>> ALLOWED = new EnumMap<>(SessionState.class);

    static {
        ALLOWED.put(SessionState.IDLE, EnumSet.of(SessionState.USER_SPEAKING, SessionState.AI_THINKING));
        ALLOWED.put(SessionState.USER_SPEAKING, EnumSet.of(SessionState.PROCESSING_USER_UTTERANCE));
        ALLOWED.put(SessionState.PROCESSING_USER_UTTERANCE, EnumSet.of(SessionState.AI_THINKING));
        ALLOWED.put(SessionState.AI_THINKING, EnumSet.of(SessionState.AI_SPEAKING, SessionState.USER_SPEAKING));
        ALLOWED.put(SessionState.AI_SPEAKING, EnumSet.of(SessionState.INTERRUPTED, SessionState.USER_SPEAKING));
        ALLOWED.put(SessionState.INTERRUPTED, EnumSet.of(SessionState.AI_SPEAKING, SessionState.USER_SPEAKING));
        ALLOWED.put(SessionState.ERROR, EnumSet.of(SessionState.USER_SPEAKING));
    }

    private final ApplicationEventPublisher publisher;
    private final Supplier<String> sessionIdSupplier;
    private volatile SessionState current = SessionState.IDLE;

    TurnStateMachine(ApplicationEventPublisher publisher, Supplier<String> sessionIdSupplier) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.sessionIdSupplier = Objects.requireNonNull(sessionIdSupplier, "sessionIdSupplier must not be null");
    }

    SessionState current() {
        return current;
    }

    boolean is(SessionState state) {
        return current == state;
    }

    static boolean isAllowed(SessionState from, SessionState to) {
        if (to == SessionState.IDLE || to == SessionState.ERROR) {
            return true;
        }
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Moves to {@code target} if the transition is allowed.
     *
     * @return {@code true} if the state is {@code target} afterwards
     */
    boolean transitionTo(SessionState target) {
        Objects.requireNonNull(target, "target must not be null");
        SessionState previous = current;
        if (previous == target) {
            return true;
        }
        if (!isAllowed(previous, target)) {
            LOG.warn("Rejected state transition {} -> {}", previous, target);
            return false;
        }
        current = target;
        LOG.debug("State {} -> {}", previous, target);
        publisher.publishEvent(new SessionStateChangedEvent(sessionIdSupplier.get(), previous, target, Instant.now()));
        return true;
    }
}
