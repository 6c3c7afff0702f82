package com.phillippitts.talkback.domain;

/**
 * Turn-taking state of a conversation session.
 *
 * <p>Exactly one state holds at any instant. Only the session's
 * {@link com.phillippitts.talkback.service.orchestration.TurnStateMachine} mutates it.
 *
 * @since 1.0
 */
public enum SessionState {
    IDLE("Idle"),
    USER_SPEAKING("User Speaking"),
    AI_THINKING("AI Thinking"),
    AI_SPEAKING("AI Speaking"),
    INTERRUPTED("Interrupted"),
    PROCESSING_USER_UTTERANCE("Processing Utterance"),
    ERROR("Error");

    private final String displayName;

    SessionState(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Whether the session is actively running a conversation.
     *
     * @return {@code false} for {@link #IDLE} and {@link #ERROR}, {@code true} otherwise
     */
    public boolean isActive() {
        return this != IDLE && this != ERROR;
    }
}
