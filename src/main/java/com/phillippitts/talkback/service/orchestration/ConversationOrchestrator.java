package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.ChatMessage;
import com.phillippitts.talkback.domain.SessionState;

import java.util.List;

/**
 * Real-time, full-duplex voice conversation between a user and a streaming
 * speech-to-text, language-model and speech-synthesis pipeline.
 *
 * <p>One instance serves one session at a time. Implementations own the turn-taking state
 * machine, utterance detection, sentence segmentation, synthesis prefetching and barge-in
 * handling. No collaborator exception escapes an orchestrator except those documented on
 * {@link #startSession(SessionServices, SessionMode)}.
 *
 * @since 1.0
 */
public interface ConversationOrchestrator extends AutoCloseable {

    /**
     * Starts a session. Does nothing (logged) if a session is already active.
     *
     * @param services provider collaborators for this session
     * @param mode     who speaks first
     * @throws com.phillippitts.talkback.exception.ServicesNotConfiguredException if a collaborator
     *         is missing; thrown before any state change
     * @throws com.phillippitts.talkback.exception.SessionStartException if audio I/O or the
     *         speech-to-text stream could not be started; the session stays idle
     */
    void startSession(SessionServices services, SessionMode mode);

    /**
     * Stops the session, cancelling all in-flight work and clearing conversation state.
     * Idempotent.
     */
    void stopSession();

    /**
     * Finalizes {@code text} as the user's utterance, as if speech-to-text had produced it.
     *
     * @return {@code true} if the utterance was accepted (the user had the floor)
     */
    boolean injectUtterance(String text);

    SessionState state();

    /** Session id of the active session, or {@code null} when idle. */
    String sessionId();

    /** Latest speech-to-text transcript of the utterance in progress. */
    String currentTranscript();

    /** Assistant response streamed so far in the current turn. */
    String currentResponse();

    /** Snapshot of the conversation history, system entry first. */
    List<ChatMessage> history();

    /** Level of the last captured audio frame in dBFS. */
    float audioLevelDb();

    /**
     * Stops any active session and releases the orchestrator's threads.
     */
    @Override
    void close();
}
