package com.phillippitts.talkback.service.orchestration.event;

import java.time.Instant;

/**
 * Published when the language model finished a response and it was appended to history.
 *
 * @param sessionId      session the response belongs to
 * @param sentenceCount  sentences queued for playback
 * @param responseLength characters in the assembled response
 * @param at             completion time
 */
public record AssistantResponseCompletedEvent(String sessionId, int sentenceCount, int responseLength, Instant at) {
}
