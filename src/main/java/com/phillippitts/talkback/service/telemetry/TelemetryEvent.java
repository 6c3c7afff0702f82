package com.phillippitts.talkback.service.telemetry;

/**
 * Discrete session milestones reported to telemetry.
 */
public enum TelemetryEvent {
    SESSION_STARTED,
    SESSION_ENDED,
    USER_FINISHED_SPEAKING,
    LLM_FIRST_TOKEN_RECEIVED,
    AI_FINISHED_SPEAKING,
    USER_INTERRUPTED,
    PLAYBACK_PAUSED,
    PLAYBACK_RESUMED,
    GENERATION_FAILED
}
