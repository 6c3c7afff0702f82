package com.phillippitts.talkback.service.telemetry;

/**
 * Latency measurements reported by the conversation pipeline.
 */
public enum LatencyKind {
    /** Provider-reported delay between audio and an STT result. */
    STT_EMISSION("stt.emission"),
    /** Generation request to first language-model token. */
    LLM_FIRST_TOKEN("llm.first_token"),
    /** Turn start to first synthesized audio handed to playback. */
    TTS_FIRST_BYTE("tts.first_byte"),
    /** Provider-reported time to first synthesized byte. */
    TTS_PROVIDER_FIRST_BYTE("tts.provider_first_byte"),
    /** User finished speaking to assistant finished speaking. */
    END_TO_END_TURN("turn.end_to_end");

    private final String tagValue;

    LatencyKind(String tagValue) {
        this.tagValue = tagValue;
    }

    /** Value used for the {@code kind} meter tag. */
    public String tagValue() {
        return tagValue;
    }
}
