package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for conversation turn-taking.
 *
 * <p>All timing values are fixed for the lifetime of an orchestrator; nothing mutates them at runtime.
 */
@Validated
@ConfigurationProperties(prefix = "conversation")
public class ConversationProperties {

    static final String DEFAULT_SYSTEM_PROMPT =
            "You are a friendly spoken-language tutor. Answer in short, clear sentences.";
    static final String DEFAULT_OPENING_PROMPT = "Please begin the lecture now.";

    /** Continuous non-speech after detected speech that ends an utterance. */
    @Min(100)
    private final int silenceTimeoutMs;

    /** Window in which renewed speech confirms a tentative barge-in. */
    @Min(50)
    private final int bargeInConfirmationMs;

    /** Delay after the assistant finishes speaking before listening resumes. */
    @Min(0)
    private final int postTurnCooldownMs;

    /** Time spent in the error state before returning to listening. */
    @Min(0)
    private final int errorRecoveryDelayMs;

    /** Idle poll interval of the playback worker while waiting for sentences. */
    @Min(1)
    private final int queuePollIntervalMs;

    /** VAD confidence a speech frame must exceed to count as a barge-in. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double bargeInThreshold;

    private final boolean enableInterruptions;

    private final boolean flushSynthesisOnInterrupt;

    private final String systemPrompt;

    /** User message sent on start when the assistant speaks first. */
    private final String openingPrompt;

    /** Hard stop for a session; 0 disables. */
    @Min(0)
    private final long maxSessionDurationMs;

    @ConstructorBinding
    public ConversationProperties(Integer silenceTimeoutMs,
                                  Integer bargeInConfirmationMs,
                                  Integer postTurnCooldownMs,
                                  Integer errorRecoveryDelayMs,
                                  Integer queuePollIntervalMs,
                                  Double bargeInThreshold,
                                  Boolean enableInterruptions,
                                  Boolean flushSynthesisOnInterrupt,
                                  String systemPrompt,
                                  String openingPrompt,
                                  Long maxSessionDurationMs) {
        this.silenceTimeoutMs = silenceTimeoutMs == null ? 1500 : silenceTimeoutMs;
        this.bargeInConfirmationMs = bargeInConfirmationMs == null ? 600 : bargeInConfirmationMs;
        this.postTurnCooldownMs = postTurnCooldownMs == null ? 500 : postTurnCooldownMs;
        this.errorRecoveryDelayMs = errorRecoveryDelayMs == null ? 1500 : errorRecoveryDelayMs;
        this.queuePollIntervalMs = queuePollIntervalMs == null ? 50 : queuePollIntervalMs;
        this.bargeInThreshold = bargeInThreshold == null ? 0.7 : bargeInThreshold;
        this.enableInterruptions = enableInterruptions == null || enableInterruptions;
        this.flushSynthesisOnInterrupt = flushSynthesisOnInterrupt == null || flushSynthesisOnInterrupt;
        this.systemPrompt = (systemPrompt == null || systemPrompt.isBlank()) ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        this.openingPrompt = (openingPrompt == null || openingPrompt.isBlank())
                ? DEFAULT_OPENING_PROMPT : openingPrompt;
        this.maxSessionDurationMs = maxSessionDurationMs == null ? 5_400_000L : maxSessionDurationMs;
    }

    /**
     * Properties with every value at its default.
     */
    public static ConversationProperties defaults() {
        return new ConversationProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public int getSilenceTimeoutMs() { return silenceTimeoutMs; }
    public int getBargeInConfirmationMs() { return bargeInConfirmationMs; }
    public int getPostTurnCooldownMs() { return postTurnCooldownMs; }
    public int getErrorRecoveryDelayMs() { return errorRecoveryDelayMs; }
    public int getQueuePollIntervalMs() { return queuePollIntervalMs; }
    public double getBargeInThreshold() { return bargeInThreshold; }
    public boolean isEnableInterruptions() { return enableInterruptions; }
    public boolean isFlushSynthesisOnInterrupt() { return flushSynthesisOnInterrupt; }
    public String getSystemPrompt() { return systemPrompt; }
    public String getOpeningPrompt() { return openingPrompt; }
    public long getMaxSessionDurationMs() { return maxSessionDurationMs; }
}
