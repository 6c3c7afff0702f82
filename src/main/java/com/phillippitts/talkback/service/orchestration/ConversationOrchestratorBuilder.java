package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.ConversationProperties;
import com.phillippitts.talkback.config.properties.PlaybackProperties;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.llm.LlmRequestConfig;
import com.phillippitts.talkback.service.telemetry.TelemetrySink;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultConversationOrchestrator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConversationOrchestrator orchestrator = ConversationOrchestratorBuilder.builder()
 *     .conversationProperties(conversationProps)
 *     .playbackProperties(playbackProps)
 *     .workerExecutor(executor)
 *     .publisher(publisher)
 *     .telemetry(telemetrySink)
 *     .build();
 * }</pre>
 *
 * <p>Playback properties, request config, audio format and telemetry fall back to defaults when
 * not set.
 *
 * @since 1.0
 */
public final class ConversationOrchestratorBuilder {

    // Required dependencies
    private ConversationProperties conversationProperties;
    private Executor workerExecutor;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private PlaybackProperties playbackProperties;
    private LlmRequestConfig llmRequestConfig;
    private AudioFormat audioFormat;
    private TelemetrySink telemetry;

    private ConversationOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static ConversationOrchestratorBuilder builder() {
        return new ConversationOrchestratorBuilder();
    }

    /**
     * @param conversationProperties turn-taking timing and prompts (required)
     */
    public ConversationOrchestratorBuilder conversationProperties(ConversationProperties conversationProperties) {
        this.conversationProperties = conversationProperties;
        return this;
    }

    /**
     * @param workerExecutor executor for stream readers, playback and prefetch (required)
     */
    public ConversationOrchestratorBuilder workerExecutor(Executor workerExecutor) {
        this.workerExecutor = workerExecutor;
        return this;
    }

    /**
     * @param publisher Spring event publisher (required)
     */
    public ConversationOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public ConversationOrchestratorBuilder playbackProperties(PlaybackProperties playbackProperties) {
        this.playbackProperties = playbackProperties;
        return this;
    }

    public ConversationOrchestratorBuilder llmRequestConfig(LlmRequestConfig llmRequestConfig) {
        this.llmRequestConfig = llmRequestConfig;
        return this;
    }

    public ConversationOrchestratorBuilder audioFormat(AudioFormat audioFormat) {
        this.audioFormat = audioFormat;
        return this;
    }

    public ConversationOrchestratorBuilder telemetry(TelemetrySink telemetry) {
        this.telemetry = telemetry;
        return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultConversationOrchestrator build() {
        Objects.requireNonNull(conversationProperties, "conversationProperties is required");
        Objects.requireNonNull(workerExecutor, "workerExecutor is required");
        Objects.requireNonNull(publisher, "publisher is required");

        return new DefaultConversationOrchestrator(
                conversationProperties,
                playbackProperties != null ? playbackProperties : PlaybackProperties.of(PlaybackProperties.Preset.DEFAULT),
                llmRequestConfig != null ? llmRequestConfig : LlmRequestConfig.DEFAULT,
                audioFormat != null ? audioFormat : AudioFormat.DEFAULT,
                workerExecutor,
                publisher,
                telemetry != null ? telemetry : TelemetrySink.NOOP
        );
    }
}
