package com.phillippitts.talkback.config.orchestration;

import com.phillippitts.talkback.config.properties.AudioProperties;
import com.phillippitts.talkback.config.properties.ConversationProperties;
import com.phillippitts.talkback.config.properties.LanguageModelProperties;
import com.phillippitts.talkback.config.properties.PlaybackProperties;
import com.phillippitts.talkback.service.orchestration.ConversationOrchestratorBuilder;
import com.phillippitts.talkback.service.orchestration.ConversationSessionFactory;
import com.phillippitts.talkback.service.telemetry.TelemetrySink;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the conversation session factory from typed properties, the worker pool and telemetry.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class OrchestrationConfig {

    private final ConversationProperties conversationProperties;
    private final PlaybackProperties playbackProperties;
    private final LanguageModelProperties languageModelProperties;
    private final AudioProperties audioProperties;
    private final ApplicationEventPublisher publisher;
    private final TelemetrySink telemetrySink;

    public OrchestrationConfig(ConversationProperties conversationProperties,
                               PlaybackProperties playbackProperties,
                               LanguageModelProperties languageModelProperties,
                               AudioProperties audioProperties,
                               ApplicationEventPublisher publisher,
                               TelemetrySink telemetrySink) {
        this.conversationProperties = conversationProperties;
        this.playbackProperties = playbackProperties;
        this.languageModelProperties = languageModelProperties;
        this.audioProperties = audioProperties;
        this.publisher = publisher;
        this.telemetrySink = telemetrySink;
    }

    /**
     * Factory producing one orchestrator per conversation. Open orchestrators are closed with
     * the context.
     */
    @Bean(destroyMethod = "closeAll")
    public ConversationSessionFactory conversationSessionFactory(
            @Qualifier("conversationWorkerExecutor") Executor workerExecutor) {
        return new ConversationSessionFactory(() -> ConversationOrchestratorBuilder.builder()
                .conversationProperties(this.conversationProperties)
                .playbackProperties(this.playbackProperties)
                .llmRequestConfig(this.languageModelProperties.toRequestConfig())
                .audioFormat(this.audioProperties.toFormat())
                .workerExecutor(workerExecutor)
                .publisher(this.publisher)
                .telemetry(this.telemetrySink)
                .build());
    }
}
