package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.ConversationProperties;
import com.phillippitts.talkback.domain.SessionState;
import com.phillippitts.talkback.testutil.EventCapturingPublisher;
import com.phillippitts.talkback.testutil.FakeAudioIo;
import com.phillippitts.talkback.testutil.FakeLanguageModelService;
import com.phillippitts.talkback.testutil.FakeSpeechSynthesisService;
import com.phillippitts.talkback.testutil.FakeSpeechToTextService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationSessionFactoryTest {

    private ExecutorService executor;
    private ConversationSessionFactory factory;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        factory = new ConversationSessionFactory(() -> ConversationOrchestratorBuilder.builder()
                .conversationProperties(ConversationProperties.defaults())
                .workerExecutor(executor)
                .publisher(new EventCapturingPublisher())
                .build());
    }

    @AfterEach
    void tearDown() {
        factory.closeAll();
        executor.shutdownNow();
    }

    @Test
    void shouldCreateIndependentIdleOrchestrators() {
        ConversationOrchestrator first = factory.create();
        ConversationOrchestrator second = factory.create();

        assertThat(first).isNotSameAs(second);
        assertThat(first.state()).isEqualTo(SessionState.IDLE);
        assertThat(factory.openOrchestrators()).containsExactlyInAnyOrder(first, second);
    }

    @Test
    void shouldForgetOrchestratorOnClose() {
        ConversationOrchestrator orchestrator = factory.create();

        orchestrator.close();

        assertThat(factory.openOrchestrators()).isEmpty();
    }

    @Test
    void shouldStopRunningSessionsOnCloseAll() {
        // Arrange
        FakeAudioIo audio = new FakeAudioIo();
        ConversationOrchestrator orchestrator = factory.create();
        orchestrator.startSession(new SessionServices(audio, new FakeSpeechToTextService(),
                new FakeLanguageModelService(), new FakeSpeechSynthesisService()), SessionMode.USER_SPEAKS_FIRST);

        // Act
        factory.closeAll();

        // Assert
        assertThat(orchestrator.state()).isEqualTo(SessionState.IDLE);
        assertThat(audio.stopCount.get()).isEqualTo(1);
        assertThat(factory.openOrchestrators()).isEmpty();
    }

    @Test
    void shouldRequireCoreDependencies() {
        assertThatThrownBy(() -> ConversationOrchestratorBuilder.builder()
                .conversationProperties(ConversationProperties.defaults())
                .build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("workerExecutor");
    }
}
