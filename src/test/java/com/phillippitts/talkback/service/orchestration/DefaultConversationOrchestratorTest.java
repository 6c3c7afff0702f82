package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.ConversationProperties;
import com.phillippitts.talkback.config.properties.PlaybackProperties;
import com.phillippitts.talkback.domain.ChatMessage;
import com.phillippitts.talkback.domain.LlmToken;
import com.phillippitts.talkback.domain.SessionState;
import com.phillippitts.talkback.domain.SttResult;
import com.phillippitts.talkback.exception.ServicesNotConfiguredException;
import com.phillippitts.talkback.exception.SessionStartException;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.orchestration.event.AssistantResponseCompletedEvent;
import com.phillippitts.talkback.service.orchestration.event.SessionErrorEvent;
import com.phillippitts.talkback.service.telemetry.LatencyKind;
import com.phillippitts.talkback.service.telemetry.TelemetryEvent;
import com.phillippitts.talkback.testutil.EventCapturingPublisher;
import com.phillippitts.talkback.testutil.FakeAudioIo;
import com.phillippitts.talkback.testutil.FakeLanguageModelService;
import com.phillippitts.talkback.testutil.FakeSpeechSynthesisService;
import com.phillippitts.talkback.testutil.FakeSpeechToTextService;
import com.phillippitts.talkback.testutil.QueueProviderStream;
import com.phillippitts.talkback.testutil.RecordingTelemetrySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Behavioral tests for {@link DefaultConversationOrchestrator} with fake providers on real threads.
 */
class DefaultConversationOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeAudioIo audio;
    private FakeSpeechToTextService stt;
    private FakeLanguageModelService llm;
    private FakeSpeechSynthesisService tts;
    private EventCapturingPublisher publisher;
    private RecordingTelemetrySink telemetry;
    private ExecutorService executor;
    private DefaultConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        audio = new FakeAudioIo();
        stt = new FakeSpeechToTextService();
        llm = new FakeLanguageModelService();
        tts = new FakeSpeechSynthesisService();
        publisher = new EventCapturingPublisher();
        telemetry = new RecordingTelemetrySink();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (audio.playPermits != null) {
            audio.playPermits.release(1000);
        }
        if (orchestrator != null) {
            orchestrator.close();
        }
        executor.shutdownNow();
    }

    private static ConversationProperties fastProperties() {
        return new ConversationProperties(300, 600, 100, 200, 10, null, null, null, null, null, 0L);
    }

    private DefaultConversationOrchestrator create(ConversationProperties conversation, PlaybackProperties playback) {
        orchestrator = ConversationOrchestratorBuilder.builder()
                .conversationProperties(conversation)
                .playbackProperties(playback)
                .workerExecutor(executor)
                .publisher(publisher)
                .telemetry(telemetry)
                .build();
        return orchestrator;
    }

    private DefaultConversationOrchestrator createFast() {
        return create(fastProperties(), PlaybackProperties.of(PlaybackProperties.Preset.DEFAULT));
    }

    private SessionServices services() {
        return new SessionServices(audio, stt, llm, tts);
    }

    private List<String> userMessages() {
        return orchestrator.history().stream()
                .filter(m -> m.role() == ChatMessage.Role.USER)
                .map(ChatMessage::content)
                .toList();
    }

    private void awaitState(SessionState state) {
        await().atMost(TIMEOUT).until(() -> orchestrator.state() == state);
    }

    // ---------------------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldFailFastWhenServicesAreMissing() {
        // Arrange
        createFast();

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.startSession(new SessionServices(audio, null, llm, null),
                SessionMode.USER_SPEAKS_FIRST))
                .isInstanceOf(ServicesNotConfiguredException.class)
                .satisfies(e -> assertThat(((ServicesNotConfiguredException) e).getMissingServices())
                        .containsExactly("speechToText", "speechSynthesis"));
        assertThat(orchestrator.state()).isEqualTo(SessionState.IDLE);
        assertThat(audio.configureCount.get()).isZero();
        assertThat(publisher.enteredStates()).isEmpty();
    }

    @Test
    void shouldStartListeningInUserSpeaksFirstMode() {
        // Arrange
        createFast();

        // Act
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Assert
        assertThat(orchestrator.state()).isEqualTo(SessionState.USER_SPEAKING);
        assertThat(orchestrator.sessionId()).isNotBlank();
        assertThat(audio.configuredFormat).isEqualTo(AudioFormat.DEFAULT);
        assertThat(audio.startCount.get()).isEqualTo(1);
        assertThat(stt.startCount.get()).isEqualTo(1);
        assertThat(orchestrator.history()).hasSize(1);
        assertThat(orchestrator.history().get(0).role()).isEqualTo(ChatMessage.Role.SYSTEM);
        assertThat(telemetry.count(TelemetryEvent.SESSION_STARTED)).isEqualTo(1);
    }

    @Test
    void shouldStayIdleWhenAudioFailsToStart() {
        // Arrange
        createFast();
        audio.startException = new IllegalStateException("no microphone");

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST))
                .isInstanceOf(SessionStartException.class)
                .satisfies(e -> assertThat(((SessionStartException) e).getStage()).isEqualTo("audio"));
        assertThat(orchestrator.state()).isEqualTo(SessionState.IDLE);
        assertThat(orchestrator.sessionId()).isNull();
        assertThat(stt.startCount.get()).isZero();
    }

    @Test
    void shouldStopAudioWhenSpeechToTextFailsToStart() {
        // Arrange
        createFast();
        stt.startException = new IllegalStateException("recognizer unavailable");

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST))
                .isInstanceOf(SessionStartException.class);
        assertThat(orchestrator.state()).isEqualTo(SessionState.IDLE);
        assertThat(audio.stopCount.get()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreSecondStartWhileActive() {
        // Arrange
        createFast();
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);
        String firstSession = orchestrator.sessionId();

        // Act
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Assert
        assertThat(orchestrator.sessionId()).isEqualTo(firstSession);
        assertThat(audio.startCount.get()).isEqualTo(1);
    }

    @Test
    void shouldReachSameIdleStateWhenStoppedTwice() {
        // Arrange
        createFast();
        QueueProviderStream<LlmToken> pending = llm.respondManually();
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);
        orchestrator.injectUtterance("Hello");
        awaitState(SessionState.AI_THINKING);
        await().atMost(TIMEOUT).until(() -> llm.requests.size() == 1);

        // Act
        orchestrator.stopSession();
        orchestrator.stopSession();

        // Assert
        assertThat(orchestrator.state()).isEqualTo(SessionState.IDLE);
        assertThat(orchestrator.history()).isEmpty();
        assertThat(telemetry.count(TelemetryEvent.SESSION_ENDED)).isEqualTo(1);
        assertThat(audio.stopCount.get()).isEqualTo(1);
        assertThat(stt.stopCount.get()).isEqualTo(1);
        await().atMost(TIMEOUT).until(pending::isClosed);
        assertThat(publisher.enteredStates()).containsExactly(
                SessionState.USER_SPEAKING,
                SessionState.PROCESSING_USER_UTTERANCE,
                SessionState.AI_THINKING,
                SessionState.IDLE);
    }

    @Test
    void shouldStopSessionWhenMaximumDurationElapses() {
        // Arrange
        create(new ConversationProperties(300, 600, 100, 200, 10, null, null, null, null, null, 300L),
                PlaybackProperties.of(PlaybackProperties.Preset.DEFAULT));

        // Act
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Assert
        awaitState(SessionState.IDLE);
        assertThat(telemetry.count(TelemetryEvent.SESSION_ENDED)).isEqualTo(1);
    }

    @Test
    void shouldRejectInjectedUtteranceWhenIdle() {
        createFast();

        assertThat(orchestrator.injectUtterance("Hello")).isFalse();
        assertThat(llm.requests).isEmpty();
    }

    // ---------------------------------------------------------------------------------------------
    // Utterance completion
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldFinalizeUtteranceOnceAfterSilenceTimeout() {
        // Arrange
        create(ConversationProperties.defaults(), PlaybackProperties.of(PlaybackProperties.Preset.DEFAULT));
        llm.respondManually();
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);
        stt.emit(SttResult.partial("What is photosynthesis"));
        await().atMost(TIMEOUT).until(() -> "What is photosynthesis".equals(orchestrator.currentTranscript()));

        // Act
        audio.speech(0.9f);
        audio.silence();

        // Assert
        awaitState(SessionState.AI_THINKING);
        assertThat(userMessages()).containsExactly("What is photosynthesis");
        assertThat(publisher.enteredStates()).containsExactly(
                SessionState.USER_SPEAKING,
                SessionState.PROCESSING_USER_UTTERANCE,
                SessionState.AI_THINKING);

        // Late triggers are no-ops
        stt.emit(SttResult.endOfUtterance("What is photosynthesis"));
        audio.silence();
        await().during(Duration.ofMillis(1800)).atMost(TIMEOUT)
                .until(() -> llm.requests.size() == 1 && userMessages().size() == 1);
        assertThat(telemetry.count(TelemetryEvent.USER_FINISHED_SPEAKING)).isEqualTo(1);
    }

    @Test
    void shouldFinalizeImmediatelyOnEndOfUtteranceResult() {
        // Arrange
        createFast();
        llm.respondManually();
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);
        audio.speech(0.9f);
        audio.silence();

        // Act
        stt.emit(SttResult.endOfUtterance("  Hello there  "));

        // Assert
        awaitState(SessionState.AI_THINKING);
        await().during(Duration.ofMillis(500)).atMost(TIMEOUT).until(() -> userMessages().size() == 1);
        assertThat(userMessages()).containsExactly("Hello there");
        assertThat(llm.requests).hasSize(1);
        assertThat(llm.requests.get(0)).extracting(ChatMessage::role)
                .containsExactly(ChatMessage.Role.SYSTEM, ChatMessage.Role.USER);
        assertThat(telemetry.latencyCount(LatencyKind.STT_EMISSION)).isEqualTo(1);
    }

    @Test
    void shouldNotFinalizeWhenSilenceFollowsSpeechWithEmptyTranscript() {
        // Arrange
        createFast();
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        audio.speech(0.9f);
        audio.silence();

        // Assert
        await().during(Duration.ofMillis(700)).atMost(TIMEOUT)
                .until(() -> orchestrator.state() == SessionState.USER_SPEAKING);
        assertThat(userMessages()).isEmpty();
        assertThat(stt.sendCount.get()).isEqualTo(2);
    }

    @Test
    void shouldKeepListeningWhenSendingAudioFails() {
        // Arrange
        createFast();
        llm.respondManually();
        stt.sendException = new IllegalStateException("socket closed");
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        audio.speech(0.9f);
        stt.emit(SttResult.endOfUtterance("Still works"));

        // Assert
        awaitState(SessionState.AI_THINKING);
        assertThat(userMessages()).containsExactly("Still works");
    }

    @Test
    void shouldReportInputLevelOfLastFrame() {
        // Arrange
        createFast();
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        audio.speech(0.9f);

        // Assert
        await().atMost(TIMEOUT).until(() -> orchestrator.audioLevelDb() > -10.0f);
    }

    // ---------------------------------------------------------------------------------------------
    // Generation and playback
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldSpeakTwoSentencesInOrderAndHandBackTheFloor() {
        // Arrange
        createFast();
        llm.respondWith("The answer is 4.", " Got it?");
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        orchestrator.injectUtterance("What is two plus two");

        // Assert
        await().atMost(TIMEOUT).until(() -> audio.played.size() == 2
                && orchestrator.state() == SessionState.USER_SPEAKING);
        assertThat(audio.playedTexts()).containsExactly("The answer is 4.", "Got it?");
        assertThat(orchestrator.history()).last()
                .isEqualTo(ChatMessage.assistant("The answer is 4. Got it?"));
        assertThat(publisher.eventsOf(AssistantResponseCompletedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.sentenceCount()).isEqualTo(2));
        assertThat(publisher.enteredStates()).containsSubsequence(
                SessionState.PROCESSING_USER_UTTERANCE,
                SessionState.AI_THINKING,
                SessionState.AI_SPEAKING,
                SessionState.USER_SPEAKING);
        assertThat(telemetry.latencyCount(LatencyKind.LLM_FIRST_TOKEN)).isEqualTo(1);
        assertThat(telemetry.latencyCount(LatencyKind.TTS_FIRST_BYTE)).isEqualTo(1);
        assertThat(telemetry.latencyCount(LatencyKind.END_TO_END_TURN)).isEqualTo(1);
        assertThat(telemetry.count(TelemetryEvent.AI_FINISHED_SPEAKING)).isEqualTo(1);
        assertThat(orchestrator.currentResponse()).isEqualTo("The answer is 4. Got it?");
        assertThat(orchestrator.prefetchedCount()).isZero();
    }

    @Test
    void shouldPlayInQueueOrderWhenEarlierSynthesisIsSlower() {
        // Arrange
        create(fastProperties(), PlaybackProperties.of(PlaybackProperties.Preset.LOW_LATENCY));
        tts.delay("One.", 400).delay("Two.", 200);
        llm.respondWith("One. Two. Three. Four.");
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        orchestrator.injectUtterance("Count to four");

        // Assert
        await().atMost(TIMEOUT).until(() -> audio.played.size() == 4);
        assertThat(audio.playedTexts()).containsExactly("One.", "Two.", "Three.", "Four.");
        assertThat(tts.countFor("One.")).isEqualTo(1);
    }

    @Test
    void shouldPrefetchOnlyOneSentenceAheadWhenDepthIsOne() {
        // Arrange
        create(fastProperties(), new PlaybackProperties(PlaybackProperties.Preset.DEFAULT, true, 1, 0, false));
        audio.playPermits = new Semaphore(0);
        llm.respondWith("Alpha one. Bravo two. Charlie three.");
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        orchestrator.injectUtterance("Spell it");

        // Assert: while Alpha plays only Bravo is prefetched
        await().atMost(TIMEOUT).until(() -> tts.synthesized.size() == 2);
        assertThat(tts.synthesized).containsExactlyInAnyOrder("Alpha one.", "Bravo two.");
        await().during(Duration.ofMillis(300)).atMost(TIMEOUT)
                .until(() -> !tts.synthesized.contains("Charlie three."));

        // Bravo starts playing, Charlie gets prefetched
        audio.playPermits.release();
        await().atMost(TIMEOUT).until(() -> tts.synthesized.contains("Charlie three."));

        audio.playPermits.release(10);
        await().atMost(TIMEOUT).until(() -> audio.played.size() == 3);
        assertThat(audio.playedTexts()).containsExactly("Alpha one.", "Bravo two.", "Charlie three.");
        assertThat(tts.synthesized).hasSize(3);
    }

    @Test
    void shouldOpenWithLectureInAiSpeaksFirstMode() {
        // Arrange
        createFast();
        llm.respondWith("Welcome to today's lecture.");

        // Act
        orchestrator.startSession(services(), SessionMode.AI_SPEAKS_FIRST);

        // Assert
        await().atMost(TIMEOUT).until(() -> audio.played.size() == 1
                && orchestrator.state() == SessionState.USER_SPEAKING);
        assertThat(publisher.enteredStates().get(0)).isEqualTo(SessionState.AI_THINKING);
        assertThat(llm.requests.get(0)).extracting(ChatMessage::content)
                .endsWith("Please begin the lecture now.");
        assertThat(stt.startCount.get()).isEqualTo(1);
    }

    @Test
    void shouldRecoverToListeningAfterGenerationFailure() {
        // Arrange
        createFast();
        llm.failWith(new IllegalStateException("provider down"));
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        orchestrator.injectUtterance("Hello");

        // Assert
        await().atMost(TIMEOUT).until(() -> publisher.enteredStates().contains(SessionState.ERROR)
                && orchestrator.state() == SessionState.USER_SPEAKING);
        assertThat(publisher.enteredStates()).containsSubsequence(
                SessionState.AI_THINKING, SessionState.ERROR, SessionState.USER_SPEAKING);
        assertThat(publisher.eventsOf(SessionErrorEvent.class)).hasSize(1);
        assertThat(orchestrator.history()).extracting(ChatMessage::role)
                .containsExactly(ChatMessage.Role.SYSTEM, ChatMessage.Role.USER);
        assertThat(telemetry.count(TelemetryEvent.GENERATION_FAILED)).isEqualTo(1);
        assertThat(orchestrator.currentResponse()).isEmpty();
    }

    @Test
    void shouldTreatEmptyResponseAsFailure() {
        // Arrange
        createFast();
        llm.respondWith("   ");
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);

        // Act
        orchestrator.injectUtterance("Hello");

        // Assert
        await().atMost(TIMEOUT).until(() -> publisher.enteredStates().contains(SessionState.ERROR)
                && orchestrator.state() == SessionState.USER_SPEAKING);
        assertThat(audio.stopPlaybackCount.get()).isEqualTo(1);
        assertThat(orchestrator.history()).hasSize(2);
    }

    // ---------------------------------------------------------------------------------------------
    // Barge-in
    // ---------------------------------------------------------------------------------------------

    private void speakHeldResponse(String... tokens) {
        audio.playPermits = new Semaphore(0);
        llm.respondWith(tokens);
        orchestrator.startSession(services(), SessionMode.USER_SPEAKS_FIRST);
        orchestrator.injectUtterance("Tell me a story");
        awaitState(SessionState.AI_SPEAKING);
    }

    @Test
    void shouldResumePlaybackWhenBargeInIsNotConfirmed() {
        // Arrange
        createFast();
        speakHeldResponse("Once upon a time. There was a fox.");

        // Act
        audio.speech(0.9f);

        // Assert
        awaitState(SessionState.INTERRUPTED);
        await().atMost(TIMEOUT).until(() -> audio.resumeCount.get() == 1
                && orchestrator.state() == SessionState.AI_SPEAKING);
        await().during(Duration.ofMillis(300)).atMost(TIMEOUT)
                .until(() -> orchestrator.state() == SessionState.AI_SPEAKING);
        assertThat(audio.pauseCount.get()).isEqualTo(1);
        assertThat(audio.resumeCount.get()).isEqualTo(1);
        assertThat(audio.stopPlaybackCount.get()).isZero();
        assertThat(telemetry.count(TelemetryEvent.USER_INTERRUPTED)).isZero();
        assertThat(telemetry.events).containsSubsequence(
                TelemetryEvent.PLAYBACK_PAUSED, TelemetryEvent.PLAYBACK_RESUMED);
        assertThat(telemetry.count(TelemetryEvent.PLAYBACK_PAUSED)).isEqualTo(1);
        assertThat(telemetry.count(TelemetryEvent.PLAYBACK_RESUMED)).isEqualTo(1);
    }

    @Test
    void shouldStopEverythingWhenBargeInIsConfirmed() {
        // Arrange
        createFast();
        speakHeldResponse("Once upon a time. There was a fox. It was quick. The end.");
        audio.speech(0.9f);
        awaitState(SessionState.INTERRUPTED);

        // Act
        audio.speech(0.95f);

        // Assert
        awaitState(SessionState.USER_SPEAKING);
        assertThat(audio.stopPlaybackCount.get()).isEqualTo(1);
        assertThat(telemetry.count(TelemetryEvent.USER_INTERRUPTED)).isEqualTo(1);
        assertThat(orchestrator.queuedSentenceCount()).isZero();
        assertThat(orchestrator.prefetchedCount()).isZero();
        assertThat(tts.flushCount.get()).isEqualTo(1);
        assertThat(orchestrator.currentResponse()).isEmpty();
        await().during(Duration.ofMillis(800)).atMost(TIMEOUT)
                .until(() -> audio.resumeCount.get() == 0 && orchestrator.state() == SessionState.USER_SPEAKING);
    }

    @Test
    void shouldIgnoreLowConfidenceSpeechWhileAssistantSpeaks() {
        // Arrange
        createFast();
        speakHeldResponse("Once upon a time.");

        // Act
        audio.speech(0.5f);
        audio.speech(0.7f);

        // Assert
        await().during(Duration.ofMillis(300)).atMost(TIMEOUT)
                .until(() -> orchestrator.state() == SessionState.AI_SPEAKING);
        assertThat(audio.pauseCount.get()).isZero();
    }

    @Test
    void shouldNotInterruptWhenInterruptionsAreDisabled() {
        // Arrange
        create(new ConversationProperties(300, 600, 100, 200, 10, null, false, null, null, null, 0L),
                PlaybackProperties.of(PlaybackProperties.Preset.DEFAULT));
        speakHeldResponse("Once upon a time.");

        // Act
        audio.speech(0.99f);

        // Assert
        await().during(Duration.ofMillis(300)).atMost(TIMEOUT)
                .until(() -> orchestrator.state() == SessionState.AI_SPEAKING);
        assertThat(audio.pauseCount.get()).isZero();
    }

    @Test
    void shouldStayInAiSpeakingWhenNothingWasPlayingToPause() {
        // Arrange
        createFast();
        audio.pauseResult = false;
        speakHeldResponse("Once upon a time.");

        // Act
        audio.speech(0.9f);

        // Assert
        await().during(Duration.ofMillis(300)).atMost(TIMEOUT)
                .until(() -> orchestrator.state() == SessionState.AI_SPEAKING);
        assertThat(audio.pauseCount.get()).isEqualTo(1);
        assertThat(publisher.enteredStates()).doesNotContain(SessionState.INTERRUPTED);
    }
}
