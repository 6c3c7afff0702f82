package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.ConversationProperties;
import com.phillippitts.talkback.config.properties.PlaybackProperties;
import com.phillippitts.talkback.domain.CapturedFrame;
import com.phillippitts.talkback.domain.ChatMessage;
import com.phillippitts.talkback.domain.ConversationHistory;
import com.phillippitts.talkback.domain.LlmToken;
import com.phillippitts.talkback.domain.SessionState;
import com.phillippitts.talkback.domain.SttResult;
import com.phillippitts.talkback.domain.VadResult;
import com.phillippitts.talkback.exception.GenerationException;
import com.phillippitts.talkback.exception.ServicesNotConfiguredException;
import com.phillippitts.talkback.exception.SessionStartException;
import com.phillippitts.talkback.exception.TalkBackException;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.audio.AudioLevelMeter;
import com.phillippitts.talkback.service.llm.LlmRequestConfig;
import com.phillippitts.talkback.service.orchestration.event.AssistantResponseCompletedEvent;
import com.phillippitts.talkback.service.orchestration.event.SessionErrorEvent;
import com.phillippitts.talkback.service.stream.ProviderStream;
import com.phillippitts.talkback.service.telemetry.LatencyKind;
import com.phillippitts.talkback.service.telemetry.TelemetryEvent;
import com.phillippitts.talkback.service.telemetry.TelemetrySink;
import com.phillippitts.talkback.util.LogSanitizer;
import com.phillippitts.talkback.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import static com.phillippitts.talkback.config.logging.ThreadContextTaskDecorator.SESSION_ID_KEY;

/**
 * Default {@link ConversationOrchestrator}.
 *
 * <p><b>Threading:</b> every piece of mutable state (history, sentence queue, prefetch maps,
 * timers, trackers, turn bookkeeping) is owned by a private {@link SessionLoop}. Long-running
 * reads (audio frames, transcripts, tokens) and playback run as worker tasks on the injected
 * executor and post their results back to the loop. Public methods hand their work to the loop
 * and wait for it.
 *
 * <p><b>Turn lifecycle:</b>
 * <ol>
 *   <li>User speech is forwarded to speech-to-text; the utterance ends on an end-of-utterance
 *       result or after continuous silence (first trigger wins)</li>
 *   <li>The user message is appended and a {@link TurnContext} starts; tokens stream in and are
 *       segmented into sentences</li>
 *   <li>The first token starts a {@link SpeechPlaybackWorker}; sentences are prefetched and
 *       played in order</li>
 *   <li>After the last sentence a short cooldown hands the floor back to the user</li>
 * </ol>
 *
 * <p><b>Barge-in:</b> qualifying speech while the assistant talks pauses playback
 * ({@code INTERRUPTED}); more qualifying speech inside the confirmation window cancels the turn,
 * otherwise playback resumes.
 *
 * @since 1.0
 */
public final class DefaultConversationOrchestrator implements ConversationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultConversationOrchestrator.class);

    private static final AtomicLong INSTANCE_COUNTER = new AtomicLong();

    private final ConversationProperties conversation;
    private final PlaybackProperties playback;
    private final LlmRequestConfig llmConfig;
    private final AudioFormat audioFormat;
    private final Executor workerExecutor;
    private final ApplicationEventPublisher publisher;
    private final TelemetrySink telemetry;

    private final SessionLoop loop;
    private final TurnStateMachine stateMachine;
    private final ConversationHistory history = new ConversationHistory();
    private final SentenceSegmenter segmenter = new SentenceSegmenter();
    private final SynthesisQueue synthesisQueue;
    private final UtteranceTracker utterance;
    private final BargeInTracker bargeIn;
    private final TimerSlot cooldownTimer;
    private final TimerSlot recoveryTimer;
    private final TimerSlot sessionTimer;

    // Session loop confined
    private SessionServices services;
    private CancellationScope sessionScope;
    private TurnContext turn;
    private long turnCounter;
    private long sessionStartNanos;
    private final StringBuilder responseBuffer = new StringBuilder();

    // Readable from any thread
    private volatile String sessionId;
    private volatile String currentTranscript = "";
    private volatile String currentResponse = "";
    private volatile float audioLevelDb = AudioLevelMeter.FLOOR_DB;

    DefaultConversationOrchestrator(ConversationProperties conversation,
                                    PlaybackProperties playback,
                                    LlmRequestConfig llmConfig,
                                    AudioFormat audioFormat,
                                    Executor workerExecutor,
                                    ApplicationEventPublisher publisher,
                                    TelemetrySink telemetry) {
        this.conversation = Objects.requireNonNull(conversation, "conversation must not be null");
        this.playback = Objects.requireNonNull(playback, "playback must not be null");
        this.llmConfig = Objects.requireNonNull(llmConfig, "llmConfig must not be null");
        this.audioFormat = Objects.requireNonNull(audioFormat, "audioFormat must not be null");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");

        this.loop = new SessionLoop("session-loop-" + INSTANCE_COUNTER.incrementAndGet());
        this.stateMachine = new TurnStateMachine(publisher, () -> sessionId);
        this.synthesisQueue = new SynthesisQueue(new PrefetchCache(loop, workerExecutor), playback.getPrefetchDepth());
        this.utterance = new UtteranceTracker(new TimerSlot("silence", loop));
        this.bargeIn = new BargeInTracker(new TimerSlot("barge-in", loop));
        this.cooldownTimer = new TimerSlot("cooldown", loop);
        this.recoveryTimer = new TimerSlot("error-recovery", loop);
        this.sessionTimer = new TimerSlot("max-session-duration", loop);
    }

    // ---------------------------------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------------------------------

    @Override
    public void startSession(SessionServices services, SessionMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (services == null) {
            throw new ServicesNotConfiguredException(new SessionServices(null, null, null, null).missing());
        }
        List<String> missing = services.missing();
        if (!missing.isEmpty()) {
            throw new ServicesNotConfiguredException(missing);
        }
        awaitOnLoop(() -> {
            doStartSession(services, mode);
            return null;
        });
    }

    @Override
    public void stopSession() {
        if (loop.isClosed()) {
            return;
        }
        awaitOnLoop(() -> {
            doStopSession("stop requested");
            return null;
        });
    }

    @Override
    public boolean injectUtterance(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        Boolean accepted = awaitOnLoop(() -> finalizeUtterance(text.trim(), "injection"));
        return Boolean.TRUE.equals(accepted);
    }

    @Override
    public SessionState state() {
        return stateMachine.current();
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String currentTranscript() {
        return currentTranscript;
    }

    @Override
    public String currentResponse() {
        return currentResponse;
    }

    @Override
    public List<ChatMessage> history() {
        return history.snapshot();
    }

    @Override
    public float audioLevelDb() {
        return audioLevelDb;
    }

    @Override
    public void close() {
        if (loop.isClosed()) {
            return;
        }
        stopSession();
        loop.close();
    }

    // Test hooks: read loop-confined state on the loop

    int queuedSentenceCount() {
        return awaitOnLoop(synthesisQueue::size);
    }

    List<String> queuedSentences() {
        return awaitOnLoop(synthesisQueue::pendingTexts);
    }

    int prefetchedCount() {
        return awaitOnLoop(() -> synthesisQueue.prefetch().cachedCount() + synthesisQueue.prefetch().inFlightCount());
    }

    // ---------------------------------------------------------------------------------------------
    // Session lifecycle (loop)
    // ---------------------------------------------------------------------------------------------

    private void doStartSession(SessionServices newServices, SessionMode mode) {
        if (!stateMachine.is(SessionState.IDLE)) {
            LOG.warn("Session {} already active in state {}; ignoring start", sessionId, stateMachine.current());
            return;
        }

        sessionId = UUID.randomUUID().toString();
        ThreadContext.put(SESSION_ID_KEY, sessionId);
        services = newServices;
        sessionScope = new CancellationScope();

        try {
            services.audioIo().configure(audioFormat);
            services.audioIo().start();
        } catch (RuntimeException e) {
            LOG.error("Audio I/O failed to start", e);
            abortStart();
            throw new SessionStartException("audio", e);
        }

        ProviderStream<SttResult> transcripts;
        try {
            transcripts = sessionScope.track(services.speechToText().startStreaming(audioFormat));
        } catch (RuntimeException e) {
            LOG.error("Speech-to-text stream failed to start", e);
            stopAudioQuietly();
            abortStart();
            throw new SessionStartException("speech-to-text", e);
        }

        CancellationScope scope = sessionScope;
        SessionServices started = services;
        boolean workersStarted = spawn(scope, "audio-frames", () -> consumeFrames(started, scope))
                && spawn(scope, "transcripts", () -> consumeTranscripts(transcripts, scope));
        if (!workersStarted) {
            scope.cancel();
            stopAudioQuietly();
            stopSttQuietly();
            abortStart();
            throw new SessionStartException("workers", new RejectedExecutionException("Worker pool is saturated"));
        }

        history.reset(conversation.getSystemPrompt());
        sessionStartNanos = System.nanoTime();
        telemetry.recordEvent(TelemetryEvent.SESSION_STARTED);
        LOG.info("Session started (mode={}, format={}Hz/{}ch/{}bit)", mode,
                audioFormat.sampleRate(), audioFormat.channels(), audioFormat.bitsPerSample());

        if (conversation.getMaxSessionDurationMs() > 0) {
            sessionTimer.arm(Duration.ofMillis(conversation.getMaxSessionDurationMs()),
                    () -> doStopSession("maximum session duration reached"));
        }

        if (mode == SessionMode.AI_SPEAKS_FIRST) {
            history.appendUser(conversation.getOpeningPrompt());
            beginTurn();
            stateMachine.transitionTo(SessionState.AI_THINKING);
            startGeneration(turn);
        } else {
            stateMachine.transitionTo(SessionState.USER_SPEAKING);
        }
    }

    private void abortStart() {
        if (sessionScope != null) {
            sessionScope.cancel();
        }
        sessionScope = null;
        services = null;
        sessionId = null;
        ThreadContext.remove(SESSION_ID_KEY);
    }

    private void doStopSession(String reason) {
        if (services == null && stateMachine.is(SessionState.IDLE)) {
            LOG.debug("No active session; stop ignored");
            return;
        }

        cancelTurn();
        if (sessionScope != null) {
            sessionScope.cancel();
        }
        utterance.reset();
        bargeIn.clear();
        cooldownTimer.cancel();
        recoveryTimer.cancel();
        sessionTimer.cancel();

        stopAudioQuietly();
        stopSttQuietly();

        telemetry.recordEvent(TelemetryEvent.SESSION_ENDED);
        LOG.info("Session ended ({}) after {}", reason, TimeUtils.formatSeconds(TimeUtils.elapsedSince(sessionStartNanos)));

        history.clear();
        synthesisQueue.clear();
        segmenter.reset();
        responseBuffer.setLength(0);
        currentTranscript = "";
        currentResponse = "";
        audioLevelDb = AudioLevelMeter.FLOOR_DB;
        services = null;
        sessionScope = null;
        turn = null;

        stateMachine.transitionTo(SessionState.IDLE);
        sessionId = null;
        ThreadContext.remove(SESSION_ID_KEY);
    }

    // ---------------------------------------------------------------------------------------------
    // Input: audio frames and transcripts
    // ---------------------------------------------------------------------------------------------

    private void consumeFrames(SessionServices active, CancellationScope scope) {
        ProviderStream<CapturedFrame> frames = null;
        try {
            frames = scope.track(active.audioIo().frames());
            CapturedFrame next;
            while (!scope.isCancelled() && (next = frames.next()) != null) {
                CapturedFrame frame = next;
                audioLevelDb = AudioLevelMeter.levelDb(frame.pcm());
                loop.execute(() -> onFrame(frame, scope));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!scope.isCancelled()) {
                LOG.warn("Audio frame stream failed; input stopped: {}", e.getMessage(), e);
            }
        } finally {
            if (frames != null) {
                scope.release(frames);
            }
        }
    }

    private void consumeTranscripts(ProviderStream<SttResult> transcripts, CancellationScope scope) {
        try {
            SttResult next;
            while (!scope.isCancelled() && (next = transcripts.next()) != null) {
                SttResult result = next;
                loop.execute(() -> onTranscript(result, scope));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!scope.isCancelled()) {
                LOG.warn("Speech-to-text stream failed; transcripts stopped: {}", e.getMessage(), e);
            }
        } finally {
            scope.release(transcripts);
        }
    }

    private void onFrame(CapturedFrame frame, CancellationScope scope) {
        if (scope != sessionScope || scope.isCancelled()) {
            return;
        }
        VadResult vad = frame.vad();
        switch (stateMachine.current()) {
            case USER_SPEAKING -> onUserFrame(frame);
            case AI_SPEAKING -> {
                if (isQualifyingSpeech(vad)) {
                    beginTentativeBargeIn(vad);
                }
            }
            case INTERRUPTED -> {
                if (isQualifyingSpeech(vad)) {
                    confirmBargeIn(frame);
                }
            }
            default -> {
                // Frames are not routed anywhere while the assistant is thinking
            }
        }
    }

    private void onUserFrame(CapturedFrame frame) {
        sendToSpeechToText(frame.pcm());
        if (frame.vad().isSpeech()) {
            utterance.onSpeech();
        } else if (utterance.shouldStartSilenceTimer()) {
            utterance.startSilence(System.nanoTime(),
                    Duration.ofMillis(conversation.getSilenceTimeoutMs()), this::onSilenceTimeout);
        }
    }

    private void sendToSpeechToText(byte[] pcm) {
        try {
            services.speechToText().sendAudio(pcm);
        } catch (RuntimeException e) {
            LOG.warn("Failed to send audio to speech-to-text: {}", e.getMessage());
        }
    }

    private void onTranscript(SttResult result, CancellationScope scope) {
        if (scope != sessionScope || scope.isCancelled()) {
            return;
        }
        telemetry.recordLatency(LatencyKind.STT_EMISSION, result.latency());
        if (!stateMachine.is(SessionState.USER_SPEAKING)) {
            LOG.debug("Transcript ignored in state {}", stateMachine.current());
            return;
        }
        currentTranscript = result.transcript();
        String text = result.transcript().trim();
        if (result.isFinal() && result.isEndOfUtterance() && !text.isEmpty()) {
            finalizeUtterance(text, "end-of-utterance");
        }
    }

    private void onSilenceTimeout() {
        if (!stateMachine.is(SessionState.USER_SPEAKING)) {
            return;
        }
        String silence = TimeUtils.formatSeconds(utterance.silenceDuration(System.nanoTime()));
        String text = currentTranscript.trim();
        if (text.isEmpty()) {
            LOG.warn("Silence timeout after {} of silence but transcript is empty; speech-to-text may be unresponsive",
                    silence);
            return;
        }
        LOG.debug("Silence timeout after {} of silence", silence);
        finalizeUtterance(text, "silence");
    }

    /**
     * Ends the user's utterance and starts the assistant turn. Only the first trigger while the
     * user has the floor takes effect.
     *
     * @return {@code true} if the utterance was finalized
     */
    private boolean finalizeUtterance(String text, String trigger) {
        if (!stateMachine.is(SessionState.USER_SPEAKING)) {
            LOG.debug("Finalize via {} ignored in state {}", trigger, stateMachine.current());
            return false;
        }
        utterance.reset();
        history.appendUser(text);
        telemetry.recordEvent(TelemetryEvent.USER_FINISHED_SPEAKING);
        LOG.info("User utterance finalized via {}: \"{}\"", trigger, LogSanitizer.preview(text));

        stateMachine.transitionTo(SessionState.PROCESSING_USER_UTTERANCE);
        beginTurn();
        stateMachine.transitionTo(SessionState.AI_THINKING);
        startGeneration(turn);
        return true;
    }

    // ---------------------------------------------------------------------------------------------
    // Generation: token stream and sentence segmentation
    // ---------------------------------------------------------------------------------------------

    private void beginTurn() {
        cancelTurn();
        turn = new TurnContext(++turnCounter, System.nanoTime());
        synthesisQueue.clear();
        segmenter.reset();
        responseBuffer.setLength(0);
        currentResponse = "";
    }

    private void cancelTurn() {
        if (turn != null) {
            turn.cancel();
        }
    }

    private boolean isCurrent(TurnContext candidate) {
        return candidate == turn && !candidate.isCancelled();
    }

    private void startGeneration(TurnContext current) {
        List<ChatMessage> messages = history.snapshot();
        SessionServices active = services;
        if (!spawn(current.scope(), "generation", () -> consumeTokens(current, active, messages))) {
            onGenerationFailed(current, new GenerationException("Worker pool rejected the generation task"));
        }
    }

    private void consumeTokens(TurnContext current, SessionServices active, List<ChatMessage> messages) {
        ProviderStream<LlmToken> tokens = null;
        try {
            tokens = current.scope().track(active.languageModel().streamCompletion(messages, llmConfig));
            LlmToken next;
            while (!current.isCancelled() && (next = tokens.next()) != null) {
                LlmToken token = next;
                loop.execute(() -> onToken(current, token));
                if (token.isDone()) {
                    break;
                }
            }
            if (!current.isCancelled()) {
                loop.execute(() -> onGenerationComplete(current));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!current.isCancelled()) {
                GenerationException failure = new GenerationException("Language model stream failed: " + e.getMessage(), e);
                loop.execute(() -> onGenerationFailed(current, failure));
            }
        } finally {
            if (tokens != null) {
                current.scope().release(tokens);
            }
        }
    }

    private void onToken(TurnContext current, LlmToken token) {
        if (!isCurrent(current)) {
            return;
        }
        if (current.markFirstToken()) {
            Duration ttft = TimeUtils.elapsedSince(current.startNanos());
            telemetry.recordLatency(LatencyKind.LLM_FIRST_TOKEN, ttft);
            telemetry.recordEvent(TelemetryEvent.LLM_FIRST_TOKEN_RECEIVED);
            LOG.info("First token of turn {} after {} ms", current.id(), ttft.toMillis());
            if (stateMachine.transitionTo(SessionState.AI_SPEAKING)) {
                startPlayback(current);
            }
        }

        responseBuffer.append(token.content());
        currentResponse = responseBuffer.toString();
        for (String sentence : segmenter.append(token.content())) {
            enqueueSentence(current, sentence);
        }
    }

    private void enqueueSentence(TurnContext current, String text) {
        QueuedSentence sentence = synthesisQueue.enqueue(text);
        current.incrementSentenceCount();
        LOG.debug("Queued sentence #{}: \"{}\"", sentence.sequence(), LogSanitizer.preview(text));
        if (playback.isEagerPrefetch()) {
            synthesisQueue.prefetchNow(sentence, services.speechSynthesis(), current.scope());
        }
    }

    private void onGenerationComplete(TurnContext current) {
        if (!isCurrent(current)) {
            return;
        }
        segmenter.flush().ifPresent(fragment -> enqueueSentence(current, fragment));
        String response = responseBuffer.toString().trim();
        if (response.isEmpty()) {
            onGenerationFailed(current, new GenerationException("Language model returned an empty response"));
            return;
        }
        history.appendAssistant(response);
        synthesisQueue.markGenerationComplete();
        LOG.info("Assistant response complete: {} sentences, {} chars", current.sentenceCount(), response.length());
        publisher.publishEvent(new AssistantResponseCompletedEvent(
                sessionId, current.sentenceCount(), response.length(), Instant.now()));
    }

    private void onGenerationFailed(TurnContext current, GenerationException failure) {
        if (!isCurrent(current)) {
            return;
        }
        LOG.error("Response generation failed: {}", failure.getMessage(), failure);
        telemetry.recordEvent(TelemetryEvent.GENERATION_FAILED);

        SessionState previous = stateMachine.current();
        cancelTurn();
        bargeIn.clear();
        cooldownTimer.cancel();
        synthesisQueue.clear();
        segmenter.reset();
        responseBuffer.setLength(0);
        currentResponse = "";
        if (previous == SessionState.AI_SPEAKING || previous == SessionState.INTERRUPTED) {
            stopPlaybackQuietly();
        }

        stateMachine.transitionTo(SessionState.ERROR);
        publisher.publishEvent(new SessionErrorEvent(sessionId,
                "Sorry, I couldn't come up with a response. Please try again.", Instant.now()));
        recoveryTimer.arm(Duration.ofMillis(conversation.getErrorRecoveryDelayMs()), this::recoverFromError);
    }

    private void recoverFromError() {
        if (!stateMachine.is(SessionState.ERROR)) {
            return;
        }
        utterance.reset();
        currentTranscript = "";
        stateMachine.transitionTo(SessionState.USER_SPEAKING);
        LOG.info("Recovered from error; listening again");
    }

    // ---------------------------------------------------------------------------------------------
    // Playback
    // ---------------------------------------------------------------------------------------------

    private void startPlayback(TurnContext current) {
        SessionServices active = services;
        SpeechPlaybackWorker worker = new SpeechPlaybackWorker(
                current,
                loop,
                () -> nextPlaybackStep(current, active),
                active.audioIo(),
                active.speechSynthesis(),
                telemetry,
                Duration.ofMillis(conversation.getQueuePollIntervalMs()),
                Duration.ofMillis(playback.getInterSentenceSilenceMs()),
                this::onPlaybackFinished);
        if (!spawn(current.scope(), "playback", worker)) {
            onGenerationFailed(current, new GenerationException("Worker pool rejected the playback task"));
        }
    }

    private PlaybackStep nextPlaybackStep(TurnContext current, SessionServices active) {
        if (!isCurrent(current)) {
            return PlaybackStep.done();
        }
        return synthesisQueue.nextStep(active.speechSynthesis(), current.scope());
    }

    private void onPlaybackFinished(TurnContext current) {
        if (!isCurrent(current)) {
            return;
        }
        synthesisQueue.clearPrefetch();
        current.markPlaybackFinished();
        Duration endToEnd = TimeUtils.elapsedSince(current.startNanos());
        telemetry.recordLatency(LatencyKind.END_TO_END_TURN, endToEnd);
        telemetry.recordEvent(TelemetryEvent.AI_FINISHED_SPEAKING);
        LOG.info("Assistant finished speaking turn {} ({} ms end-to-end)", current.id(), endToEnd.toMillis());
        if (stateMachine.is(SessionState.AI_SPEAKING)) {
            armCooldown(current);
        }
    }

    private void armCooldown(TurnContext current) {
        cooldownTimer.arm(Duration.ofMillis(conversation.getPostTurnCooldownMs()), () -> {
            if (current != turn || !stateMachine.is(SessionState.AI_SPEAKING)) {
                return;
            }
            utterance.reset();
            currentTranscript = "";
            stateMachine.transitionTo(SessionState.USER_SPEAKING);
        });
    }

    // ---------------------------------------------------------------------------------------------
    // Barge-in
    // ---------------------------------------------------------------------------------------------

    private boolean isQualifyingSpeech(VadResult vad) {
        return conversation.isEnableInterruptions()
                && vad.isSpeech()
                && vad.confidence() > conversation.getBargeInThreshold();
    }

    private void beginTentativeBargeIn(VadResult vad) {
        if (bargeIn.isTentative()) {
            return;
        }
        boolean paused;
        try {
            paused = services.audioIo().pausePlayback();
        } catch (RuntimeException e) {
            LOG.warn("Pausing playback failed: {}", e.getMessage());
            return;
        }
        if (!paused) {
            LOG.debug("Speech during AI turn but nothing was playing; not pausing");
            return;
        }
        telemetry.recordEvent(TelemetryEvent.PLAYBACK_PAUSED);
        LOG.debug("Tentative barge-in (confidence {}); playback paused", vad.confidence());
        stateMachine.transitionTo(SessionState.INTERRUPTED);
        bargeIn.beginTentative(Duration.ofMillis(conversation.getBargeInConfirmationMs()), this::onBargeInWindowElapsed);
    }

    private void onBargeInWindowElapsed() {
        if (!stateMachine.is(SessionState.INTERRUPTED)) {
            return;
        }
        bargeIn.clear();
        try {
            if (!services.audioIo().resumePlayback()) {
                LOG.debug("Resume reported nothing to resume");
            }
        } catch (RuntimeException e) {
            LOG.warn("Resuming playback failed: {}", e.getMessage());
        }
        telemetry.recordEvent(TelemetryEvent.PLAYBACK_RESUMED);
        LOG.debug("Barge-in not confirmed; playback resumed");
        stateMachine.transitionTo(SessionState.AI_SPEAKING);
        if (turn != null && turn.isPlaybackFinished()) {
            armCooldown(turn);
        }
    }

    private void confirmBargeIn(CapturedFrame frame) {
        bargeIn.clear();
        telemetry.recordEvent(TelemetryEvent.USER_INTERRUPTED);
        LOG.info("User interrupted the assistant");

        cancelTurn();
        stopPlaybackQuietly();
        synthesisQueue.clear();
        if (conversation.isFlushSynthesisOnInterrupt()) {
            try {
                services.speechSynthesis().flush();
            } catch (RuntimeException e) {
                LOG.warn("Flushing speech synthesis failed: {}", e.getMessage());
            }
        }
        cooldownTimer.cancel();
        segmenter.reset();
        responseBuffer.setLength(0);
        currentResponse = "";
        currentTranscript = "";

        stateMachine.transitionTo(SessionState.USER_SPEAKING);
        utterance.reset();
        // The confirming frame is the start of the user's utterance
        onUserFrame(frame);
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    private boolean spawn(CancellationScope scope, String name, Runnable task) {
        FutureTask<Void> future = new FutureTask<>(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Conversation worker '{}' failed", name, e);
            }
        }, null) {
            @Override
            protected void done() {
                scope.untrack(this);
            }
        };
        scope.track(future);
        try {
            workerExecutor.execute(future);
            return true;
        } catch (RejectedExecutionException e) {
            scope.untrack(future);
            LOG.error("Worker pool rejected '{}' task", name, e);
            return false;
        }
    }

    private void stopPlaybackQuietly() {
        try {
            services.audioIo().stopPlayback();
        } catch (RuntimeException e) {
            LOG.warn("Stopping playback failed: {}", e.getMessage());
        }
    }

    private void stopAudioQuietly() {
        if (services == null) {
            return;
        }
        try {
            services.audioIo().stop();
        } catch (RuntimeException e) {
            LOG.warn("Stopping audio I/O failed: {}", e.getMessage());
        }
    }

    private void stopSttQuietly() {
        if (services == null) {
            return;
        }
        try {
            services.speechToText().stopStreaming();
        } catch (RuntimeException e) {
            LOG.warn("Stopping speech-to-text failed: {}", e.getMessage());
        }
    }

    private <T> T awaitOnLoop(Callable<T> task) {
        try {
            return loop.call(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TalkBackException("Interrupted while waiting for the session loop", e);
        }
    }
}
