package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.service.audio.AudioIo;
import com.phillippitts.talkback.service.stream.ProviderStream;
import com.phillippitts.talkback.service.telemetry.LatencyKind;
import com.phillippitts.talkback.service.telemetry.TelemetrySink;
import com.phillippitts.talkback.service.tts.SpeechSynthesisService;
import com.phillippitts.talkback.service.tts.SynthesizedSpeech;
import com.phillippitts.talkback.util.LogSanitizer;
import com.phillippitts.talkback.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Plays the sentences of one turn strictly in queue order.
 *
 * <p>One worker runs per turn. Each iteration asks the session loop for the next
 * {@link PlaybackStep}, then plays cached audio, awaits an in-flight prefetch, or synthesizes the
 * sentence cold while streaming its chunks to the speaker. The worker exits when the queue is
 * drained and generation is complete, or silently when the turn is cancelled.
 *
 * <p>A failing chunk or sentence is logged and skipped; the turn continues.
 */
final class SpeechPlaybackWorker implements Runnable {

    private static final Logger LOG = LogManager.getLogger(SpeechPlaybackWorker.class);

    private final TurnContext turn;
    private final SessionLoop loop;
    private final Callable<PlaybackStep> stepSource;
    private final AudioIo audioIo;
    private final SpeechSynthesisService tts;
    private final TelemetrySink telemetry;
    private final Duration pollInterval;
    private final Duration interSentenceSilence;
    private final Consumer<TurnContext> onFinished;

    private boolean firstAudioRecorded;

    SpeechPlaybackWorker(TurnContext turn,
                         SessionLoop loop,
                         Callable<PlaybackStep> stepSource,
                         AudioIo audioIo,
                         SpeechSynthesisService tts,
                         TelemetrySink telemetry,
                         Duration pollInterval,
                         Duration interSentenceSilence,
                         Consumer<TurnContext> onFinished) {
        this.turn = Objects.requireNonNull(turn);
        this.loop = Objects.requireNonNull(loop);
        this.stepSource = Objects.requireNonNull(stepSource);
        this.audioIo = Objects.requireNonNull(audioIo);
        this.tts = Objects.requireNonNull(tts);
        this.telemetry = Objects.requireNonNull(telemetry);
        this.pollInterval = Objects.requireNonNull(pollInterval);
        this.interSentenceSilence = Objects.requireNonNull(interSentenceSilence);
        this.onFinished = Objects.requireNonNull(onFinished);
    }

    @Override
    public void run() {
        try {
            int played = 0;
            while (!turn.isCancelled()) {
                PlaybackStep step = loop.call(stepSource);
                if (step.kind() == PlaybackStep.Kind.DONE) {
                    break;
                }
                if (step.kind() == PlaybackStep.Kind.WAIT) {
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                if (played > 0 && !interSentenceSilence.isZero()) {
                    Thread.sleep(interSentenceSilence.toMillis());
                }
                playStep(step);
                played++;
            }
            if (!turn.isCancelled()) {
                LOG.debug("Playback finished for turn {} ({} sentences)", turn.id(), played);
                loop.execute(() -> onFinished.accept(turn));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Playback worker for turn {} interrupted", turn.id());
        } catch (RuntimeException e) {
            if (turn.isCancelled()) {
                LOG.debug("Playback worker for cancelled turn {} stopped: {}", turn.id(), e.getMessage());
            } else {
                LOG.error("Playback worker failed for turn {}", turn.id(), e);
                loop.execute(() -> onFinished.accept(turn));
            }
        }
    }

    private void playStep(PlaybackStep step) throws InterruptedException {
        QueuedSentence sentence = step.sentence();
        LOG.debug("Playing sentence #{} ({}): \"{}\"", sentence.sequence(), step.kind(),
                LogSanitizer.preview(sentence.text()));
        switch (step.kind()) {
            case PLAY_CACHED -> playChunks(step.speech().chunks());
            case AWAIT -> playAwaited(step);
            case COLD -> playCold(sentence);
            default -> throw new IllegalStateException("Unexpected playback step: " + step.kind());
        }
    }

    private void playAwaited(PlaybackStep step) throws InterruptedException {
        SynthesizedSpeech speech;
        try {
            speech = step.pending().get();
        } catch (CancellationException e) {
            if (turn.isCancelled()) {
                return;
            }
            LOG.debug("Prefetch for sentence #{} was cancelled; synthesizing on demand", step.sentence().sequence());
            playCold(step.sentence());
            return;
        } catch (ExecutionException e) {
            LOG.warn("Prefetch failed for sentence #{}; synthesizing on demand: {}",
                    step.sentence().sequence(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            playCold(step.sentence());
            return;
        }
        playChunks(speech.chunks());
    }

    private void playCold(QueuedSentence sentence) throws InterruptedException {
        ProviderStream<AudioChunk> stream;
        try {
            stream = turn.scope().track(tts.synthesize(sentence.text()));
        } catch (RuntimeException e) {
            LOG.warn("Speech synthesis failed for sentence #{}; skipping: {}", sentence.sequence(), e.getMessage());
            return;
        }
        try {
            boolean first = true;
            AudioChunk chunk;
            while (!turn.isCancelled() && (chunk = stream.next()) != null) {
                if (first && chunk.hasTimeToFirstByte()) {
                    telemetry.recordLatency(LatencyKind.TTS_PROVIDER_FIRST_BYTE, chunk.timeToFirstByte());
                }
                first = false;
                play(chunk);
                if (chunk.isLast()) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            if (!turn.isCancelled()) {
                LOG.warn("Speech synthesis stream failed for sentence #{}; skipping rest: {}",
                        sentence.sequence(), e.getMessage());
            }
        } finally {
            turn.scope().release(stream);
        }
    }

    private void playChunks(List<AudioChunk> chunks) throws InterruptedException {
        for (AudioChunk chunk : chunks) {
            if (turn.isCancelled()) {
                return;
            }
            play(chunk);
        }
    }

    private void play(AudioChunk chunk) throws InterruptedException {
        if (!firstAudioRecorded) {
            firstAudioRecorded = true;
            Duration ttfb = TimeUtils.elapsedSince(turn.startNanos());
            telemetry.recordLatency(LatencyKind.TTS_FIRST_BYTE, ttfb);
            LOG.info("First audio of turn {} after {} ms", turn.id(), ttfb.toMillis());
        }
        try {
            audioIo.playAudio(chunk);
        } catch (RuntimeException e) {
            LOG.warn("Audio chunk playback failed ({} bytes); continuing: {}", chunk.data().length, e.getMessage());
        }
    }
}
