package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for sentence playback and synthesis prefetching.
 *
 * <p>A {@link Preset} supplies defaults; explicitly configured values override it.
 */
@Validated
@ConfigurationProperties(prefix = "conversation.playback")
public class PlaybackProperties {

    public enum Preset {
        DEFAULT(true, 1, 0),
        LOW_LATENCY(true, 2, 0),
        CONSERVATIVE(true, 1, 100),
        DISABLED(false, 0, 0);

        private final boolean enablePrefetch;
        private final int prefetchDepth;
        private final int interSentenceSilenceMs;

        Preset(boolean enablePrefetch, int prefetchDepth, int interSentenceSilenceMs) {
            this.enablePrefetch = enablePrefetch;
            this.prefetchDepth = prefetchDepth;
            this.interSentenceSilenceMs = interSentenceSilenceMs;
        }
    }

    private final Preset preset;

    private final boolean enablePrefetch;

    /** Number of queued sentences synthesized ahead of the one playing. */
    @Min(0)
    @Max(8)
    private final int prefetchDepth;

    @Min(0)
    @Max(2000)
    private final int interSentenceSilenceMs;

    /** Start synthesis as soon as a sentence is segmented, ahead of queue-driven prefetch. */
    private final boolean eagerPrefetch;

    @ConstructorBinding
    public PlaybackProperties(Preset preset,
                              Boolean enablePrefetch,
                              Integer prefetchDepth,
                              Integer interSentenceSilenceMs,
                              Boolean eagerPrefetch) {
        this.preset = preset == null ? Preset.DEFAULT : preset;
        this.enablePrefetch = enablePrefetch == null ? this.preset.enablePrefetch : enablePrefetch;
        this.prefetchDepth = prefetchDepth == null ? this.preset.prefetchDepth : prefetchDepth;
        this.interSentenceSilenceMs = interSentenceSilenceMs == null
                ? this.preset.interSentenceSilenceMs : interSentenceSilenceMs;
        this.eagerPrefetch = eagerPrefetch == null || eagerPrefetch;
    }

    public static PlaybackProperties of(Preset preset) {
        return new PlaybackProperties(preset, null, null, null, null);
    }

    public Preset getPreset() { return preset; }
    public boolean isEnablePrefetch() { return enablePrefetch; }
    public int getPrefetchDepth() { return enablePrefetch ? prefetchDepth : 0; }
    public int getInterSentenceSilenceMs() { return interSentenceSilenceMs; }
    public boolean isEagerPrefetch() { return enablePrefetch && eagerPrefetch; }
}
