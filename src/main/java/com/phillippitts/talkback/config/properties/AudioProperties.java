package com.phillippitts.talkback.config.properties;

import com.phillippitts.talkback.service.audio.AudioFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the PCM format negotiated with audio I/O and speech-to-text.
 *
 * Default format: 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "conversation.audio")
public class AudioProperties {

    @Min(8000)
    @Max(48_000)
    private final int sampleRate;

    @Min(1)
    @Max(2)
    private final int channels;

    @Min(8)
    @Max(32)
    private final int bitsPerSample;

    @ConstructorBinding
    public AudioProperties(Integer sampleRate, Integer channels, Integer bitsPerSample) {
        this.sampleRate = sampleRate == null ? AudioFormat.DEFAULT.sampleRate() : sampleRate;
        this.channels = channels == null ? AudioFormat.DEFAULT.channels() : channels;
        this.bitsPerSample = bitsPerSample == null ? AudioFormat.DEFAULT.bitsPerSample() : bitsPerSample;
    }

    public AudioFormat toFormat() {
        return new AudioFormat(sampleRate, channels, bitsPerSample);
    }

    public int getSampleRate() { return sampleRate; }
    public int getChannels() { return channels; }
    public int getBitsPerSample() { return bitsPerSample; }
}
