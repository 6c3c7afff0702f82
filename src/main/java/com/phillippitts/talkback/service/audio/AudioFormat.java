package com.phillippitts.talkback.service.audio;

/**
 * PCM format negotiated with audio I/O and the speech-to-text provider.
 *
 * @param sampleRate    sample rate in Hz
 * @param channels      number of channels
 * @param bitsPerSample bits per sample (signed, little-endian)
 */
public record AudioFormat(int sampleRate, int channels, int bitsPerSample) {

    /** 16 kHz, mono, 16-bit signed little-endian PCM. */
    public static final AudioFormat DEFAULT = new AudioFormat(16_000, 1, 16);

    public AudioFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
        if (bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
            throw new IllegalArgumentException("bitsPerSample must be a positive multiple of 8, got: "
                    + bitsPerSample);
        }
    }

    /** Bytes per PCM frame (sample for all channels). */
    public int blockAlign() {
        return (bitsPerSample / 8) * channels;
    }

    /** Bytes per second at this format. */
    public int byteRate() {
        return sampleRate * blockAlign();
    }
}
