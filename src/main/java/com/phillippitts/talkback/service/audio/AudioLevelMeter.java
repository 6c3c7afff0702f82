package com.phillippitts.talkback.service.audio;

/**
 * Computes the input level of PCM16LE frames in dBFS for level visualization.
 *
 * <p><b>Algorithm:</b> RMS amplitude over all 16-bit samples in the frame, normalized to full
 * scale (32768) and converted with {@code 20 * log10(rms)}. Silence is clamped to
 * {@link #FLOOR_DB}.
 *
 * @since 1.0
 */
public final class AudioLevelMeter {

    /** Level reported for silent or empty frames. */
    public static final float FLOOR_DB = -60.0f;

    private static final double FULL_SCALE = 32768.0;
    private static final double MIN_RMS = 1e-10;

    private AudioLevelMeter() {
        // Utility class
    }

    /**
     * Calculates the level of a PCM16LE frame.
     *
     * @param pcm16le PCM16LE audio (any channel count, samples are pooled)
     * @return level in dBFS, between {@link #FLOOR_DB} and 0
     */
    public static float levelDb(byte[] pcm16le) {
        if (pcm16le == null || pcm16le.length < 2) {
            return FLOOR_DB;
        }
        double rms = calculateRms(pcm16le) / FULL_SCALE;
        double db = 20.0 * Math.log10(Math.max(rms, MIN_RMS));
        return (float) Math.max(FLOOR_DB, Math.min(0.0, db));
    }

    private static double calculateRms(byte[] pcm) {
        long sumSquares = 0;
        int sampleCount = 0;

        for (int i = 0; i + 1 < pcm.length; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
