package com.phillippitts.talkback.util;

/** Utility for privacy-safe logging of transcript and response previews. */
public final class LogSanitizer {

    /** Default preview length used for transcripts and sentences in logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 50;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of at most {@link #DEFAULT_PREVIEW_CHARS} characters, with an ellipsis
     * when the text was cut.
     */
    public static String preview(String s) {
        String flat = s == null ? "" : s.replace('\n', ' ').replace('\r', ' ');
        String cut = truncate(flat, DEFAULT_PREVIEW_CHARS);
        return cut.length() < flat.length() ? cut + "..." : cut;
    }
}
