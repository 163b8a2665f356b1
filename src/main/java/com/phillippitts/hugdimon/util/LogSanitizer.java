package com.phillippitts.hugdimon.util;

/** Utility for privacy-safe logging of user and model text. */
public final class LogSanitizer {

    /** Default preview length for user messages in log lines. */
    public static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview suitable for a log statement: line breaks flattened, text cut to
     * {@link #DEFAULT_PREVIEW} characters with an ellipsis marker when shortened.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ");
        if (flat.length() <= DEFAULT_PREVIEW) {
            return flat;
        }
        return flat.substring(0, DEFAULT_PREVIEW) + "...";
    }
}
