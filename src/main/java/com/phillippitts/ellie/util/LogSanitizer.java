package com.phillippitts.ellie.util;

/** Privacy-safe previews of user text for logs. */
public final class LogSanitizer {

    /** Default preview length for transcripts and replies. */
    public static final int DEFAULT_PREVIEW_CHARS = 60;

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
     * Single-line preview: line breaks become spaces, then {@link #truncate} with an ellipsis marker.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= DEFAULT_PREVIEW_CHARS ? flat : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
