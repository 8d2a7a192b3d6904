package com.phillippitts.branchplayer.util;

/** Utility for log-safe previews of caption text. */
public final class LogSanitizer {
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
     * Single-line preview: line breaks become {@code " / "} and the result is truncated.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.replace("\r\n", " / ").replace('\n', ' ').replace('\r', ' '), max);
    }
}
