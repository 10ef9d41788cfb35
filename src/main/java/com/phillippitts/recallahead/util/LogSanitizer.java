package com.phillippitts.recallahead.util;

/** Utility for privacy-safe logging of typed text and queries. */
public final class LogSanitizer {

    /** Default number of characters of a query shown in log lines. */
    public static final int DEFAULT_PREVIEW_CHARS = 32;

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
     * Short quoted preview of user text with its full length, e.g. {@code "explain rea…"(19)}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "<none>";
        }
        String head = truncate(s, DEFAULT_PREVIEW_CHARS);
        String ellipsis = head.length() < s.length() ? "…" : "";
        return '"' + head + ellipsis + "\"(" + s.length() + ')';
    }
}
