package com.phillippitts.attendancekiosk.util;

/** Utility for log-safe rendering of backend error text and stored failure reasons. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Collapse line breaks and truncate to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String oneLine = s.replaceAll("[\\r\\n\\t]+", " ").strip();
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max);
    }

    /**
     * Human-readable description of a failure: the exception's message, or its simple class
     * name when it carries none.
     */
    public static String describe(Throwable t) {
        if (t == null) {
            return "";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
