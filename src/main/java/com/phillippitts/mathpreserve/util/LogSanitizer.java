package com.phillippitts.mathpreserve.util;

/** Utility for compact, single-line log previews of captured notation. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input to at most max characters and collapse line breaks; returns "" for null.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
