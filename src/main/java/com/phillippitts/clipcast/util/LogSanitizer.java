package com.phillippitts.clipcast.util;

/** Keeps subprocess output and user paths short in logs and error messages. */
public final class LogSanitizer {
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
     * Last {@code max} characters of the input, single-lined; returns "" for null.
     * ffmpeg prints the actual failure at the end of stderr.
     */
    public static String tail(CharSequence s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String text = s.toString();
        String cut = text.length() <= max ? text : text.substring(text.length() - max);
        return cut.replace('\n', ' ').replace('\r', ' ').trim();
    }
}
