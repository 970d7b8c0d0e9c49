package com.phillippitts.trackembed.util;

/** Utility for privacy-safe logging of user-supplied track metadata. */
public final class LogSanitizer {

    /** Default preview length for track names and artists in log lines. */
    public static final int DEFAULT_MAX = 64;

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
     * Truncates to {@link #DEFAULT_MAX} and replaces control characters so a crafted track
     * name cannot forge extra log lines.
     */
    public static String forLog(String s) {
        String truncated = truncate(s, DEFAULT_MAX);
        StringBuilder sb = new StringBuilder(truncated.length());
        for (int i = 0; i < truncated.length(); i++) {
            char c = truncated.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return sb.toString();
    }
}
