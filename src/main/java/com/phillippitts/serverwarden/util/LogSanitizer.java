package com.phillippitts.serverwarden.util;

/** Utility for logging untrusted text (server log lines, command output) safely. */
public final class LogSanitizer {

    private static final char REPLACEMENT = '�';

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
     * Removes control characters and undecodable-byte replacement characters, keeping tabs as spaces.
     * Returns "" for null.
     */
    public static String stripNoise(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\t') {
                sb.append(' ');
            } else if (c != REPLACEMENT && !Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Sanitizes and truncates in one step, for log statements.
     */
    public static String preview(String s, int max) {
        return truncate(stripNoise(s), max);
    }
}
