package com.phillippitts.bes3t.util;

/** Utility for safe logging of names that come from uploaded archives. */
public final class LogSanitizer {

    /** Longest entry name written to logs. */
    public static final int MAX_LOGGED_LENGTH = 200;

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
     * Replaces control characters (CR, LF, tabs and the rest) with {@code '?'} and truncates to
     * {@link #MAX_LOGGED_LENGTH}, so a crafted entry name cannot forge log lines.
     */
    public static String sanitize(String s) {
        String t = truncate(s, MAX_LOGGED_LENGTH);
        StringBuilder sb = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            sb.append(Character.isISOControl(c) ? '?' : c);
        }
        return sb.toString();
    }
}
