package com.phillippitts.tapguard.util;

/** Utility for privacy-safe logging of identifiers and bridge-supplied text. */
public final class LogSanitizer {
    private static final int VISIBLE_SUFFIX = 4;

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
     * Masks a payment or reader identifier, keeping only its last four characters.
     * Returns "-" for null.
     */
    public static String maskIdentifier(String id) {
        if (id == null) {
            return "-";
        }
        if (id.length() <= VISIBLE_SUFFIX) {
            return "****";
        }
        return "****" + id.substring(id.length() - VISIBLE_SUFFIX);
    }
}
