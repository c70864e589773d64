package com.mcpcat.core.truncate;

final class Strings {

    private Strings() {}

    /** Returns {@code s} unchanged when within {@code maxLength}, else its prefix plus "...". */
    static String truncate(String s, int maxLength) {
        if (s == null || s.length() <= maxLength) return s;
        return s.substring(0, maxLength) + TruncationLimits.TRUNCATION_SUFFIX;
    }
}
