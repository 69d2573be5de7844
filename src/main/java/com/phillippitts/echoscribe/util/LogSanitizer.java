package com.phillippitts.echoscribe.util;

/** Utility for privacy-safe logging of transcript text and credentials. */
public final class LogSanitizer {

    private static final int VISIBLE_SECRET_CHARS = 4;

    private LogSanitizer() {}

    /**
     * Truncate the input string to max characters, appending "..." when something was cut;
     * returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Masks a secret, keeping only its first few characters (e.g. {@code sk-a****}).
     * Returns "" for null and "****" for values too short to reveal anything.
     */
    public static String mask(String secret) {
        if (secret == null) {
            return "";
        }
        if (secret.length() <= VISIBLE_SECRET_CHARS * 2) {
            return "****";
        }
        return secret.substring(0, VISIBLE_SECRET_CHARS) + "****";
    }
}
