package com.phillippitts.voicegate.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Utility for privacy-safe logging of text previews and provider settings. */
public final class LogSanitizer {

    static final String MASK = "****";

    private static final String[] SECRET_MARKERS = {"key", "secret", "token", "password"};

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
     * Copy of the settings with credential-like values replaced, sorted by key for stable output.
     * A key is credential-like when it contains key, secret, token or password (case-insensitive).
     */
    public static Map<String, String> maskSecrets(Map<String, String> settings) {
        if (settings == null || settings.isEmpty()) {
            return Map.of();
        }
        Map<String, String> masked = new LinkedHashMap<>();
        new TreeMap<>(settings).forEach((k, v) -> masked.put(k, isSecret(k) ? MASK : v));
        return masked;
    }

    static boolean isSecret(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        for (String marker : SECRET_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
