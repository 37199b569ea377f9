package com.mtlockyer.utils;

import java.util.Locale;

public final class Kind {
    private Kind() {}

    public static void logf(String fmt, Object... args) {
        System.out.printf(fmt + "%n", args);
    }

    public static void infof(String fmt, Object... args) {
        logf("[INFO] " + fmt, args);
    }

    public static void warnf(String fmt, Object... args) {
        logf("[WARN] " + fmt, args);
    }

    public static void errorf(String fmt, Object... args) {
        logf("[ERROR] " + fmt, args);
    }

    public static String envOr(String key, String fallback) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v : fallback;
    }

    public static String envOr(String key, String fallback, String fallbackSource) {
        String v = System.getenv(key);
        if (v != null && !v.isBlank()) {
            infof("%s=%s (source: environment)", key, redact(key, v));
            return v;
        }
        infof("%s=%s (source: %s)", key, redact(key, fallback), fallbackSource);
        return fallback;
    }

    // Secret references, credentials and recipient addresses are shown by length only
    public static String redact(String key, String value) {
        if (value == null) return null;
        String k = key.toLowerCase(Locale.ROOT);
        return (k.contains("secret") || k.contains("site_un") || k.contains("siteun") || k.contains("email"))
                ? "(%d chars)".formatted(value.length())
                : value;
    }
}
