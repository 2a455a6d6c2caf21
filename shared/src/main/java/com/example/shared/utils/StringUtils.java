package com.example.shared.utils;

import java.time.Instant;

public final class StringUtils {
    private StringUtils() {
    }

    /**
     * Безопасный для имени файла суффикс пары: lme_0_shfe_0
     */
    public static String pairFileSuffix(String instrumentA, String instrumentB) {
        return sanitize(instrumentA) + "_" + sanitize(instrumentB);
    }

    public static String range(Instant from, Instant to) {
        return "[" + (from != null ? from : "-") + " .. " + (to != null ? to : "-") + "]";
    }

    private static String sanitize(String value) {
        return value == null ? "null" : value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
