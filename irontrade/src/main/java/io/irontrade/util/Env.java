package io.irontrade.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration lookup: environment variable first, then system property,
 * then the given default.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * @throws IllegalStateException if the key is not set
     */
    public static String require(String key) {
        String value = get(key, null);
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[ENV] {}={} is not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[ENV] {}={} is not a decimal, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Comma-separated list, entries trimmed, blanks dropped.
     */
    public static List<String> getList(String key, List<String> defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private Env() {}
}
