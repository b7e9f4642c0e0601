package com.servicehealth.analytics.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.time.Duration;

/**
 * Lenient coercion of configuration and request values.
 * Invalid values never raise: they fall back to the given default and a
 * warning is logged with the offending key.
 */
@Slf4j
public final class ConfigValues {

    private ConfigValues() {
    }

    /**
     * Parses a positive integer, e.g. a {@code hours} request parameter.
     * Blank input silently yields the default; non-numeric or non-positive input
     * yields the default with a warning.
     */
    public static int parsePositiveInt(String raw, int defaultValue, String name) {
        if (StringUtils.isBlank(raw)) {
            return defaultValue;
        }
        String trimmed = raw.trim();
        if (!NumberUtils.isCreatable(trimmed)) {
            log.warn("Invalid value for {}: '{}' is not numeric, using default {}", name, raw, defaultValue);
            return defaultValue;
        }
        double parsed = NumberUtils.toDouble(trimmed, Double.NaN);
        if (Double.isNaN(parsed) || parsed <= 0 || parsed > Integer.MAX_VALUE) {
            log.warn("Invalid value for {}: {} is out of range, using default {}", name, raw, defaultValue);
            return defaultValue;
        }
        return (int) parsed;
    }

    public static int positiveOrDefault(int value, int defaultValue, String name) {
        if (value <= 0) {
            log.warn("Invalid value for {}: {} must be positive, using default {}", name, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public static int nonNegativeOrDefault(int value, int defaultValue, String name) {
        if (value < 0) {
            log.warn("Invalid value for {}: {} must not be negative, using default {}", name, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public static double positiveOrDefault(double value, double defaultValue, String name) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
            log.warn("Invalid value for {}: {} must be a positive number, using default {}", name, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public static Duration positiveOrDefault(Duration value, Duration defaultValue, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            log.warn("Invalid value for {}: {} must be a positive duration, using default {}", name, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public static Duration nonNegativeOrDefault(Duration value, Duration defaultValue, String name) {
        if (value == null || value.isNegative()) {
            log.warn("Invalid value for {}: {} must not be negative, using default {}", name, value, defaultValue);
            return defaultValue;
        }
        return value;
    }
}
