package com.flagship.practice_analytics.wip;

import java.util.Locale;

/**
 * User-facing chart resolution. The number of points each one maps to is policy
 * and lives in configuration (see {@code analytics.resolution.*}).
 */
public enum Resolution {
    LOW,
    STANDARD,
    HIGH;

    /**
     * Parses a request parameter. Null or blank means STANDARD.
     *
     * @throws IllegalArgumentException for any other unrecognized value
     */
    public static Resolution fromParam(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        try {
            return Resolution.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid resolution: " + value + ". Expected one of low, standard, high");
        }
    }

    public String paramValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
