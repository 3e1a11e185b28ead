package com.tracecontract.core;

import java.util.Locale;

/**
 * Available levels of a trace operation, from least to most important.
 * <p>
 * {@link #NONE} means the operation never emits. The declaration order is the severity order,
 * so {@link #compareTo(Enum)} can be used for minimum-level filtering.
 */
public enum LogLevel {

    /** Never emitted. Used by operations declared as ignored. */
    NONE,

    /** Diagnostic detail, normally disabled in production. */
    DEBUG,

    /** Normal operational events. */
    INFO,

    /** Unexpected situations the system recovers from. */
    WARNING,

    /** Failures that need attention. */
    ERROR;

    /**
     * Returns true if this level is at least as severe as {@code other}.
     *
     * @param other the level to compare against
     */
    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a level name case-insensitively. {@code WARN} is accepted as an alias of
     * {@link #WARNING} so SLF4J-style configuration values can be used.
     *
     * @param value the level name
     * @return the matching level
     * @throws IllegalArgumentException if the value is null, blank or unknown
     */
    public static LogLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("log level must not be null or blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: " + value, e);
        }
    }
}
