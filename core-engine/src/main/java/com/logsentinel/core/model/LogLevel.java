package com.logsentinel.core.model;

import java.util.Locale;

/**
 * Severity level of a clustered error signature.
 *
 * <p>
 * Constants are declared from most to least severe; {@link #rank()} follows
 * that order so that {@code CRITICAL} ranks highest and {@code TRACE} lowest.
 * </p>
 *
 * @since 1.0.0
 */
public enum LogLevel {
    CRITICAL,
    FATAL,
    ERROR,
    WARNING,
    INFO,
    SERVICE,
    DEBUG,
    TRACE;

    /**
     * @return severity rank, {@code 1} for {@code TRACE} up to
     *         {@code values().length} for {@code CRITICAL}
     */
    public int rank() {
        return values().length - ordinal();
    }

    /**
     * Parse a level name, ignoring case and surrounding whitespace.
     *
     * @param text the level name
     * @return the matching level
     * @throws IllegalArgumentException if {@code text} is blank or names no
     *                                  known level
     */
    public static LogLevel parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Log level must not be blank");
        }
        String normalised = text.strip().toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(normalised)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level: '" + text
                + "'. Supported: CRITICAL, FATAL, ERROR, WARNING, INFO, SERVICE, DEBUG, TRACE");
    }
}
