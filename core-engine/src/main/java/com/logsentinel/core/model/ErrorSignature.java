package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of an error pattern: a {@link LogLevel} plus the verbatim message
 * text.
 *
 * <p>
 * The message is compared exactly; no trimming, case folding or token
 * normalisation is applied. Two producers that emit the same level and
 * message therefore always address the same history record.
 * </p>
 *
 * @since 1.0.0
 */
public final class ErrorSignature implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Separator between level and message in the rendered {@link #key()}. */
    public static final String KEY_SEPARATOR = ": ";

    private final LogLevel level;
    private final String message;

    /**
     * @param level   severity level; must not be {@code null}
     * @param message message text; must not be {@code null} or blank
     * @throws NullPointerException     if either argument is {@code null}
     * @throws IllegalArgumentException if {@code message} is blank
     */
    @JsonCreator
    public ErrorSignature(@JsonProperty("level") LogLevel level,
            @JsonProperty("message") String message) {
        this.level = Objects.requireNonNull(level, "Signature level must not be null");
        this.message = Objects.requireNonNull(message, "Signature message must not be null");
        if (message.isBlank()) {
            throw new IllegalArgumentException("Signature message must not be blank");
        }
    }

    public static ErrorSignature of(LogLevel level, String message) {
        return new ErrorSignature(level, message);
    }

    /**
     * Parse the rendered {@code "LEVEL: message"} form produced by
     * {@link #key()}.
     *
     * <p>
     * The text is split on the <em>first</em> {@value #KEY_SEPARATOR}, so
     * messages may themselves contain the separator.
     * </p>
     *
     * @param key rendered signature
     * @return the parsed signature
     * @throws IllegalArgumentException if the text has no separator, an unknown
     *                                  level or an empty message
     */
    public static ErrorSignature parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Signature must not be blank");
        }
        int idx = key.indexOf(KEY_SEPARATOR);
        if (idx <= 0) {
            throw new IllegalArgumentException(
                    "Signature must have the form 'LEVEL: message', got: '" + key + "'");
        }
        String message = key.substring(idx + KEY_SEPARATOR.length());
        if (message.isBlank()) {
            throw new IllegalArgumentException("Signature message must not be blank");
        }
        return new ErrorSignature(LogLevel.parse(key.substring(0, idx)), message);
    }

    public LogLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the stable string key {@code "LEVEL: message"}
     */
    @JsonIgnore
    public String key() {
        return level.name() + KEY_SEPARATOR + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ErrorSignature that))
            return false;
        return level == that.level && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, message);
    }

    @Override
    public String toString() {
        return key();
    }
}
