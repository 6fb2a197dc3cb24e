package com.logsentinel.core.query;

import java.util.Objects;

/**
 * Read request of the history query interface: a signature given either as
 * {@code level} + {@code message} or as one {@code "LEVEL: message"} string,
 * plus a lookback in hours.
 *
 * <p>
 * Holds raw caller input; {@link HistoryQueryService} validates it.
 * </p>
 *
 * @since 1.0.0
 */
public final class OccurrenceQuery {

    /** Lookback applied when the caller gives none. */
    public static final int DEFAULT_LOOKBACK_HOURS = 24;

    private final String level;
    private final String message;
    private final String signature;
    private final Integer lookbackHours;

    private OccurrenceQuery(String level, String message, String signature, Integer lookbackHours) {
        this.level = level;
        this.message = message;
        this.signature = signature;
        this.lookbackHours = lookbackHours;
    }

    /**
     * @param level         log level name, case-insensitive
     * @param message       exact error message
     * @param lookbackHours lookback, {@code null} for the default
     */
    public static OccurrenceQuery of(String level, String message, Integer lookbackHours) {
        return new OccurrenceQuery(level, message, null, lookbackHours);
    }

    /**
     * @param signature     {@code "LEVEL: message"}
     * @param lookbackHours lookback, {@code null} for the default
     */
    public static OccurrenceQuery ofSignature(String signature, Integer lookbackHours) {
        return new OccurrenceQuery(null, null, signature, lookbackHours);
    }

    public String getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the combined signature string, or {@code null} when the query
     *         was built from level and message
     */
    public String getSignature() {
        return signature;
    }

    public int getLookbackHours() {
        return lookbackHours != null ? lookbackHours : DEFAULT_LOOKBACK_HOURS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OccurrenceQuery that))
            return false;
        return Objects.equals(level, that.level)
                && Objects.equals(message, that.message)
                && Objects.equals(signature, that.signature)
                && Objects.equals(lookbackHours, that.lookbackHours);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, message, signature, lookbackHours);
    }

    @Override
    public String toString() {
        return "OccurrenceQuery{" +
                (signature != null ? "signature='" + signature + '\'' : "level='" + level + "', message='" + message + '\'') +
                ", lookbackHours=" + getLookbackHours() +
                '}';
    }
}
