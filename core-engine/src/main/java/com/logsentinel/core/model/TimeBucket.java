package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Occurrence count aggregated over one fixed-size time window.
 *
 * <p>
 * Immutable; merging a count yields a new bucket via {@link #plus(long)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeBucket implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant start;
    private final long count;

    @JsonCreator
    public TimeBucket(@JsonProperty("start") Instant start, @JsonProperty("count") long count) {
        this.start = Objects.requireNonNull(start, "Bucket start must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("Bucket count must be >= 0, got: " + count);
        }
        this.count = count;
    }

    public Instant getStart() {
        return start;
    }

    public long getCount() {
        return count;
    }

    public TimeBucket plus(long delta) {
        return new TimeBucket(start, Math.addExact(count, delta));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeBucket that))
            return false;
        return count == that.count && start.equals(that.start);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, count);
    }

    @Override
    public String toString() {
        return start + "=" + count;
    }
}
