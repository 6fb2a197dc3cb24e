package com.logsentinel.core.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Answer of the history query interface, serialized as
 * {@code {"signature":"LEVEL: message","lookback_hours":24,"occurrence_count":16}}.
 *
 * @since 1.0.0
 */
public final class OccurrenceReport {

    private final String signature;
    private final int lookbackHours;
    private final long occurrenceCount;

    @JsonCreator
    public OccurrenceReport(@JsonProperty("signature") String signature,
            @JsonProperty("lookback_hours") int lookbackHours,
            @JsonProperty("occurrence_count") long occurrenceCount) {
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.lookbackHours = lookbackHours;
        this.occurrenceCount = occurrenceCount;
    }

    @JsonProperty("signature")
    public String getSignature() {
        return signature;
    }

    @JsonProperty("lookback_hours")
    public int getLookbackHours() {
        return lookbackHours;
    }

    @JsonProperty("occurrence_count")
    public long getOccurrenceCount() {
        return occurrenceCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OccurrenceReport that))
            return false;
        return lookbackHours == that.lookbackHours
                && occurrenceCount == that.occurrenceCount
                && signature.equals(that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, lookbackHours, occurrenceCount);
    }

    @Override
    public String toString() {
        return "OccurrenceReport{" +
                "signature='" + signature + '\'' +
                ", lookbackHours=" + lookbackHours +
                ", occurrenceCount=" + occurrenceCount +
                '}';
    }
}
