package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable per-signature occurrence history.
 *
 * <p>
 * Instances are <strong>immutable</strong>. The signature store replaces a
 * record wholesale with a new version; readers holding an older instance keep
 * a consistent snapshot and never observe a partially merged bucket.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code version} increases by one on every persisted change.</li>
 * <li>{@code totalOccurrences} is the lifetime sum of merged counts and never
 * decreases, even when the buckets holding those counts are evicted.</li>
 * <li>{@code windowBuckets} is ordered by start time, holds at most one bucket
 * per start time and only buckets inside the retention horizon.</li>
 * <li>{@code baselineRate} is {@code null} while it is undefined.</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = HistoryRecord.Builder.class)
public final class HistoryRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ErrorSignature signature;
    private final long version;
    private final long totalOccurrences;
    private final List<TimeBucket> windowBuckets;
    private final Instant lastAlertAt;
    private final Double baselineRate;
    private final List<ProcessedEvent> recentEvents;
    private final List<PublicationClaim> publications;
    private final Instant createdAt;
    private final Instant updatedAt;

    private HistoryRecord(Builder b) {
        this.signature = Objects.requireNonNull(b.signature, "signature must not be null");
        if (b.version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + b.version);
        }
        if (b.totalOccurrences < 0) {
            throw new IllegalArgumentException(
                    "totalOccurrences must be >= 0, got: " + b.totalOccurrences);
        }
        this.version = b.version;
        this.totalOccurrences = b.totalOccurrences;
        this.windowBuckets = List.copyOf(b.windowBuckets);
        this.lastAlertAt = b.lastAlertAt;
        this.baselineRate = b.baselineRate;
        this.recentEvents = List.copyOf(b.recentEvents);
        this.publications = List.copyOf(b.publications);
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.updatedAt = b.updatedAt != null ? b.updatedAt : b.createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this record's state
     */
    public Builder toBuilder() {
        return new Builder()
                .signature(signature)
                .version(version)
                .totalOccurrences(totalOccurrences)
                .windowBuckets(windowBuckets)
                .lastAlertAt(lastAlertAt)
                .baselineRate(baselineRate)
                .recentEvents(recentEvents)
                .publications(publications)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public ErrorSignature getSignature() {
        return signature;
    }

    public long getVersion() {
        return version;
    }

    public long getTotalOccurrences() {
        return totalOccurrences;
    }

    /**
     * @return unmodifiable buckets, oldest first
     */
    public List<TimeBucket> getWindowBuckets() {
        return windowBuckets;
    }

    public Instant getLastAlertAt() {
        return lastAlertAt;
    }

    /**
     * @return mean count per historical bucket, or {@code null} when fewer than
     *         two historical buckets exist
     */
    public Double getBaselineRate() {
        return baselineRate;
    }

    public List<ProcessedEvent> getRecentEvents() {
        return recentEvents;
    }

    public List<PublicationClaim> getPublications() {
        return publications;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Look up the ledger entry of an already merged event.
     *
     * @param observedAt      event observation time
     * @param occurrenceCount event count
     * @return the matching entry, if the event was merged within the dedup
     *         window
     */
    @JsonIgnore
    public Optional<ProcessedEvent> findProcessed(Instant observedAt, long occurrenceCount) {
        return recentEvents.stream()
                .filter(e -> e.matches(observedAt, occurrenceCount))
                .findFirst();
    }

    @JsonIgnore
    public boolean isPublicationClaimed(Instant observedAt) {
        return publications.stream().anyMatch(p -> p.getObservedAt().equals(observedAt));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link HistoryRecord}. Also used by Jackson when
     * reading persisted records.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private ErrorSignature signature;
        private long version = 1;
        private long totalOccurrences;
        private List<TimeBucket> windowBuckets = new ArrayList<>();
        private Instant lastAlertAt;
        private Double baselineRate;
        private List<ProcessedEvent> recentEvents = new ArrayList<>();
        private List<PublicationClaim> publications = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder signature(ErrorSignature signature) {
            this.signature = signature;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder totalOccurrences(long totalOccurrences) {
            this.totalOccurrences = totalOccurrences;
            return this;
        }

        public Builder windowBuckets(List<TimeBucket> windowBuckets) {
            this.windowBuckets = windowBuckets != null ? new ArrayList<>(windowBuckets) : new ArrayList<>();
            return this;
        }

        public Builder lastAlertAt(Instant lastAlertAt) {
            this.lastAlertAt = lastAlertAt;
            return this;
        }

        public Builder baselineRate(Double baselineRate) {
            this.baselineRate = baselineRate;
            return this;
        }

        public Builder recentEvents(List<ProcessedEvent> recentEvents) {
            this.recentEvents = recentEvents != null ? new ArrayList<>(recentEvents) : new ArrayList<>();
            return this;
        }

        public Builder publications(List<PublicationClaim> publications) {
            this.publications = publications != null ? new ArrayList<>(publications) : new ArrayList<>();
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public HistoryRecord build() {
            return new HistoryRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HistoryRecord that))
            return false;
        return version == that.version
                && totalOccurrences == that.totalOccurrences
                && signature.equals(that.signature)
                && windowBuckets.equals(that.windowBuckets)
                && Objects.equals(lastAlertAt, that.lastAlertAt)
                && Objects.equals(baselineRate, that.baselineRate)
                && recentEvents.equals(that.recentEvents)
                && publications.equals(that.publications);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, version, totalOccurrences);
    }

    @Override
    public String toString() {
        return "HistoryRecord{" +
                "signature='" + signature + '\'' +
                ", version=" + version +
                ", totalOccurrences=" + totalOccurrences +
                ", windowBuckets=" + windowBuckets +
                ", lastAlertAt=" + lastAlertAt +
                ", baselineRate=" + baselineRate +
                '}';
    }
}
