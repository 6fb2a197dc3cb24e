package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One clustered error signature observed in one analysis run.
 *
 * <p>
 * Produced upstream once per run per signature and delivered at least once.
 * Instances are plain carriers: they are deserialized from untrusted JSON, so
 * field validity is checked by the anomaly filter, not here.
 * </p>
 *
 * <h3>Identity for redelivery</h3>
 * <p>
 * Two events with the same signature, {@code observedAt} and
 * {@code occurrenceCount} are treated as the same delivery.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private ErrorSignature signature;

    @JsonAlias("count")
    private long occurrenceCount;

    @JsonAlias("timestamp")
    private Instant observedAt;

    /** Opaque sample of the clustered log lines, passed through to alerts. */
    @JsonAlias("representative_log")
    private String sampleContext;

    /** No-arg constructor required by Jackson. */
    public ClusterEvent() {
    }

    private ClusterEvent(Builder builder) {
        this.signature = builder.signature;
        this.occurrenceCount = builder.occurrenceCount;
        this.observedAt = builder.observedAt;
        this.sampleContext = builder.sampleContext;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ClusterEvent} instances.
     */
    public static class Builder {
        private ErrorSignature signature;
        private long occurrenceCount;
        private Instant observedAt;
        private String sampleContext;

        public Builder signature(ErrorSignature signature) {
            this.signature = signature;
            return this;
        }

        public Builder signature(LogLevel level, String message) {
            this.signature = ErrorSignature.of(level, message);
            return this;
        }

        public Builder occurrenceCount(long occurrenceCount) {
            this.occurrenceCount = occurrenceCount;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder sampleContext(String sampleContext) {
            this.sampleContext = sampleContext;
            return this;
        }

        public ClusterEvent build() {
            return new ClusterEvent(this);
        }
    }

    public ErrorSignature getSignature() {
        return signature;
    }

    public void setSignature(ErrorSignature signature) {
        this.signature = signature;
    }

    public long getOccurrenceCount() {
        return occurrenceCount;
    }

    public void setOccurrenceCount(long occurrenceCount) {
        this.occurrenceCount = occurrenceCount;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public void setObservedAt(Instant observedAt) {
        this.observedAt = observedAt;
    }

    public String getSampleContext() {
        return sampleContext;
    }

    public void setSampleContext(String sampleContext) {
        this.sampleContext = sampleContext;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClusterEvent that))
            return false;
        return occurrenceCount == that.occurrenceCount
                && Objects.equals(signature, that.signature)
                && Objects.equals(observedAt, that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, occurrenceCount, observedAt);
    }

    @Override
    public String toString() {
        return "ClusterEvent{" +
                "signature='" + signature + '\'' +
                ", occurrenceCount=" + occurrenceCount +
                ", observedAt=" + observedAt +
                '}';
    }
}
