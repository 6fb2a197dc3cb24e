package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of running one {@link ClusterEvent} through the anomaly filter.
 *
 * <p>
 * Serialized to JSON and handed to the notification channel when
 * {@link #isAnomalous()} is {@code true}. Non-anomalous decisions are returned
 * to the caller for logging and metrics but never published.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code signature}, {@code observedAt} and
 * {@code decidedAt} are required; an anomalous decision also requires a
 * {@code reason}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertDecision implements Serializable {

    private static final long serialVersionUID = 1L;

    private ErrorSignature signature;

    /** Count carried by the triggering event. */
    private long occurrenceCount;

    /** Lookback used for {@link #windowOccurrences}. */
    private int lookbackHours;

    /** Occurrences of the signature within {@link #lookbackHours}, this event included. */
    private long windowOccurrences;

    private boolean anomalous;

    /** {@code null} when the decision is not anomalous. */
    private AlertReason reason;

    private Instant observedAt;
    private Instant decidedAt;
    private String sampleContext;

    /** {@code true} when the event had already been processed before. */
    private boolean redelivered;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public AlertDecision() {
    }

    private AlertDecision(Builder builder) {
        this.signature = Objects.requireNonNull(builder.signature, "signature must not be null");
        this.observedAt = Objects.requireNonNull(builder.observedAt, "observedAt must not be null");
        this.decidedAt = Objects.requireNonNull(builder.decidedAt, "decidedAt must not be null");
        if (builder.anomalous && builder.reason == null) {
            throw new IllegalStateException("An anomalous decision requires a reason");
        }
        this.occurrenceCount = builder.occurrenceCount;
        this.lookbackHours = builder.lookbackHours;
        this.windowOccurrences = builder.windowOccurrences;
        this.anomalous = builder.anomalous;
        this.reason = builder.anomalous ? builder.reason : null;
        this.sampleContext = builder.sampleContext;
        this.redelivered = builder.redelivered;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertDecision} instances.
     */
    public static class Builder {
        private ErrorSignature signature;
        private long occurrenceCount;
        private int lookbackHours;
        private long windowOccurrences;
        private boolean anomalous;
        private AlertReason reason;
        private Instant observedAt;
        private Instant decidedAt;
        private String sampleContext;
        private boolean redelivered;

        public Builder signature(ErrorSignature signature) {
            this.signature = signature;
            return this;
        }

        public Builder occurrenceCount(long occurrenceCount) {
            this.occurrenceCount = occurrenceCount;
            return this;
        }

        public Builder lookbackHours(int lookbackHours) {
            this.lookbackHours = lookbackHours;
            return this;
        }

        public Builder windowOccurrences(long windowOccurrences) {
            this.windowOccurrences = windowOccurrences;
            return this;
        }

        /**
         * Mark the decision anomalous for the given reason, or not anomalous when
         * {@code reason} is {@code null}.
         */
        public Builder reason(AlertReason reason) {
            this.reason = reason;
            this.anomalous = reason != null;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder decidedAt(Instant decidedAt) {
            this.decidedAt = decidedAt;
            return this;
        }

        public Builder sampleContext(String sampleContext) {
            this.sampleContext = sampleContext;
            return this;
        }

        public Builder redelivered(boolean redelivered) {
            this.redelivered = redelivered;
            return this;
        }

        public AlertDecision build() {
            return new AlertDecision(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public ErrorSignature getSignature() {
        return signature;
    }

    public void setSignature(ErrorSignature signature) {
        this.signature = signature;
    }

    /**
     * @return the rendered {@code "LEVEL: message"} signature for flat consumers
     */
    @JsonProperty(value = "signatureKey", access = JsonProperty.Access.READ_ONLY)
    public String getSignatureKey() {
        return signature != null ? signature.key() : null;
    }

    public long getOccurrenceCount() {
        return occurrenceCount;
    }

    public void setOccurrenceCount(long occurrenceCount) {
        this.occurrenceCount = occurrenceCount;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public long getWindowOccurrences() {
        return windowOccurrences;
    }

    public void setWindowOccurrences(long windowOccurrences) {
        this.windowOccurrences = windowOccurrences;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public void setAnomalous(boolean anomalous) {
        this.anomalous = anomalous;
    }

    public AlertReason getReason() {
        return reason;
    }

    public void setReason(AlertReason reason) {
        this.reason = reason;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public void setObservedAt(Instant observedAt) {
        this.observedAt = observedAt;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public void setDecidedAt(Instant decidedAt) {
        this.decidedAt = decidedAt;
    }

    public String getSampleContext() {
        return sampleContext;
    }

    public void setSampleContext(String sampleContext) {
        this.sampleContext = sampleContext;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public void setRedelivered(boolean redelivered) {
        this.redelivered = redelivered;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertDecision that))
            return false;
        return occurrenceCount == that.occurrenceCount
                && anomalous == that.anomalous
                && Objects.equals(signature, that.signature)
                && Objects.equals(observedAt, that.observedAt)
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, observedAt, occurrenceCount, anomalous, reason);
    }

    @Override
    public String toString() {
        return "AlertDecision{" +
                "signature='" + signature + '\'' +
                ", occurrenceCount=" + occurrenceCount +
                ", anomalous=" + anomalous +
                ", reason=" + reason +
                ", observedAt=" + observedAt +
                ", redelivered=" + redelivered +
                '}';
    }
}
