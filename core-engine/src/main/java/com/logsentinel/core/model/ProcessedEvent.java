package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Ledger entry for a {@link ClusterEvent} already merged into a
 * {@link HistoryRecord}. Used to recognise redeliveries.
 *
 * @since 1.0.0
 */
public final class ProcessedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant observedAt;
    private final long occurrenceCount;
    private final Instant processedAt;

    /** Reason the event alerted with, or {@code null} if it was not anomalous. */
    private final AlertReason reason;

    @JsonCreator
    public ProcessedEvent(@JsonProperty("observedAt") Instant observedAt,
            @JsonProperty("occurrenceCount") long occurrenceCount,
            @JsonProperty("processedAt") Instant processedAt,
            @JsonProperty("reason") AlertReason reason) {
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
        this.occurrenceCount = occurrenceCount;
        this.processedAt = Objects.requireNonNull(processedAt, "processedAt must not be null");
        this.reason = reason;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public long getOccurrenceCount() {
        return occurrenceCount;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public AlertReason getReason() {
        return reason;
    }

    @JsonIgnore
    public boolean matches(Instant observedAt, long occurrenceCount) {
        return this.occurrenceCount == occurrenceCount && this.observedAt.equals(observedAt);
    }

    public ProcessedEvent withReason(AlertReason reason) {
        return new ProcessedEvent(observedAt, occurrenceCount, processedAt, reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ProcessedEvent that))
            return false;
        return occurrenceCount == that.occurrenceCount
                && observedAt.equals(that.observedAt)
                && processedAt.equals(that.processedAt)
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(observedAt, occurrenceCount, processedAt, reason);
    }

    @Override
    public String toString() {
        return "ProcessedEvent{observedAt=" + observedAt + ", count=" + occurrenceCount
                + ", reason=" + reason + '}';
    }
}
