package com.logsentinel.core.detection;

import com.logsentinel.core.model.HistoryRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * State an {@link AlertRule} evaluates: the signature's history before and
 * after merging the event, the event's count and the decision time.
 *
 * @since 1.0.0
 */
public final class RuleContext {

    private final HistoryRecord previous;
    private final HistoryRecord merged;
    private final long occurrenceCount;
    private final Instant now;

    /**
     * @param previous        history before the event, {@code null} for a new
     *                        signature
     * @param merged          history with the event merged in
     * @param occurrenceCount the event's count
     * @param now             decision time
     */
    public RuleContext(HistoryRecord previous, HistoryRecord merged, long occurrenceCount, Instant now) {
        this.previous = previous;
        this.merged = Objects.requireNonNull(merged, "merged record must not be null");
        this.occurrenceCount = occurrenceCount;
        this.now = Objects.requireNonNull(now, "now must not be null");
    }

    public boolean isNewSignature() {
        return previous == null;
    }

    public HistoryRecord getPrevious() {
        return previous;
    }

    public HistoryRecord getMerged() {
        return merged;
    }

    public long getOccurrenceCount() {
        return occurrenceCount;
    }

    public Instant getNow() {
        return now;
    }

    /**
     * @return baseline over the history excluding the bucket this event landed
     *         in, or {@code null} while undefined
     */
    public Double getBaselineRate() {
        return merged.getBaselineRate();
    }

    /**
     * @return when the signature last alerted before this event, or
     *         {@code null}
     */
    public Instant getLastAlertAt() {
        return previous != null ? previous.getLastAlertAt() : null;
    }
}
