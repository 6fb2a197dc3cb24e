package com.logsentinel.core.store;

import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.HistoryRecord;

/**
 * Outcome of {@link SignatureStore#upsertAndMerge(com.logsentinel.core.model.ErrorSignature,
 * long, java.time.Instant, AlertEvaluator)}.
 *
 * @since 1.0.0
 */
public final class UpsertResult {

    private final HistoryRecord previous;
    private final HistoryRecord current;
    private final AlertReason reason;
    private final boolean duplicate;

    private UpsertResult(HistoryRecord previous, HistoryRecord current, AlertReason reason,
            boolean duplicate) {
        this.previous = previous;
        this.current = current;
        this.reason = reason;
        this.duplicate = duplicate;
    }

    static UpsertResult merged(HistoryRecord previous, HistoryRecord current, AlertReason reason) {
        return new UpsertResult(previous, current, reason, false);
    }

    static UpsertResult duplicate(HistoryRecord current, AlertReason originalReason) {
        return new UpsertResult(null, current, originalReason, true);
    }

    /**
     * @return the record before the merge; {@code null} for a new signature or
     *         a duplicate
     */
    public HistoryRecord getPrevious() {
        return previous;
    }

    /**
     * @return the record as persisted after this call
     */
    public HistoryRecord getCurrent() {
        return current;
    }

    /**
     * @return the alert reason, or {@code null} if not anomalous. For a
     *         duplicate, the reason recorded when the event was first merged.
     */
    public AlertReason getReason() {
        return reason;
    }

    public boolean isAnomalous() {
        return reason != null;
    }

    /**
     * @return {@code true} if the event had already been merged within the
     *         dedup window and nothing was written
     */
    public boolean isDuplicate() {
        return duplicate;
    }

    public boolean isNewSignature() {
        return !duplicate && previous == null;
    }

    @Override
    public String toString() {
        return "UpsertResult{" +
                "version=" + current.getVersion() +
                ", reason=" + reason +
                ", duplicate=" + duplicate +
                '}';
    }
}
