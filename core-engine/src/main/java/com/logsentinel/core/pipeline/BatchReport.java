package com.logsentinel.core.pipeline;

import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.publish.DeliveryOutcome;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one analysis run processed by {@link ClusterBatchProcessor}.
 *
 * <p>
 * Actionable decisions are ordered by severity: level rank times occurrence
 * count, highest first.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatchReport {

    /** Highest {@code rank × occurrenceCount} first. */
    static final Comparator<AlertDecision> BY_SEVERITY = Comparator
            .comparingLong((AlertDecision d) -> d.getSignature().getLevel().rank() * d.getOccurrenceCount())
            .reversed();

    private final List<AlertDecision> actionable;
    private final int suppressed;
    private final Map<DeliveryOutcome, Integer> outcomes;
    private final Map<String, Exception> failures;

    BatchReport(List<AlertDecision> actionable, int suppressed, Map<DeliveryOutcome, Integer> outcomes,
            Map<String, Exception> failures) {
        this.actionable = actionable.stream().sorted(BY_SEVERITY).toList();
        this.suppressed = suppressed;
        this.outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * @return anomalous decisions not swallowed as duplicates, most severe
     *         first
     */
    public List<AlertDecision> getActionable() {
        return actionable;
    }

    /**
     * @return events judged noise
     */
    public int getSuppressed() {
        return suppressed;
    }

    /**
     * @param outcome a delivery outcome
     * @return how many decisions ended with it
     */
    public int count(DeliveryOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    /**
     * @return failed events keyed by signature ({@code "#index"} when the event
     *         had none)
     */
    public Map<String, Exception> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchReport{" +
                "actionable=" + actionable.size() +
                ", suppressed=" + suppressed +
                ", outcomes=" + outcomes +
                ", failures=" + failures.keySet() +
                '}';
    }
}
