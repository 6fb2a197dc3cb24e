package com.logsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds used by the anomaly filter's rule chain.
 *
 * <p>
 * All values are policy knobs loaded from configuration; the defaults below
 * apply when a key is omitted.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    /** A count above {@code baselineRate × spikeFactor} is a rate spike. */
    private double spikeFactor = 3.0;

    /** A count at or above this floor alerts regardless of baseline. */
    private long absoluteMinThreshold = 10;

    /** How long after an alert a signature is considered still recurring. */
    private int recurringWindowHours = 24;

    /** A recurring signature alerts again only above this count. */
    private long recurringMinThreshold = 5;

    /** Lookback reported on every decision together with its window count. */
    private int decisionLookbackHours = 24;

    /** How far an event's {@code observedAt} may run ahead of the local clock. */
    private long maxClockSkewSeconds = 300;

    /**
     * Collect validation errors into {@code errors}.
     *
     * @param errors sink for human-readable error messages
     */
    void collectErrors(List<String> errors) {
        if (spikeFactor <= 0) {
            errors.add("filter.spikeFactor must be > 0, got: " + spikeFactor);
        }
        if (absoluteMinThreshold < 1) {
            errors.add("filter.absoluteMinThreshold must be >= 1, got: " + absoluteMinThreshold);
        }
        if (recurringWindowHours < 1) {
            errors.add("filter.recurringWindowHours must be >= 1, got: " + recurringWindowHours);
        }
        if (recurringMinThreshold < 0) {
            errors.add("filter.recurringMinThreshold must be >= 0, got: " + recurringMinThreshold);
        }
        if (recurringMinThreshold >= absoluteMinThreshold) {
            errors.add("filter.recurringMinThreshold (" + recurringMinThreshold
                    + ") must be below filter.absoluteMinThreshold (" + absoluteMinThreshold + ")");
        }
        if (decisionLookbackHours < 1) {
            errors.add("filter.decisionLookbackHours must be >= 1, got: " + decisionLookbackHours);
        }
        if (maxClockSkewSeconds < 0) {
            errors.add("filter.maxClockSkewSeconds must be >= 0, got: " + maxClockSkewSeconds);
        }
    }

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid FilterPolicy: " + String.join("; ", errors));
        }
    }

    public double getSpikeFactor() {
        return spikeFactor;
    }

    public void setSpikeFactor(double spikeFactor) {
        this.spikeFactor = spikeFactor;
    }

    public long getAbsoluteMinThreshold() {
        return absoluteMinThreshold;
    }

    public void setAbsoluteMinThreshold(long absoluteMinThreshold) {
        this.absoluteMinThreshold = absoluteMinThreshold;
    }

    public int getRecurringWindowHours() {
        return recurringWindowHours;
    }

    public void setRecurringWindowHours(int recurringWindowHours) {
        this.recurringWindowHours = recurringWindowHours;
    }

    public long getRecurringMinThreshold() {
        return recurringMinThreshold;
    }

    public void setRecurringMinThreshold(long recurringMinThreshold) {
        this.recurringMinThreshold = recurringMinThreshold;
    }

    public int getDecisionLookbackHours() {
        return decisionLookbackHours;
    }

    public void setDecisionLookbackHours(int decisionLookbackHours) {
        this.decisionLookbackHours = decisionLookbackHours;
    }

    public long getMaxClockSkewSeconds() {
        return maxClockSkewSeconds;
    }

    public void setMaxClockSkewSeconds(long maxClockSkewSeconds) {
        this.maxClockSkewSeconds = maxClockSkewSeconds;
    }

    @Override
    public String toString() {
        return "FilterPolicy{" +
                "spikeFactor=" + spikeFactor +
                ", absoluteMinThreshold=" + absoluteMinThreshold +
                ", recurringWindowHours=" + recurringWindowHours +
                ", recurringMinThreshold=" + recurringMinThreshold +
                ", decisionLookbackHours=" + decisionLookbackHours +
                ", maxClockSkewSeconds=" + maxClockSkewSeconds +
                '}';
    }
}
