package com.logsentinel.core.detection;

import com.logsentinel.core.model.AlertReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate-spike rule.
 *
 * <p>
 * Fires when the event's count exceeds the signature's baseline rate
 * multiplied by {@code spikeFactor}. An undefined baseline (fewer than two
 * historical buckets) or a zero baseline never fires.
 * </p>
 *
 * @since 1.0.0
 */
public class RateSpikeRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RateSpikeRule.class);

    private final double spikeFactor;

    /**
     * @param spikeFactor multiplier over the baseline; must be {@code > 0}
     * @throws IllegalArgumentException if {@code spikeFactor <= 0}
     */
    public RateSpikeRule(double spikeFactor) {
        if (spikeFactor <= 0) {
            throw new IllegalArgumentException("spikeFactor must be > 0, got: " + spikeFactor);
        }
        this.spikeFactor = spikeFactor;
    }

    @Override
    public boolean fires(RuleContext context) {
        Double baseline = context.getBaselineRate();
        if (baseline == null || baseline <= 0) {
            return false;
        }
        double limit = baseline * spikeFactor;
        boolean spike = context.getOccurrenceCount() > limit;
        if (spike) {
            LOG.debug("Rate spike: count={} > baseline={} x {}",
                    context.getOccurrenceCount(), baseline, spikeFactor);
        }
        return spike;
    }

    @Override
    public AlertReason getReason() {
        return AlertReason.RATE_SPIKE;
    }
}
