package com.logsentinel.core.detection;

import com.logsentinel.core.model.AlertReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Absolute volume rule.
 *
 * <p>
 * Fires when the event's count reaches {@code minThreshold}, whatever the
 * baseline says. Keeps a slowly rising baseline from hiding a real burst.
 * </p>
 *
 * @since 1.0.0
 */
public class VolumeThresholdRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(VolumeThresholdRule.class);

    private final long minThreshold;

    public VolumeThresholdRule(long minThreshold) {
        if (minThreshold < 1) {
            throw new IllegalArgumentException("minThreshold must be >= 1, got: " + minThreshold);
        }
        this.minThreshold = minThreshold;
    }

    @Override
    public boolean fires(RuleContext context) {
        boolean reached = context.getOccurrenceCount() >= minThreshold;
        if (reached) {
            LOG.debug("Volume threshold: count={} >= {}", context.getOccurrenceCount(), minThreshold);
        }
        return reached;
    }

    @Override
    public AlertReason getReason() {
        return AlertReason.VOLUME_THRESHOLD;
    }
}
