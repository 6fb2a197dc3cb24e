package com.logsentinel.core.detection;

import com.logsentinel.core.model.AlertReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Recurring-issue rule.
 *
 * <p>
 * Fires when the signature already alerted within the last
 * {@code windowHours} and the event's count is still above
 * {@code minThreshold}. Tagged separately so notifications can present it as
 * an ongoing issue rather than a new one.
 * </p>
 *
 * @since 1.0.0
 */
public class RecurringRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RecurringRule.class);

    private final int windowHours;
    private final long minThreshold;

    public RecurringRule(int windowHours, long minThreshold) {
        if (windowHours < 1) {
            throw new IllegalArgumentException("windowHours must be >= 1, got: " + windowHours);
        }
        this.windowHours = windowHours;
        this.minThreshold = minThreshold;
    }

    @Override
    public boolean fires(RuleContext context) {
        Instant lastAlertAt = context.getLastAlertAt();
        if (lastAlertAt == null) {
            return false;
        }
        Instant windowStart = context.getNow().minus(Duration.ofHours(windowHours));
        if (lastAlertAt.isBefore(windowStart)) {
            return false;
        }
        boolean recurring = context.getOccurrenceCount() > minThreshold;
        if (recurring) {
            LOG.debug("Recurring: last alert at {}, count={} > {}",
                    lastAlertAt, context.getOccurrenceCount(), minThreshold);
        }
        return recurring;
    }

    @Override
    public AlertReason getReason() {
        return AlertReason.RECURRING;
    }
}
