package com.logsentinel.core.detection;

import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.store.AlertEvaluator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of {@link AlertRule}s; the first rule that fires decides.
 *
 * <p>
 * Implements {@link AlertEvaluator} so the signature store can run the chain
 * inside the same atomic update that merges the event.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleChain implements AlertEvaluator {

    private final List<AlertRule> rules;

    /**
     * @param rules rules in priority order; must not be {@code null} or empty
     */
    public RuleChain(List<AlertRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Rules list must not be empty");
        }
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * @param context history and event under evaluation
     * @return reason of the first firing rule, or empty if none fires
     */
    public Optional<AlertReason> evaluate(RuleContext context) {
        for (AlertRule rule : rules) {
            if (rule.fires(context)) {
                return Optional.of(rule.getReason());
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<AlertReason> evaluate(HistoryRecord previous, HistoryRecord merged, long count,
            Instant now) {
        return evaluate(new RuleContext(previous, merged, count, now));
    }

    public List<AlertRule> getRules() {
        return rules;
    }
}
