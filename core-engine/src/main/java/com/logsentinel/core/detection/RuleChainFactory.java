package com.logsentinel.core.detection;

import com.logsentinel.core.config.FilterPolicy;
import com.logsentinel.core.model.AlertReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link AlertRule}s and the priority-ordered {@link RuleChain} from a
 * {@link FilterPolicy}.
 *
 * <p>
 * The single point of extension when adding a new alert reason: add the
 * constant, the rule, and its case here.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleChainFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleChainFactory.class);

    private RuleChainFactory() {
        // utility class
    }

    /**
     * Create the rule reporting {@code reason}.
     *
     * @param reason the alert reason; must not be {@code null}
     * @param policy thresholds; must not be {@code null}
     * @return a configured rule
     */
    public static AlertRule create(AlertReason reason, FilterPolicy policy) {
        Objects.requireNonNull(reason, "AlertReason must not be null");
        Objects.requireNonNull(policy, "FilterPolicy must not be null");

        return switch (reason) {
            case NEW_SIGNATURE -> new NewSignatureRule();
            case RATE_SPIKE -> new RateSpikeRule(policy.getSpikeFactor());
            case VOLUME_THRESHOLD -> new VolumeThresholdRule(policy.getAbsoluteMinThreshold());
            case RECURRING -> new RecurringRule(policy.getRecurringWindowHours(),
                    policy.getRecurringMinThreshold());
        };
    }

    /**
     * Create the full chain, one rule per {@link AlertReason} in declaration
     * (priority) order.
     *
     * @param policy thresholds; must not be {@code null}
     * @return the rule chain
     */
    public static RuleChain createChain(FilterPolicy policy) {
        Objects.requireNonNull(policy, "FilterPolicy must not be null");
        List<AlertRule> rules = Arrays.stream(AlertReason.values())
                .map(reason -> create(reason, policy))
                .toList();
        LOG.info("Created rule chain {} with {}", rules.stream().map(AlertRule::getReason).toList(), policy);
        return new RuleChain(rules);
    }
}
