package com.logsentinel.core.detection;

import com.logsentinel.core.config.FilterPolicy;
import com.logsentinel.core.config.RetryPolicy;
import com.logsentinel.core.exception.InvalidEventException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.model.ClusterEvent;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.store.SignatureStore;
import com.logsentinel.core.store.UpsertResult;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a {@link ClusterEvent} is worth alerting a human about.
 *
 * <h3>Algorithm</h3>
 * <p>
 * The event is merged into its signature's history and the {@link RuleChain}
 * is evaluated against the same state in one atomic store update. Rules apply
 * in priority order: new signature, rate spike, absolute volume, recurring.
 * Non-anomalous events still accumulate into the history.
 * </p>
 *
 * <h3>Idempotence</h3>
 * <p>
 * Redelivery of an event already merged within the store's dedup window does
 * not count it again; the returned decision repeats the original outcome and
 * is flagged {@link AlertDecision#isRedelivered() redelivered}.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Malformed events raise {@link InvalidEventException} and are never
 * persisted. {@link StoreUnavailableException} is retried with exponential
 * backoff; once retries are exhausted it propagates so that the event is
 * redelivered upstream.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyFilter.class);

    private final SignatureStore store;
    private final RuleChain rules;
    private final Retry storeRetry;
    private final Clock clock;
    private final long maxClockSkewSeconds;
    private final int lookbackHours;

    /**
     * @param store       the signature store
     * @param policy      rule thresholds
     * @param retryPolicy backoff for store access
     * @param clock       decision time source
     */
    public AnomalyFilter(SignatureStore store, FilterPolicy policy, RetryPolicy retryPolicy, Clock clock) {
        this.store = Objects.requireNonNull(store, "SignatureStore must not be null");
        Objects.requireNonNull(policy, "FilterPolicy must not be null");
        Objects.requireNonNull(retryPolicy, "RetryPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        policy.validate();
        this.maxClockSkewSeconds = policy.getMaxClockSkewSeconds();

        this.rules = RuleChainFactory.createChain(policy);
        this.lookbackHours = policy.getDecisionLookbackHours();
        this.storeRetry = retryPolicy.toRetry("signature-store",
                e -> e instanceof StoreUnavailableException);
        this.storeRetry.getEventPublisher().onRetry(event -> LOG.warn(
                "Signature store unavailable, retry {} in {} ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Classify one event and record it in the signature's history.
     *
     * @param event the cluster event
     * @return the decision; anomalous decisions should be handed to the
     *         publisher
     * @throws InvalidEventException     if the event is malformed
     * @throws StoreUnavailableException if the store stays unavailable after
     *                                   all retries
     */
    public AlertDecision decide(ClusterEvent event) {
        validate(event);
        rejectFutureDated(event);
        ErrorSignature signature = event.getSignature();

        UpsertResult result;
        try {
            result = Retry.decorateSupplier(storeRetry, () -> store.upsertAndMerge(
                    signature, event.getOccurrenceCount(), event.getObservedAt(), rules)).get();
        } catch (StoreUnavailableException e) {
            LOG.error("Failed to process [{}] observed at {}: {}",
                    signature.key(), event.getObservedAt(), e.getMessage());
            throw e;
        }

        AlertDecision decision = AlertDecision.builder()
                .signature(signature)
                .occurrenceCount(event.getOccurrenceCount())
                .observedAt(event.getObservedAt())
                .sampleContext(event.getSampleContext())
                .lookbackHours(lookbackHours)
                .windowOccurrences(store.countWithin(result.getCurrent(), lookbackHours))
                .reason(result.getReason())
                .redelivered(result.isDuplicate())
                .decidedAt(clock.instant())
                .build();

        if (result.isDuplicate()) {
            LOG.warn("Redelivered event for [{}] observed at {} was already processed (reason={})",
                    signature.key(), event.getObservedAt(), result.getReason());
        } else if (decision.isAnomalous()) {
            LOG.info("Alert [{}] for [{}]: count={} total={}", decision.getReason(), signature.key(),
                    event.getOccurrenceCount(), result.getCurrent().getTotalOccurrences());
        } else {
            LOG.debug("Suppressed [{}]: count={} baseline={}", signature.key(),
                    event.getOccurrenceCount(), result.getCurrent().getBaselineRate());
        }
        return decision;
    }

    public RuleChain getRules() {
        return rules;
    }

    private void rejectFutureDated(ClusterEvent event) {
        Instant latest = clock.instant().plusSeconds(maxClockSkewSeconds);
        if (event.getObservedAt().isAfter(latest)) {
            throw new InvalidEventException("Cluster event for '" + event.getSignature().key()
                    + "' is dated " + event.getObservedAt() + ", more than " + maxClockSkewSeconds
                    + " s ahead of " + clock.instant());
        }
    }

    static void validate(ClusterEvent event) {
        if (event == null) {
            throw new InvalidEventException("Cluster event must not be null");
        }
        if (event.getSignature() == null) {
            throw new InvalidEventException("Cluster event has no signature");
        }
        if (event.getObservedAt() == null) {
            throw new InvalidEventException("Cluster event for '" + event.getSignature().key()
                    + "' has no observedAt timestamp");
        }
        if (event.getOccurrenceCount() <= 0) {
            throw new InvalidEventException("Cluster event for '" + event.getSignature().key()
                    + "' has occurrenceCount " + event.getOccurrenceCount() + "; must be > 0");
        }
    }
}
