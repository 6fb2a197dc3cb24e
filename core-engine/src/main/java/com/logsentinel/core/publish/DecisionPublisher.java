package com.logsentinel.core.publish;

import com.logsentinel.core.config.RetryPolicy;
import com.logsentinel.core.exception.PublishFailureException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.store.SignatureStore;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Delivers anomalous {@link AlertDecision}s to a {@link NotificationChannel}
 * once per {@code (signature, observedAt)} within the store's dedup window.
 *
 * <h3>Exactly once</h3>
 * <p>
 * Before sending, the publisher takes a pending claim on the pair in the
 * signature's history record through {@link SignatureStore#claimPublication}
 * and confirms it once {@link NotificationChannel#send} returns. A confirmed
 * claim, or a pending one still within its lease, means another delivery
 * already happened or is in flight, and the decision is swallowed as
 * {@link DeliveryOutcome#DUPLICATE}. A worker that dies between claim and
 * confirmation leaves a pending claim that a redelivery takes over once the
 * lease has run out.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Retryable {@link PublishFailureException}s are retried with exponential
 * backoff. A permanent failure, or a retryable one that outlives the retries,
 * releases the claim and goes to the {@link UndeliveredDecisionHandler}.
 * Store failures while claiming propagate so the event is redelivered.
 * </p>
 *
 * @since 1.0.0
 */
public class DecisionPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionPublisher.class);

    private final SignatureStore store;
    private final NotificationChannel channel;
    private final Retry sendRetry;
    private final UndeliveredDecisionHandler undeliveredHandler;

    public DecisionPublisher(SignatureStore store, NotificationChannel channel, RetryPolicy retryPolicy) {
        this(store, channel, retryPolicy, UndeliveredDecisionHandler.LOGGING);
    }

    /**
     * @param store              the signature store holding publication claims
     * @param channel            the downstream channel
     * @param retryPolicy        backoff for retryable send failures
     * @param undeliveredHandler receives decisions that could not be delivered
     */
    public DecisionPublisher(SignatureStore store, NotificationChannel channel, RetryPolicy retryPolicy,
            UndeliveredDecisionHandler undeliveredHandler) {
        this.store = Objects.requireNonNull(store, "SignatureStore must not be null");
        this.channel = Objects.requireNonNull(channel, "NotificationChannel must not be null");
        Objects.requireNonNull(retryPolicy, "RetryPolicy must not be null");
        this.undeliveredHandler = Objects.requireNonNull(undeliveredHandler,
                "UndeliveredDecisionHandler must not be null");

        this.sendRetry = retryPolicy.toRetry("notification-channel",
                e -> e instanceof PublishFailureException failure && failure.isRetryable());
        this.sendRetry.getEventPublisher().onRetry(event -> LOG.warn(
                "Notification channel failed, retry {} in {} ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Publish a decision unless it is not anomalous or was already published.
     *
     * @param decision the decision from the anomaly filter
     * @return what happened to it
     * @throws StoreUnavailableException if the publication claim could not be
     *                                   taken
     */
    public DeliveryOutcome publish(AlertDecision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        if (!decision.isAnomalous()) {
            return DeliveryOutcome.SKIPPED;
        }

        if (!store.claimPublication(decision.getSignature(), decision.getObservedAt())) {
            LOG.info("Alert for [{}] observed at {} already published, skipping",
                    decision.getSignatureKey(), decision.getObservedAt());
            return DeliveryOutcome.DUPLICATE;
        }

        try {
            Retry.decorateRunnable(sendRetry, () -> channel.send(decision)).run();
        } catch (PublishFailureException e) {
            release(decision, e);
            undeliveredHandler.onUndelivered(decision, e);
            return DeliveryOutcome.UNDELIVERED;
        }

        confirm(decision);
        LOG.info("Published [{}] alert for [{}] observed at {}", decision.getReason(),
                decision.getSignatureKey(), decision.getObservedAt());
        return DeliveryOutcome.PUBLISHED;
    }

    private void confirm(AlertDecision decision) {
        try {
            store.confirmPublication(decision.getSignature(), decision.getObservedAt());
        } catch (StoreUnavailableException e) {
            // delivered; a redelivery after the lease may send it a second time
            LOG.warn("Could not confirm publication of [{}] observed at {}: {}",
                    decision.getSignatureKey(), decision.getObservedAt(), e.getMessage());
        }
    }

    private void release(AlertDecision decision, PublishFailureException failure) {
        try {
            store.releasePublication(decision.getSignature(), decision.getObservedAt());
        } catch (StoreUnavailableException e) {
            // the claim stays until the dedup window expires it
            failure.addSuppressed(e);
            LOG.warn("Could not release publication claim for [{}] observed at {}: {}",
                    decision.getSignatureKey(), decision.getObservedAt(), e.getMessage());
        }
    }
}
