package com.logsentinel.core.pipeline;

import com.logsentinel.core.detection.AnomalyFilter;
import com.logsentinel.core.exception.InvalidEventException;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.model.ClusterEvent;
import com.logsentinel.core.publish.DecisionPublisher;
import com.logsentinel.core.publish.DeliveryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs every cluster of one analysis run through the anomaly filter and the
 * publisher, concurrently on the given executor.
 *
 * <p>
 * Failures are isolated per signature: they are collected into the
 * {@link BatchReport} and never abort the rest of the batch. A signature may
 * appear once per run; repeats are rejected as invalid.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusterBatchProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterBatchProcessor.class);

    private final AnomalyFilter filter;
    private final DecisionPublisher publisher;
    private final ExecutorService executor;

    /**
     * @param filter    the anomaly filter
     * @param publisher the decision publisher
     * @param executor  worker pool; owned by the caller
     */
    public ClusterBatchProcessor(AnomalyFilter filter, DecisionPublisher publisher, ExecutorService executor) {
        this.filter = Objects.requireNonNull(filter, "AnomalyFilter must not be null");
        this.publisher = Objects.requireNonNull(publisher, "DecisionPublisher must not be null");
        this.executor = Objects.requireNonNull(executor, "ExecutorService must not be null");
    }

    /**
     * @param batch clusters of one analysis run
     * @return the run's report
     */
    public BatchReport process(List<ClusterEvent> batch) {
        Objects.requireNonNull(batch, "batch must not be null");

        Map<String, Exception> failures = new LinkedHashMap<>();
        Map<String, CompletableFuture<Outcome>> pending = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < batch.size(); i++) {
            ClusterEvent event = batch.get(i);
            String key = describe(event, i);
            if (event != null && event.getSignature() != null && !seen.add(key)) {
                failures.put(key + " #" + i, new InvalidEventException(
                        "Signature '" + key + "' appears more than once in the batch"));
                continue;
            }
            pending.put(key, CompletableFuture.supplyAsync(() -> handle(event), executor));
        }

        List<AlertDecision> actionable = new ArrayList<>();
        Map<DeliveryOutcome, Integer> outcomes = new EnumMap<>(DeliveryOutcome.class);
        int suppressed = 0;
        for (Map.Entry<String, CompletableFuture<Outcome>> entry : pending.entrySet()) {
            Outcome outcome;
            try {
                outcome = entry.getValue().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.warn("Cluster [{}] failed: {}", entry.getKey(), cause.getMessage());
                failures.put(entry.getKey(), cause instanceof Exception failure ? failure : e);
                continue;
            }
            outcomes.merge(outcome.delivery, 1, Integer::sum);
            if (outcome.delivery == DeliveryOutcome.SKIPPED) {
                suppressed++;
            } else if (outcome.delivery != DeliveryOutcome.DUPLICATE) {
                actionable.add(outcome.decision);
            }
        }

        BatchReport report = new BatchReport(actionable, suppressed, outcomes, failures);
        LOG.info("Processed batch of {} cluster(s): {}", batch.size(), report);
        return report;
    }

    private Outcome handle(ClusterEvent event) {
        AlertDecision decision = filter.decide(event);
        return new Outcome(decision, publisher.publish(decision));
    }

    private static String describe(ClusterEvent event, int index) {
        if (event == null || event.getSignature() == null) {
            return "#" + index;
        }
        return event.getSignature().key();
    }

    private static final class Outcome {
        private final AlertDecision decision;
        private final DeliveryOutcome delivery;

        private Outcome(AlertDecision decision, DeliveryOutcome delivery) {
            this.decision = decision;
            this.delivery = delivery;
        }
    }
}
