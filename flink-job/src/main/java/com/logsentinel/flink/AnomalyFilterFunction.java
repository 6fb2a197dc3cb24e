package com.logsentinel.flink;

import com.logsentinel.core.config.SentinelConfig;
import com.logsentinel.core.detection.AnomalyFilter;
import com.logsentinel.core.exception.InvalidEventException;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.model.ClusterEvent;
import com.logsentinel.core.publish.DecisionPublisher;
import com.logsentinel.core.publish.DeliveryOutcome;
import com.logsentinel.core.publish.NotificationChannel;
import com.logsentinel.core.publish.UndeliveredDecisionHandler;
import com.logsentinel.core.store.RecordStores;
import com.logsentinel.core.store.SignatureStore;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} running each {@link ClusterEvent} through
 * the {@link AnomalyFilter} and publishing anomalous decisions through the
 * {@link NotificationChannel} made by its {@link NotificationChannelFactory}.
 *
 * <p>
 * The channel acknowledges each alert before the publisher confirms it in the
 * store, so an alert is never recorded as delivered while it only sits in
 * Flink's buffers. Decisions the channel acknowledged are also emitted to the
 * function's output.
 * </p>
 *
 * <p>
 * The stream is keyed by signature, so events of one signature are handled by
 * one subtask. History lives in the signature store, not in Flink state: the
 * store's compare-and-set and dedup ledgers make redelivery after a restart
 * idempotent.
 * </p>
 *
 * <h3>Failures</h3>
 * <ul>
 * <li>Invalid events are logged, counted and dropped.</li>
 * <li>A store that stays unavailable after retries fails the task; Flink
 * restarts from the last checkpoint and redelivers the event.</li>
 * <li>A task killed between claiming an alert and its acknowledgment leaves a
 * pending claim. The job restarts no sooner than the claim lease, so the
 * redelivered event takes the claim over and sends the alert again.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AnomalyFilterFunction extends KeyedProcessFunction<String, ClusterEvent, AlertDecision> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyFilterFunction.class);

    private final SentinelConfig config;
    private final NotificationChannelFactory channelFactory;

    private transient AnomalyFilter filter;
    private transient NotificationChannel channel;
    private transient DecisionPublisher publisher;
    private transient SentinelMetrics metrics;

    /**
     * @param config         validated sentinel configuration
     * @param channelFactory creates the downstream channel when the task opens
     */
    public AnomalyFilterFunction(SentinelConfig config, NotificationChannelFactory channelFactory) {
        this.config = Objects.requireNonNull(config, "SentinelConfig must not be null");
        this.channelFactory = Objects.requireNonNull(channelFactory, "NotificationChannelFactory must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());

        Clock clock = Clock.systemUTC();
        SignatureStore store = new SignatureStore(RecordStores.create(config.getStore()), config.getStore(), clock);
        filter = new AnomalyFilter(store, config.getFilter(), config.getRetry(), clock);

        channel = channelFactory.create();
        UndeliveredDecisionHandler undelivered = (decision, cause) -> {
            metrics.incrementUndelivered();
            UndeliveredDecisionHandler.LOGGING.onUndelivered(decision, cause);
        };
        publisher = new DecisionPublisher(store, channel, config.getPublisher(), undelivered);

        LOG.info("AnomalyFilterFunction opened with {} rule(s), store={}",
                filter.getRules().getRules().size(), config.getStore().getType());
    }

    @Override
    public void close() throws Exception {
        LOG.info("AnomalyFilterFunction closing");
        if (channel instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(ClusterEvent event,
            KeyedProcessFunction<String, ClusterEvent, AlertDecision>.Context ctx,
            Collector<AlertDecision> out) {
        long startNanos = System.nanoTime();
        try {
            AlertDecision decision = filter.decide(event);
            metrics.incrementEventsProcessed();
            if (decision.isRedelivered()) {
                metrics.incrementDuplicates();
            } else if (decision.isAnomalous()) {
                metrics.incrementAnomaliesDetected();
            }

            DeliveryOutcome outcome = publisher.publish(decision);
            if (outcome == DeliveryOutcome.DUPLICATE) {
                metrics.incrementDuplicates();
            } else if (outcome == DeliveryOutcome.PUBLISHED) {
                out.collect(decision);
            }
        } catch (InvalidEventException e) {
            metrics.incrementInvalidEvents();
            LOG.warn("Dropping invalid cluster event for key [{}]: {}", ctx.getCurrentKey(), e.getMessage());
        } finally {
            metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
        }
    }
}
