package com.logsentinel.flink;

import com.logsentinel.core.config.ConfigLoader;
import com.logsentinel.core.config.RetryPolicy;
import com.logsentinel.core.config.SentinelConfig;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.model.ClusterEvent;
import com.logsentinel.core.query.HistoryQueryService;
import com.logsentinel.core.store.RecordStores;
import com.logsentinel.core.store.SignatureStore;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.restartstrategy.RestartStrategies;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.functions.sink.DiscardingSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Main entry point for the Log Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (error-clusters topic)
 *     → Deserialize JSON → ClusterEvent
 *     → Key by signature ("LEVEL: message")
 *     → AnomalyFilterFunction (signature store, rule chain, deduplicated publish)
 *         → KafkaNotificationChannel → Kafka (alert-decisions topic), acknowledged per alert
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Wiring from environment variables via {@link JobConfig}; policy from
 * {@code sentinel.yml} via {@link ConfigLoader}.
 * </p>
 *
 * <h3>Delivery</h3>
 * <p>
 * Kafka delivers at least once. Redelivered events are recognised by the
 * signature store's dedup ledgers, so counts and alerts are not doubled.
 * Alerts are written by the filter function itself and confirmed only after
 * the broker acknowledged them; the restart delay is never shorter than the
 * store's claim lease.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(LogSentinelJob.class);

    /** Key for events whose signature is missing; the filter rejects them. */
    static final String INVALID_KEY = "__invalid__";

    private LogSentinelJob() {
        // entry-point class
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Log Sentinel with config: {}", config);

        SentinelConfig sentinelConfig = loadSentinelConfig(config);
        if ("memory".equals(sentinelConfig.getStore().getType())) {
            LOG.warn("Using the in-memory signature store: history is lost on restart and "
                    + "the /history endpoint does not see task-side writes");
        }

        SignatureStore queryStore = new SignatureStore(RecordStores.create(sentinelConfig.getStore()),
                sentinelConfig.getStore(), Clock.systemUTC());
        QueryServer queryServer = new QueryServer(new HistoryQueryService(queryStore));
        queryServer.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(queryServer::stop, "query-server-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);
        configureRestarts(env, config, sentinelConfig);

        buildPipeline(env, config, sentinelConfig);

        env.execute("Log Sentinel - Error Anomaly Filter");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, SentinelConfig sentinelConfig) {
        KafkaSource<ClusterEvent> kafkaSource = KafkaSource.<ClusterEvent>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new ClusterEventDeserializationSchema())
                .build();

        DataStream<ClusterEvent> events = env.fromSource(
                kafkaSource, WatermarkStrategy.noWatermarks(), "kafka-clusters-source");

        DataStream<AlertDecision> alerts = events
                .filter(Objects::nonNull)
                .keyBy(LogSentinelJob::keyOf)
                .process(new AnomalyFilterFunction(sentinelConfig,
                        () -> KafkaNotificationChannel.create(config)))
                .name("anomaly-filter");

        // alerts are already on the topic; the stream only carries what was acknowledged
        alerts.addSink(new DiscardingSink<>()).name("acknowledged-alerts");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static String keyOf(ClusterEvent event) {
        return event.getSignature() != null ? event.getSignature().key() : INVALID_KEY;
    }

    static SentinelConfig loadSentinelConfig(JobConfig config) {
        String path = config.getSentinelConfigPath();
        SentinelConfig sentinelConfig = path.isBlank() ? ConfigLoader.load() : ConfigLoader.fromFile(path);

        if (!config.getStoreDirectory().isBlank()) {
            LOG.info("Overriding store with file store at {}", config.getStoreDirectory());
            sentinelConfig.getStore().setType("file");
            sentinelConfig.getStore().setDirectory(config.getStoreDirectory());
            sentinelConfig.validate();
        }
        return sentinelConfig;
    }

    /**
     * Restart no sooner than the claim lease, so a replayed event finds the
     * pending claim of the failed attempt expired.
     */
    static long restartDelayMillis(JobConfig config, SentinelConfig sentinelConfig) {
        long lease = sentinelConfig.getStore().getClaimLeaseMillis();
        RetryPolicy publisher = sentinelConfig.getPublisher();
        long sendBudget = publisher.getMaxAttempts() * config.getAlertAckTimeoutMs()
                + (publisher.getMaxAttempts() - 1L) * publisher.getMaxBackoffMillis();
        if (sendBudget >= lease) {
            LOG.warn("Alert hand-off may take up to {} ms, longer than the {} ms claim lease; "
                    + "a concurrent redelivery could send the same alert twice", sendBudget, lease);
        }
        return Math.max(config.getRestartDelayMs(), lease);
    }

    private static void configureRestarts(StreamExecutionEnvironment env, JobConfig config,
            SentinelConfig sentinelConfig) {
        long delay = restartDelayMillis(config, sentinelConfig);
        env.setRestartStrategy(RestartStrategies.fixedDelayRestart(config.getRestartAttempts(),
                Time.milliseconds(delay)));
        LOG.info("Restart strategy: {} attempts, {} ms apart", config.getRestartAttempts(), delay);
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
