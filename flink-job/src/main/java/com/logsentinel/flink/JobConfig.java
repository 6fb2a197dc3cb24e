package com.logsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Where the job's collaborators live and how the Flink runtime should treat it.
 *
 * <p>
 * Thresholds, retention and retry budgets are not here; they come from
 * {@code sentinel.yml}. This class holds the deployment facts: Kafka endpoints
 * and topics, parallelism, checkpoint and restart timing, the alert
 * acknowledgment timeout, the store directory and the HTTP port.
 * </p>
 *
 * <table>
 * <caption>Environment variables read by {@link #fromEnvironment()}</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>KAFKA_BOOTSTRAP_SERVERS</td><td>localhost:9092</td></tr>
 * <tr><td>KAFKA_INPUT_TOPIC</td><td>error-clusters</td></tr>
 * <tr><td>KAFKA_ALERT_TOPIC</td><td>alert-decisions</td></tr>
 * <tr><td>KAFKA_GROUP_ID</td><td>log-sentinel</td></tr>
 * <tr><td>ALERT_ACK_TIMEOUT_MS</td><td>10000</td></tr>
 * <tr><td>FLINK_PARALLELISM</td><td>1</td></tr>
 * <tr><td>FLINK_CHECKPOINT_INTERVAL_MS</td><td>60000</td></tr>
 * <tr><td>FLINK_RESTART_ATTEMPTS</td><td>10</td></tr>
 * <tr><td>FLINK_RESTART_DELAY_MS</td><td>10000</td></tr>
 * <tr><td>SENTINEL_CONFIG_PATH</td><td>(classpath sentinel.yml)</td></tr>
 * <tr><td>SENTINEL_STORE_DIR</td><td>(store settings from sentinel.yml)</td></tr>
 * <tr><td>HTTP_PORT</td><td>8080</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 2L;

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;
    private final long alertAckTimeoutMs;

    private final int parallelism;
    private final long checkpointIntervalMs;
    private final int restartAttempts;
    private final long restartDelayMs;

    private final String sentinelConfigPath;
    private final String storeDirectory;
    private final int httpPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.alertAckTimeoutMs = b.alertAckTimeoutMs;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.restartAttempts = b.restartAttempts;
        this.restartDelayMs = b.restartDelayMs;
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.storeDirectory = b.storeDirectory;
        this.httpPort = b.httpPort;
    }

    /**
     * Read the process environment; unset or blank variables keep their
     * default.
     *
     * @throws IllegalStateException    if a numeric variable is not a number
     * @throws IllegalArgumentException if a value fails validation
     */
    public static JobConfig fromEnvironment() {
        Builder builder = new Builder()
                .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "error-clusters"))
                .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "alert-decisions"))
                .kafkaGroupId(env("KAFKA_GROUP_ID", "log-sentinel"))
                .sentinelConfigPath(env("SENTINEL_CONFIG_PATH", ""))
                .storeDirectory(env("SENTINEL_STORE_DIR", ""));
        try {
            builder.alertAckTimeoutMs(Long.parseLong(env("ALERT_ACK_TIMEOUT_MS", "10000")))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .restartAttempts(Integer.parseInt(env("FLINK_RESTART_ATTEMPTS", "10")))
                    .restartDelayMs(Long.parseLong(env("FLINK_RESTART_DELAY_MS", "10000")))
                    .httpPort(Integer.parseInt(env("HTTP_PORT", "8080")));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Numeric environment variable is not a number: " + e.getMessage(), e);
        }
        return builder.build();
    }

    /**
     * Consumer settings for the cluster event source.
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * Producer settings for the alert channel: every in-sync replica must
     * acknowledge, and broker-side retries do not duplicate records.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        return props;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    /**
     * @return how long one alert hand-off waits for the broker
     */
    public long getAlertAckTimeoutMs() {
        return alertAckTimeoutMs;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public int getRestartAttempts() {
        return restartAttempts;
    }

    /**
     * @return requested pause between restarts; the job raises it to the claim
     *         lease when that is longer
     */
    public long getRestartDelayMs() {
        return restartDelayMs;
    }

    /**
     * @return explicit {@code sentinel.yml} path, blank to use the classpath
     */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    /**
     * @return file store directory overriding {@code store.directory}, blank
     *         to keep the YAML setting
     */
    public String getStoreDirectory() {
        return storeDirectory;
    }

    public int getHttpPort() {
        return httpPort;
    }

    /**
     * Mutable staging area for a {@link JobConfig}; starts from the same
     * defaults as {@link JobConfig#fromEnvironment()}.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "error-clusters";
        private String kafkaAlertTopic = "alert-decisions";
        private String kafkaGroupId = "log-sentinel";
        private long alertAckTimeoutMs = 10_000;
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private int restartAttempts = 10;
        private long restartDelayMs = 10_000;
        private String sentinelConfigPath = "";
        private String storeDirectory = "";
        private int httpPort = 8080;

        public Builder kafkaBootstrapServers(String servers) {
            this.kafkaBootstrapServers = servers;
            return this;
        }

        public Builder kafkaInputTopic(String topic) {
            this.kafkaInputTopic = topic;
            return this;
        }

        public Builder kafkaAlertTopic(String topic) {
            this.kafkaAlertTopic = topic;
            return this;
        }

        public Builder kafkaGroupId(String groupId) {
            this.kafkaGroupId = groupId;
            return this;
        }

        public Builder alertAckTimeoutMs(long millis) {
            this.alertAckTimeoutMs = millis;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder checkpointIntervalMs(long millis) {
            this.checkpointIntervalMs = millis;
            return this;
        }

        public Builder restartAttempts(int attempts) {
            this.restartAttempts = attempts;
            return this;
        }

        public Builder restartDelayMs(long millis) {
            this.restartDelayMs = millis;
            return this;
        }

        public Builder sentinelConfigPath(String path) {
            this.sentinelConfigPath = path;
            return this;
        }

        public Builder storeDirectory(String directory) {
            this.storeDirectory = directory;
            return this;
        }

        public Builder httpPort(int port) {
            this.httpPort = port;
            return this;
        }

        /**
         * @throws IllegalArgumentException naming the first offending value
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            // alerts written to the input topic would be read back as clusters
            if (kafkaInputTopic.equals(kafkaAlertTopic)) {
                throw new IllegalArgumentException(
                        "kafkaInputTopic and kafkaAlertTopic must differ, both are: " + kafkaInputTopic);
            }
            requireAtLeast(alertAckTimeoutMs, 1, "alertAckTimeoutMs");
            requireAtLeast(parallelism, 1, "parallelism");
            requireAtLeast(checkpointIntervalMs, 1, "checkpointIntervalMs");
            requireAtLeast(restartAttempts, 0, "restartAttempts");
            requireAtLeast(restartDelayMs, 0, "restartDelayMs");
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [1, 65535], got: " + httpPort);
            }
            sentinelConfigPath = sentinelConfigPath != null ? sentinelConfigPath : "";
            storeDirectory = storeDirectory != null ? storeDirectory : "";
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requireAtLeast(long value, long min, String name) {
            if (value < min) {
                throw new IllegalArgumentException(name + " must be >= " + min + ", got: " + value);
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", topics=" + kafkaInputTopic + "->" + kafkaAlertTopic
                + ", groupId=" + kafkaGroupId
                + ", alertAckTimeoutMs=" + alertAckTimeoutMs
                + ", parallelism=" + parallelism
                + ", checkpointIntervalMs=" + checkpointIntervalMs
                + ", restarts=" + restartAttempts + "x" + restartDelayMs + "ms"
                + ", sentinelConfigPath='" + sentinelConfigPath + '\''
                + ", storeDirectory='" + storeDirectory + '\''
                + ", httpPort=" + httpPort
                + '}';
    }
}
