package com.logsentinel.flink;

import com.logsentinel.core.exception.PublishFailureException;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.publish.NotificationChannel;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link NotificationChannel} writing alerts to the Kafka alerts topic and
 * waiting for the broker's acknowledgment before returning.
 *
 * <p>
 * Records are keyed by signature so one signature's alerts stay ordered within
 * a partition. Kafka's retriable errors and acknowledgment timeouts become
 * retryable {@link PublishFailureException}s; everything else is permanent.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaNotificationChannel implements NotificationChannel, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaNotificationChannel.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Producer<byte[], byte[]> producer;
    private final String topic;
    private final long ackTimeoutMillis;
    private final AlertDecisionSerializationSchema serializer = new AlertDecisionSerializationSchema();

    /**
     * @param producer         producer with byte-array key and value
     * @param topic            alerts topic
     * @param ackTimeoutMillis bound on waiting for the broker's acknowledgment
     */
    public KafkaNotificationChannel(Producer<byte[], byte[]> producer, String topic, long ackTimeoutMillis) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        if (ackTimeoutMillis < 1) {
            throw new IllegalArgumentException("ackTimeoutMillis must be >= 1, got: " + ackTimeoutMillis);
        }
        this.ackTimeoutMillis = ackTimeoutMillis;
    }

    /**
     * Open a channel to the job's alerts topic.
     */
    public static KafkaNotificationChannel create(JobConfig config) {
        Properties props = config.kafkaProducerProperties();
        props.setProperty(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.setProperty(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        LOG.info("Opening Kafka notification channel to topic [{}]", config.getKafkaAlertTopic());
        return new KafkaNotificationChannel(new KafkaProducer<>(props), config.getKafkaAlertTopic(),
                config.getAlertAckTimeoutMs());
    }

    @Override
    public void send(AlertDecision decision) {
        byte[] value;
        try {
            value = serializer.serialize(decision);
        } catch (IllegalStateException e) {
            throw new PublishFailureException(e.getMessage(), false, e);
        }
        byte[] key = decision.getSignatureKey().getBytes(StandardCharsets.UTF_8);

        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, key, value))
                    .get(ackTimeoutMillis, TimeUnit.MILLISECONDS);
            LOG.debug("Alert for [{}] acknowledged at {}-{}@{}", decision.getSignatureKey(),
                    metadata.topic(), metadata.partition(), metadata.offset());
        } catch (ExecutionException e) {
            throw failure(decision, e.getCause() != null ? e.getCause() : e);
        } catch (KafkaException e) {
            throw failure(decision, e);
        } catch (TimeoutException e) {
            throw PublishFailureException.transientFailure("No acknowledgment for alert on ["
                    + decision.getSignatureKey() + "] within " + ackTimeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PublishFailureException.transientFailure("Interrupted sending alert for ["
                    + decision.getSignatureKey() + "]", e);
        }
    }

    private PublishFailureException failure(AlertDecision decision, Throwable cause) {
        String message = "Kafka rejected alert for [" + decision.getSignatureKey() + "] on topic "
                + topic + ": " + cause.getMessage();
        return new PublishFailureException(message, cause instanceof RetriableException, cause);
    }

    @Override
    public void close() {
        producer.close(CLOSE_TIMEOUT);
    }
}
