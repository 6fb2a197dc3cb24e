package com.logsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsentinel.core.model.AlertDecision;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * Flink {@link SerializationSchema} that converts {@link AlertDecision} → JSON
 * bytes for the Kafka alerts topic.
 *
 * <p>
 * A decision that cannot be serialized raises {@link IllegalStateException};
 * {@link KafkaNotificationChannel} reports it as a permanent delivery failure.
 * </p>
 */
public class AlertDecisionSerializationSchema implements SerializationSchema<AlertDecision> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(AlertDecision decision) {
        try {
            return objectMapper().writeValueAsBytes(decision);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert for ["
                    + decision.getSignatureKey() + "]: " + e.getMessage(), e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
