package com.logsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsentinel.core.model.ClusterEvent;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes →
 * {@link ClusterEvent}.
 * <p>
 * Unparseable messages are logged and dropped (returns {@code null}). Parsed
 * events with invalid fields pass through and are rejected by the anomaly
 * filter, where they are counted.
 * </p>
 */
public class ClusterEventDeserializationSchema implements DeserializationSchema<ClusterEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ClusterEventDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public ClusterEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, ClusterEvent.class);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Failed to deserialize cluster event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(ClusterEvent nextElement) {
        return false;
    }

    @Override
    public TypeInformation<ClusterEvent> getProducedType() {
        return TypeInformation.of(ClusterEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
