package com.universalcs.routing.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalcs.routing.json.RoutingObjectMappers;
import org.apache.kafka.common.serialization.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka serializer writing routing payloads (WorkItem, RoutingResult,
 * ConversationStateChange, Message) as JSON.
 *
 * Thread-safe: ObjectMapper is thread-safe after configuration.
 */
public class JsonPayloadSerializer<T> implements Serializer<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonPayloadSerializer.class);

    private final ObjectMapper objectMapper;

    public JsonPayloadSerializer() {
        this.objectMapper = RoutingObjectMappers.create();
    }

    @Override
    public byte[] serialize(String topic, T data) {
        if (data == null) {
            return null;
        }

        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (Exception e) {
            log.error("Failed to serialize {} for topic: {}", data.getClass().getSimpleName(), topic, e);
            throw new RuntimeException("Failed to serialize " + data.getClass().getSimpleName(), e);
        }
    }

    @Override
    public void close() {
        // ObjectMapper doesn't require cleanup
    }
}
