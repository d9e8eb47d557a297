package com.universalcs.routing.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.json.RoutingObjectMappers;
import org.apache.kafka.common.serialization.Deserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka deserializer for classified messages arriving for routing.
 *
 * Thread-safe: ObjectMapper is thread-safe after configuration.
 */
public class MessageDeserializer implements Deserializer<Message> {

    private static final Logger log = LoggerFactory.getLogger(MessageDeserializer.class);

    private final ObjectMapper objectMapper;

    public MessageDeserializer() {
        this.objectMapper = RoutingObjectMappers.create();
    }

    @Override
    public Message deserialize(String topic, byte[] data) {
        if (data == null) {
            return null;
        }

        try {
            return objectMapper.readValue(data, Message.class);
        } catch (Exception e) {
            log.error("Failed to deserialize Message from topic: {}", topic, e);
            throw new RuntimeException("Failed to deserialize Message", e);
        }
    }

    @Override
    public void close() {
        // ObjectMapper doesn't require cleanup
    }
}
