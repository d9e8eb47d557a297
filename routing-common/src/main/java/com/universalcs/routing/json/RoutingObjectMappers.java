package com.universalcs.routing.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson configuration shared by rule documents, Kafka payloads and message
 * path lookups.
 *
 * Rule documents are authored by tenants, so the mapper is lenient: unknown
 * properties are ignored, unknown condition types/operators read as null and
 * unknown action types read as a null action. The engine treats those as
 * never matching and never executing.
 *
 * Thread-safe: ObjectMapper is thread-safe after configuration.
 */
public final class RoutingObjectMappers {

    private RoutingObjectMappers() {
    }

    public static ObjectMapper create() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.disable(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE);
        objectMapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
        return objectMapper;
    }
}
