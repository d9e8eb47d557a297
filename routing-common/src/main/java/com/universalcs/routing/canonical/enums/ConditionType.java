package com.universalcs.routing.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Source a routing condition reads its actual value from.
 */
public enum ConditionType {
    CONTENT_CONTAINS("content_contains"),
    SENDER_EMAIL("sender_email"),
    AI_CLASSIFICATION("ai_classification"),
    SENTIMENT("sentiment"),
    URGENCY("urgency"),
    TIME_OF_DAY("time_of_day"),
    CUSTOM("custom");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
