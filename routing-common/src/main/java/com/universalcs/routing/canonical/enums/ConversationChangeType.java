package com.universalcs.routing.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of conversation state change requested by a routing action.
 */
public enum ConversationChangeType {
    PRIORITY("PRIORITY"),
    TAGS("TAGS");

    private final String value;

    ConversationChangeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
