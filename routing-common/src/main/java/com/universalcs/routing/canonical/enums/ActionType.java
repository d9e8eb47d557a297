package com.universalcs.routing.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Routing action type, as written in rule definitions.
 */
public enum ActionType {
    ASSIGN_TO_AGENT("assign_to_agent"),
    ASSIGN_TO_TEAM("assign_to_team"),
    SET_PRIORITY("set_priority"),
    ADD_TAGS("add_tags"),
    TRIGGER_WEBHOOK("trigger_webhook"),
    AUTO_RESPOND("auto_respond"),
    ESCALATE("escalate");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
