package com.universalcs.routing.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied between a condition's actual value and its literal.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    REGEX("regex"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    IN("in"),
    NOT_IN("not_in");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
