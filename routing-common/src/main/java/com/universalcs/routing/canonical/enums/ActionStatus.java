package com.universalcs.routing.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happened to a single routing action during one routing pass.
 */
public enum ActionStatus {
    APPLIED("APPLIED"),
    SUBMITTED("SUBMITTED"),
    LOGGED("LOGGED"),
    FAILED("FAILED");

    private final String value;

    ActionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
