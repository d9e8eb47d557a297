package com.universalcs.routing.broker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical broker queues the router produces work items onto.
 *
 * The router only produces; consumption, retry and backoff belong to the
 * workers behind each queue.
 */
public enum WorkQueue {
    ROUTING_ASSIGNMENT("routing.assignment"),
    WEBHOOK_DELIVERY("webhook.delivery"),
    MESSAGE_DELIVERY("message.delivery");

    private final String value;

    WorkQueue(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
