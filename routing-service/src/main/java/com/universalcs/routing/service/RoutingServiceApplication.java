package com.universalcs.routing.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Message Routing Application.
 *
 * Main entry point for the routing service.
 *
 * This application:
 * - Consumes classified messages from message.routing.in
 * - Matches them against the organization's routing rules
 * - Submits assignment, webhook and auto-response work items to the broker queues
 * - Publishes the RoutingResult to message.routing.results
 * - Re-publishes messages whose rules cannot be loaded to message.routing.deferred
 */
@SpringBootApplication
public class RoutingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutingServiceApplication.class, args);
    }
}
