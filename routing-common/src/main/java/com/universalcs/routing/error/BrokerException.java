package com.universalcs.routing.error;

/**
 * The message broker did not accept a work item.
 */
public class BrokerException extends RoutingException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
