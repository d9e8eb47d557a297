package com.universalcs.routing.error;

/**
 * A condition could not be evaluated (bad pattern, unreadable field).
 *
 * Never leaves the condition evaluator; it is normalized to "condition not met".
 */
public class ConditionEvaluationException extends RoutingException {

    public ConditionEvaluationException(String message) {
        super(message);
    }

    public ConditionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
