package com.universalcs.routing.error;

import com.universalcs.routing.canonical.enums.ActionType;

/**
 * A single routing action could not be applied or submitted.
 *
 * Recorded against the action; never aborts the remaining actions.
 */
public class ActionDispatchException extends RoutingException {

    private final ActionType actionType;

    public ActionDispatchException(ActionType actionType, String message) {
        super(message);
        this.actionType = actionType;
    }

    public ActionDispatchException(ActionType actionType, String message, Throwable cause) {
        super(message, cause);
        this.actionType = actionType;
    }

    public ActionType getActionType() {
        return actionType;
    }
}
