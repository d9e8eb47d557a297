package com.universalcs.routing.error;

/**
 * The rule set of an organization could not be loaded.
 *
 * Fatal to a single routing call: there is no default action list to fall
 * back on. Callers should treat the message as "routing deferred", never as lost.
 */
public class RuleLoadException extends Exception {

    private final String organizationId;

    public RuleLoadException(String organizationId, String message) {
        super(message);
        this.organizationId = organizationId;
    }

    public RuleLoadException(String organizationId, String message, Throwable cause) {
        super(message, cause);
        this.organizationId = organizationId;
    }

    public String getOrganizationId() {
        return organizationId;
    }
}
