package com.universalcs.routing.engine.store;

import com.universalcs.routing.error.RuleLoadException;
import com.universalcs.routing.rules.RoutingRule;

import java.util.List;

/**
 * Persistent source of routing rules.
 *
 * Rule authoring and versioning live outside the router; the router only reads.
 */
public interface RuleStore {

    /**
     * Load every rule of an organization, active or not, in evaluation order.
     *
     * @param organizationId owning tenant
     * @return the organization's rules; empty if it has none
     * @throws RuleLoadException if the store cannot be read
     */
    List<RoutingRule> loadRules(String organizationId) throws RuleLoadException;
}
