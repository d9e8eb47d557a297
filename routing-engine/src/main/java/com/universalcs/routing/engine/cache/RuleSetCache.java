package com.universalcs.routing.engine.cache;

import java.util.Optional;

/**
 * Key-value cache for per-organization rule sets.
 *
 * Implementations may be in-process or remote. Entries carry their own TTL;
 * an implementation may evict an entry once it expires but callers still
 * check {@link CachedRuleSet#isFresh} before trusting it.
 */
public interface RuleSetCache {

    Optional<CachedRuleSet> get(String key);

    void put(String key, CachedRuleSet ruleSet);

    void invalidate(String key);
}
