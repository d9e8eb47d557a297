package com.universalcs.routing.engine.support;

import com.universalcs.routing.engine.cache.CachedRuleSet;
import com.universalcs.routing.engine.cache.RuleSetCache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache without eviction, so freshness is decided by the caller's clock alone.
 * Can be made to fail like an unreachable remote cache.
 */
public class MapRuleSetCache implements RuleSetCache {

    private final Map<String, CachedRuleSet> entries = new ConcurrentHashMap<>();
    private volatile boolean failing;

    @Override
    public Optional<CachedRuleSet> get(String key) {
        if (failing) {
            throw new IllegalStateException("Cache unreachable");
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, CachedRuleSet ruleSet) {
        if (failing) {
            throw new IllegalStateException("Cache unreachable");
        }
        entries.put(key, ruleSet);
    }

    @Override
    public void invalidate(String key) {
        entries.remove(key);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public Map<String, CachedRuleSet> getEntries() {
        return entries;
    }
}
