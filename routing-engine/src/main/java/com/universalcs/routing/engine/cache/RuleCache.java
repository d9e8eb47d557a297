package com.universalcs.routing.engine.cache;

import com.universalcs.routing.engine.store.RuleStore;
import com.universalcs.routing.error.RuleLoadException;
import com.universalcs.routing.rules.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Per-organization rule lists, cached in front of the rule store.
 *
 * Lookup order:
 * 1. Fresh cache entry for routing_rules:{organizationId} - returned as is
 * 2. Load already running for the same organization - wait for its result
 * 3. Otherwise load from the store and cache the result for the TTL
 *
 * Returns what the store provides, inactive rules included. A failing cache
 * only costs a store load; a failing store is a {@link RuleLoadException}.
 *
 * This class is thread-safe.
 */
public class RuleCache {

    private static final Logger log = LoggerFactory.getLogger(RuleCache.class);

    public static final String KEY_PREFIX = "routing_rules:";
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final RuleStore ruleStore;
    private final RuleSetCache cache;
    private final Duration ttl;
    private final Clock clock;

    // Key: cache key, Value: load in progress for that organization
    private final ConcurrentMap<String, CompletableFuture<List<RoutingRule>>> inFlightLoads = new ConcurrentHashMap<>();

    public RuleCache(RuleStore ruleStore, RuleSetCache cache) {
        this(ruleStore, cache, DEFAULT_TTL, Clock.systemUTC());
    }

    public RuleCache(RuleStore ruleStore, RuleSetCache cache, Duration ttl, Clock clock) {
        this.ruleStore = ruleStore;
        this.cache = cache;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Get the rules of an organization.
     *
     * @param organizationId owning tenant
     * @return unmodifiable rule list in store order; the same instance while the entry is fresh
     * @throws RuleLoadException if the rules are not cached and the store cannot be read
     */
    public List<RoutingRule> getRules(String organizationId) throws RuleLoadException {
        String key = cacheKey(organizationId);

        Optional<List<RoutingRule>> cached = lookup(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<List<RoutingRule>> ownLoad = new CompletableFuture<>();
        CompletableFuture<List<RoutingRule>> runningLoad = inFlightLoads.putIfAbsent(key, ownLoad);
        if (runningLoad != null) {
            log.debug("Waiting for running rule load: organizationId={}", organizationId);
            return await(organizationId, runningLoad);
        }

        try {
            // A load may have completed between the first lookup and claiming the key
            Optional<List<RoutingRule>> refreshed = lookup(key);
            List<RoutingRule> rules = refreshed.isPresent() ? refreshed.get() : loadAndCache(organizationId, key);
            ownLoad.complete(rules);
            return rules;
        } catch (RuleLoadException | RuntimeException | Error e) {
            // Waiters block on ownLoad, so it must complete on every path
            ownLoad.completeExceptionally(e);
            throw e;
        } finally {
            inFlightLoads.remove(key, ownLoad);
        }
    }

    /**
     * Drop the cached rules of an organization; the next lookup reloads from the store.
     *
     * @param organizationId owning tenant
     */
    public void invalidate(String organizationId) {
        String key = cacheKey(organizationId);
        try {
            cache.invalidate(key);
            log.info("Invalidated cached routing rules: organizationId={}", organizationId);
        } catch (RuntimeException e) {
            log.warn("Failed to invalidate cached routing rules: organizationId={}, reason={}",
                organizationId, e.getMessage());
        }
    }

    public static String cacheKey(String organizationId) {
        return KEY_PREFIX + organizationId;
    }

    private Optional<List<RoutingRule>> lookup(String key) {
        Optional<CachedRuleSet> entry;
        try {
            entry = cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Rule cache read failed, loading from store: key={}, reason={}", key, e.getMessage());
            return Optional.empty();
        }

        if (entry.isPresent() && entry.get().isFresh(clock.instant()) && entry.get().getRules() != null) {
            log.debug("Rule cache hit: key={}", key);
            return Optional.of(entry.get().getRules());
        }
        return Optional.empty();
    }

    private List<RoutingRule> loadAndCache(String organizationId, String key) throws RuleLoadException {
        List<RoutingRule> loaded;
        try {
            loaded = ruleStore.loadRules(organizationId);
        } catch (RuntimeException e) {
            throw new RuleLoadException(organizationId, "Rule store failed for organization " + organizationId, e);
        }

        List<RoutingRule> rules = loaded == null
            ? Collections.emptyList()
            : loaded.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());

        CachedRuleSet entry = CachedRuleSet.builder()
            .organizationId(organizationId)
            .rules(rules)
            .refreshedAt(clock.instant())
            .ttl(ttl)
            .build();

        try {
            cache.put(key, entry);
        } catch (RuntimeException e) {
            log.warn("Rule cache write failed: key={}, reason={}", key, e.getMessage());
        }

        log.info("Refreshed routing rules: organizationId={}, rules={}", organizationId, rules.size());
        return rules;
    }

    private List<RoutingRule> await(String organizationId, CompletableFuture<List<RoutingRule>> runningLoad)
            throws RuleLoadException {
        try {
            return runningLoad.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuleLoadException(organizationId, "Interrupted while waiting for rule load", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuleLoadException) {
                throw (RuleLoadException) cause;
            }
            throw new RuleLoadException(organizationId, "Rule load failed for organization " + organizationId, cause);
        }
    }
}
