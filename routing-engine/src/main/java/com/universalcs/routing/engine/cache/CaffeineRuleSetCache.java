package com.universalcs.routing.engine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process {@link RuleSetCache} backed by Caffeine.
 *
 * Each entry expires after its own ttl, measured from the write.
 */
public class CaffeineRuleSetCache implements RuleSetCache {

    private static final Duration FALLBACK_TTL = Duration.ofMinutes(5);

    private final Cache<String, CachedRuleSet> cache;

    public CaffeineRuleSetCache(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    /** Package-private constructor for testing with a controllable ticker. */
    CaffeineRuleSetCache(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new RuleSetExpiry())
            .ticker(ticker)
            .build();
    }

    @Override
    public Optional<CachedRuleSet> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, CachedRuleSet ruleSet) {
        cache.put(key, ruleSet);
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    private static final class RuleSetExpiry implements Expiry<String, CachedRuleSet> {

        @Override
        public long expireAfterCreate(String key, CachedRuleSet value, long currentTime) {
            Duration ttl = value.getTtl() != null ? value.getTtl() : FALLBACK_TTL;
            return ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedRuleSet value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CachedRuleSet value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
