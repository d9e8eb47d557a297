package com.universalcs.routing.service.config;

import com.universalcs.routing.broker.MessageBroker;
import com.universalcs.routing.engine.RuleEngine;
import com.universalcs.routing.engine.action.ActionExecutor;
import com.universalcs.routing.engine.action.ConversationStateClient;
import com.universalcs.routing.engine.cache.CaffeineRuleSetCache;
import com.universalcs.routing.engine.cache.RuleCache;
import com.universalcs.routing.engine.cache.RuleSetCache;
import com.universalcs.routing.engine.condition.ConditionEvaluator;
import com.universalcs.routing.engine.store.ClasspathRuleStore;
import com.universalcs.routing.engine.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the routing engine from explicitly constructed components.
 *
 * Configuration Properties:
 * - routing.rules.location: classpath rules document (default: /config/routing_rules.json)
 * - routing.cache.ttl-seconds: rule cache TTL (default: 300)
 * - routing.cache.max-entries: cached organizations (default: 10000)
 * - routing.broker.max-attempts: maxAttempts on submitted work items (default: 3)
 * - routing.time-zone: zone for time_of_day conditions (default: system zone)
 */
@Configuration
public class RoutingEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngineConfig.class);

    @Bean
    public Clock routingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId routingZoneId(@Value("${routing.time-zone:}") String timeZone) {
        ZoneId zoneId = timeZone == null || timeZone.trim().isEmpty() ? ZoneId.systemDefault() : ZoneId.of(timeZone.trim());
        log.info("time_of_day conditions evaluated in zone {}", zoneId);
        return zoneId;
    }

    @Bean
    public RuleStore ruleStore(@Value("${routing.rules.location:" + ClasspathRuleStore.DEFAULT_RULES_PATH + "}") String location) {
        return new ClasspathRuleStore(location);
    }

    @Bean
    public RuleSetCache ruleSetCache(@Value("${routing.cache.max-entries:10000}") long maxEntries) {
        return new CaffeineRuleSetCache(maxEntries);
    }

    @Bean
    public RuleCache ruleCache(RuleStore ruleStore, RuleSetCache ruleSetCache, Clock routingClock,
                               @Value("${routing.cache.ttl-seconds:300}") long ttlSeconds) {
        return new RuleCache(ruleStore, ruleSetCache, Duration.ofSeconds(ttlSeconds), routingClock);
    }

    @Bean
    public ConditionEvaluator conditionEvaluator(Clock routingClock, ZoneId routingZoneId) {
        return new ConditionEvaluator(routingClock, routingZoneId);
    }

    @Bean
    public ActionExecutor actionExecutor(MessageBroker messageBroker, ConversationStateClient conversationStateClient,
                                         Clock routingClock,
                                         @Value("${routing.broker.max-attempts:3}") int maxAttempts) {
        return new ActionExecutor(messageBroker, conversationStateClient, routingClock, maxAttempts);
    }

    @Bean
    public RuleEngine ruleEngine(RuleCache ruleCache, ConditionEvaluator conditionEvaluator,
                                 ActionExecutor actionExecutor, Clock routingClock) {
        return new RuleEngine(ruleCache, conditionEvaluator, actionExecutor, routingClock);
    }
}
