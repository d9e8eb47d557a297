package com.universalcs.routing.engine;

import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.RoutingResult;
import com.universalcs.routing.canonical.RoutingTrace;
import com.universalcs.routing.engine.action.ActionExecutionResult;
import com.universalcs.routing.engine.action.ActionExecutor;
import com.universalcs.routing.engine.cache.RuleCache;
import com.universalcs.routing.engine.condition.ConditionEvaluator;
import com.universalcs.routing.error.RuleLoadException;
import com.universalcs.routing.rules.RoutingCondition;
import com.universalcs.routing.rules.RoutingRule;
import com.universalcs.routing.rules.action.RoutingAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Routing rules engine for matching a message against its organization's rules.
 *
 * This engine:
 * - Evaluates rules in the order the rule cache returns them (priority is not used)
 * - Skips inactive rules and rules of other organizations
 * - Matches a rule when all of its conditions hold (no conditions always matches)
 * - Concatenates the actions of every matching rule, in rule order
 * - Executes the accumulated actions once, so the last rule setting a field wins
 * - Produces RoutingTrace entries explaining every decision
 *
 * Only rule loading can fail a routing call. Condition and action failures are
 * absorbed into the result.
 *
 * Usage:
 * <pre>
 * RuleEngine engine = new RuleEngine(ruleCache, conditionEvaluator, actionExecutor, clock);
 * RoutingResult result = engine.route(message);
 * </pre>
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleCache ruleCache;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionExecutor actionExecutor;
    private final Clock clock;

    public RuleEngine(RuleCache ruleCache, ConditionEvaluator conditionEvaluator,
                      ActionExecutor actionExecutor, Clock clock) {
        this.ruleCache = ruleCache;
        this.conditionEvaluator = conditionEvaluator;
        this.actionExecutor = actionExecutor;
        this.clock = clock;
    }

    /**
     * Route a message.
     *
     * @param message classified message to route
     * @return routing result with applied rules, executed actions and their outcomes
     * @throws RuleLoadException if the organization's rules cannot be loaded
     * @throws IllegalArgumentException if the message or its organizationId is missing
     */
    public RoutingResult route(Message message) throws RuleLoadException {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        if (message.getOrganizationId() == null || message.getOrganizationId().trim().isEmpty()) {
            throw new IllegalArgumentException("Message " + message.getId() + " has no organizationId");
        }

        long startNanos = System.nanoTime();
        String organizationId = message.getOrganizationId();
        log.info("Routing message: messageId={}, organizationId={}", message.getId(), organizationId);

        List<RoutingRule> rules = ruleCache.getRules(organizationId);

        List<RoutingTrace> trace = new ArrayList<>();
        List<String> appliedRules = new ArrayList<>();
        List<RoutingAction> actions = new ArrayList<>();

        for (RoutingRule rule : rules) {
            if (!rule.isActive()) {
                addTraceEntry(trace, rule.getId(), RoutingTrace.INACTIVE, "Rule is inactive");
                continue;
            }

            if (rule.getOrganizationId() != null && !rule.getOrganizationId().equals(organizationId)) {
                log.warn("Ignoring rule of another organization: ruleId={}, ruleOrganizationId={}, organizationId={}",
                    rule.getId(), rule.getOrganizationId(), organizationId);
                addTraceEntry(trace, rule.getId(), RoutingTrace.TENANT_MISMATCH,
                    "Rule belongs to organization " + rule.getOrganizationId());
                continue;
            }

            if (matches(rule, message)) {
                appliedRules.add(rule.getId());
                appendActions(rule, message, actions);
                addTraceEntry(trace, rule.getId(), RoutingTrace.MATCHED, "Rule conditions matched: " + rule.getName());
            } else {
                addTraceEntry(trace, rule.getId(), RoutingTrace.SKIPPED, "Rule conditions did not match");
            }
        }

        if (!appliedRules.isEmpty()) {
            log.info("Rules matched: messageId={}, appliedRules={}, actions={}",
                message.getId(), appliedRules, actions.size());
        }

        ActionExecutionResult executed = actionExecutor.execute(message, actions);

        RoutingResult result = RoutingResult.builder()
            .messageId(message.getId())
            .organizationId(organizationId)
            .appliedRules(appliedRules)
            .actions(actions)
            .assignedTo(executed.getAssignedTo())
            .priority(executed.getPriority())
            .tags(executed.getTags())
            .autoResponse(executed.getAutoResponse())
            .webhookTriggered(executed.isWebhookTriggered())
            .routingTrace(trace)
            .actionOutcomes(executed.getOutcomes())
            .processingTime(Duration.ofNanos(System.nanoTime() - startNanos))
            .build();

        log.info("Routed message: messageId={}, appliedRules={}, processingTimeMs={}",
            message.getId(), appliedRules.size(), result.getProcessingTime().toMillis());

        return result;
    }

    /**
     * A rule matches when every condition holds. No conditions means always match.
     */
    private boolean matches(RoutingRule rule, Message message) {
        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            return true;
        }

        for (RoutingCondition condition : rule.getConditions()) {
            if (!conditionEvaluator.evaluate(condition, message)) {
                return false;
            }
        }
        return true;
    }

    private void appendActions(RoutingRule rule, Message message, List<RoutingAction> actions) {
        if (rule.getActions() == null) {
            return;
        }

        for (RoutingAction action : rule.getActions()) {
            if (action == null) {
                log.warn("Skipping unknown action type: ruleId={}, messageId={}", rule.getId(), message.getId());
                continue;
            }
            actions.add(action);
        }
    }

    private void addTraceEntry(List<RoutingTrace> trace, String ruleId, String decision, String reason) {
        trace.add(RoutingTrace.builder()
            .ruleId(ruleId)
            .decision(decision)
            .reason(reason)
            .timestamp(Instant.now(clock).toString())
            .build());
    }
}
