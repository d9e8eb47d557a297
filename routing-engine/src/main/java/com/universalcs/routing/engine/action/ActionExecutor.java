package com.universalcs.routing.engine.action;

import com.universalcs.routing.broker.MessageBroker;
import com.universalcs.routing.broker.WorkItem;
import com.universalcs.routing.broker.WorkQueue;
import com.universalcs.routing.canonical.ActionOutcome;
import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.enums.ActionStatus;
import com.universalcs.routing.canonical.enums.ActionType;
import com.universalcs.routing.error.ActionDispatchException;
import com.universalcs.routing.error.BrokerException;
import com.universalcs.routing.rules.action.AddTagsAction;
import com.universalcs.routing.rules.action.AssignToAgentAction;
import com.universalcs.routing.rules.action.AssignToTeamAction;
import com.universalcs.routing.rules.action.AutoRespondAction;
import com.universalcs.routing.rules.action.EscalateAction;
import com.universalcs.routing.rules.action.RoutingAction;
import com.universalcs.routing.rules.action.RoutingActionVisitor;
import com.universalcs.routing.rules.action.SetPriorityAction;
import com.universalcs.routing.rules.action.TriggerWebhookAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies routing actions to a message, one at a time, in the given order.
 *
 * Each action either changes conversation state directly (set_priority,
 * add_tags), submits a work item to the broker (assign_to_agent,
 * trigger_webhook, auto_respond) or is logged only (assign_to_team, escalate).
 *
 * Failures are isolated per action: a failing action is logged, recorded as
 * FAILED and execution continues with the next action. execute never throws
 * because of a single action.
 *
 * Submitted work items are not confirmed; SUBMITTED means the broker accepted
 * the item.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    public static final String DEFAULT_AUTO_RESPONSE = "Thank you for your message. We will get back to you soon.";
    public static final String DEFAULT_WEBHOOK_EVENT = "message.routed";
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    static final String ASSIGN_WORK_TYPE = "message.assign";
    static final String WEBHOOK_WORK_TYPE = "webhook.trigger";
    static final String AUTO_RESPONSE_WORK_TYPE = "message.auto_response";

    private final MessageBroker messageBroker;
    private final ConversationStateClient conversationStateClient;
    private final Clock clock;
    private final int maxAttempts;

    public ActionExecutor(MessageBroker messageBroker, ConversationStateClient conversationStateClient, Clock clock) {
        this(messageBroker, conversationStateClient, clock, DEFAULT_MAX_ATTEMPTS);
    }

    public ActionExecutor(MessageBroker messageBroker, ConversationStateClient conversationStateClient,
                          Clock clock, int maxAttempts) {
        this.messageBroker = messageBroker;
        this.conversationStateClient = conversationStateClient;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Execute actions against a message.
     *
     * @param message message being routed
     * @param actions actions of all matching rules, in rule order
     * @return partial result with one outcome per executed action
     */
    public ActionExecutionResult execute(Message message, List<RoutingAction> actions) {
        ActionExecutionResult result = new ActionExecutionResult();
        if (actions == null || actions.isEmpty()) {
            return result;
        }

        DispatchingVisitor visitor = new DispatchingVisitor(message, result);

        for (RoutingAction action : actions) {
            if (action == null) {
                log.warn("Skipping unknown routing action: messageId={}", message.getId());
                continue;
            }

            ActionOutcome outcome;
            try {
                outcome = action.accept(visitor);
            } catch (RuntimeException e) {
                log.error("Routing action failed: messageId={}, actionType={}, reason={}",
                    message.getId(), action.getType(), e.getMessage(), e);
                outcome = outcome(action.getType(), ActionStatus.FAILED, e.getMessage());
            }
            result.getOutcomes().add(outcome);
        }

        return result;
    }

    private void submit(WorkQueue queue, WorkItem workItem, ActionType actionType) {
        try {
            messageBroker.submit(queue, workItem);
        } catch (BrokerException e) {
            throw new ActionDispatchException(actionType,
                "Broker rejected work item " + workItem.getId() + " on " + queue.getValue(), e);
        }
    }

    private WorkItem workItem(String prefix, String type, String messageId, Map<String, Object> payload) {
        Instant now = Instant.now(clock);
        return WorkItem.builder()
            .id(prefix + "-" + messageId + "-" + now.toEpochMilli())
            .type(type)
            .payload(payload)
            .timestamp(now)
            .attempts(0)
            .maxAttempts(maxAttempts)
            .build();
    }

    private static ActionOutcome outcome(ActionType actionType, ActionStatus status, String detail) {
        return ActionOutcome.builder()
            .actionType(actionType)
            .status(status)
            .detail(detail)
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static ActionDispatchException missingParameter(ActionType actionType, String parameter) {
        return new ActionDispatchException(actionType, "Missing required parameter: " + parameter);
    }

    /**
     * Executes one action and records its effect on the partial result.
     * Result fields are written only after the action succeeded.
     */
    private class DispatchingVisitor implements RoutingActionVisitor<ActionOutcome> {

        private final Message message;
        private final ActionExecutionResult result;

        DispatchingVisitor(Message message, ActionExecutionResult result) {
            this.message = message;
            this.result = result;
        }

        @Override
        public ActionOutcome visitAssignToAgent(AssignToAgentAction action) {
            String agentId = action.getParameters() != null ? action.getParameters().getAgentId() : null;
            if (isBlank(agentId)) {
                throw missingParameter(ActionType.ASSIGN_TO_AGENT, "agentId");
            }

            Map<String, Object> payload = new HashMap<>();
            payload.put("messageId", message.getId());
            payload.put("agentId", agentId);
            payload.put("assignedAt", Instant.now(clock).toString());

            WorkItem workItem = workItem("assign", ASSIGN_WORK_TYPE, message.getId(), payload);
            submit(WorkQueue.ROUTING_ASSIGNMENT, workItem, ActionType.ASSIGN_TO_AGENT);

            result.setAssignedTo(agentId);
            log.info("Submitted agent assignment: messageId={}, agentId={}, workItemId={}",
                message.getId(), agentId, workItem.getId());
            return outcome(ActionType.ASSIGN_TO_AGENT, ActionStatus.SUBMITTED, workItem.getId());
        }

        @Override
        public ActionOutcome visitAssignToTeam(AssignToTeamAction action) {
            String teamId = action.getParameters() != null ? action.getParameters().getTeamId() : null;
            if (isBlank(teamId)) {
                throw missingParameter(ActionType.ASSIGN_TO_TEAM, "teamId");
            }

            // No team queue exists yet; logged only
            log.info("Team assignment requested: messageId={}, teamId={}", message.getId(), teamId);
            return outcome(ActionType.ASSIGN_TO_TEAM, ActionStatus.LOGGED, teamId);
        }

        @Override
        public ActionOutcome visitSetPriority(SetPriorityAction action) {
            String priority = action.getParameters() != null ? action.getParameters().getPriority() : null;
            if (isBlank(priority)) {
                throw missingParameter(ActionType.SET_PRIORITY, "priority");
            }

            conversationStateClient.setPriority(message, priority);
            result.setPriority(priority);
            log.info("Set conversation priority: messageId={}, conversationId={}, priority={}",
                message.getId(), message.getConversationId(), priority);
            return outcome(ActionType.SET_PRIORITY, ActionStatus.APPLIED, priority);
        }

        @Override
        public ActionOutcome visitAddTags(AddTagsAction action) {
            List<String> tags = action.getParameters() != null ? action.getParameters().getTags() : null;
            if (tags == null || tags.isEmpty()) {
                throw missingParameter(ActionType.ADD_TAGS, "tags");
            }

            List<String> copy = new ArrayList<>(tags);
            conversationStateClient.addTags(message, copy);
            result.setTags(copy);
            log.info("Added conversation tags: messageId={}, conversationId={}, tags={}",
                message.getId(), message.getConversationId(), copy);
            return outcome(ActionType.ADD_TAGS, ActionStatus.APPLIED, String.join(",", copy));
        }

        @Override
        public ActionOutcome visitTriggerWebhook(TriggerWebhookAction action) {
            // Any failure below leaves the webhook reported as not triggered
            result.setWebhookTriggered(false);

            TriggerWebhookAction.Parameters parameters = action.getParameters();
            String url = parameters != null ? parameters.getUrl() : null;
            if (isBlank(url)) {
                throw missingParameter(ActionType.TRIGGER_WEBHOOK, "url");
            }
            String event = parameters.getEvent() != null ? parameters.getEvent() : DEFAULT_WEBHOOK_EVENT;

            Map<String, Object> body = new HashMap<>();
            body.put("message", message);
            body.put("timestamp", Instant.now(clock).toString());

            Map<String, Object> payload = new HashMap<>();
            payload.put("messageId", message.getId());
            payload.put("webhookUrl", url);
            payload.put("event", event);
            payload.put("payload", body);

            WorkItem workItem = workItem("webhook", WEBHOOK_WORK_TYPE, message.getId(), payload);
            submit(WorkQueue.WEBHOOK_DELIVERY, workItem, ActionType.TRIGGER_WEBHOOK);

            result.setWebhookTriggered(true);
            log.info("Submitted webhook: messageId={}, url={}, event={}, workItemId={}",
                message.getId(), url, event, workItem.getId());
            return outcome(ActionType.TRIGGER_WEBHOOK, ActionStatus.SUBMITTED, workItem.getId());
        }

        @Override
        public ActionOutcome visitAutoRespond(AutoRespondAction action) {
            String template = action.getParameters() != null ? action.getParameters().getTemplate() : null;
            String responseText = isBlank(template) ? DEFAULT_AUTO_RESPONSE : template;

            Map<String, Object> payload = new HashMap<>();
            payload.put("conversationId", message.getConversationId());
            payload.put("responseText", responseText);
            payload.put("originalMessageId", message.getId());

            WorkItem workItem = workItem("auto-response", AUTO_RESPONSE_WORK_TYPE, message.getId(), payload);
            submit(WorkQueue.MESSAGE_DELIVERY, workItem, ActionType.AUTO_RESPOND);

            result.setAutoResponse(responseText);
            log.info("Submitted auto response: messageId={}, conversationId={}, workItemId={}",
                message.getId(), message.getConversationId(), workItem.getId());
            return outcome(ActionType.AUTO_RESPOND, ActionStatus.SUBMITTED, workItem.getId());
        }

        @Override
        public ActionOutcome visitEscalate(EscalateAction action) {
            Integer level = action.getParameters() != null ? action.getParameters().getLevel() : null;
            String reason = action.getParameters() != null ? action.getParameters().getReason() : null;

            log.info("Escalation requested: messageId={}, level={}, reason={}", message.getId(), level, reason);
            return outcome(ActionType.ESCALATE, ActionStatus.LOGGED, level != null ? "level " + level : null);
        }
    }
}
