package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.universalcs.routing.rules.action.RoutingAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of routing one message.
 *
 * appliedRules and actions are append-only logs of a single routing pass.
 * Result fields set by actions (assignedTo, priority, tags, autoResponse,
 * webhookTriggered) hold the value written by the last rule that set them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutingResult {
    private String messageId;

    private String organizationId;

    /**
     * Ids of matching rules, in evaluation order.
     */
    @Builder.Default
    private List<String> appliedRules = new ArrayList<>();

    /**
     * Actions of all matching rules, concatenated in evaluation order.
     */
    @Builder.Default
    private List<RoutingAction> actions = new ArrayList<>();

    /**
     * Agent the message was submitted for assignment to. Set only once the
     * broker accepted the assignment work item; the agent has not confirmed it.
     * Stays unset when the submission fails.
     */
    private String assignedTo;

    /**
     * Priority the conversation was set to. Set only once the conversation
     * state client accepted the change.
     */
    private String priority;

    private List<String> tags;

    /**
     * Text of the auto response submitted for delivery.
     */
    private String autoResponse;

    /**
     * True when a webhook work item was accepted by the broker.
     */
    private boolean webhookTriggered;

    private Duration processingTime;

    @Builder.Default
    private List<RoutingTrace> routingTrace = new ArrayList<>();

    @Builder.Default
    private List<ActionOutcome> actionOutcomes = new ArrayList<>();
}
