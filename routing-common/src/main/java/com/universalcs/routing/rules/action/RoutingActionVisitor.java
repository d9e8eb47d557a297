package com.universalcs.routing.rules.action;

/**
 * Exhaustive dispatch over the routing action variants.
 *
 * @param <R> result of visiting one action
 */
public interface RoutingActionVisitor<R> {

    R visitAssignToAgent(AssignToAgentAction action);

    R visitAssignToTeam(AssignToTeamAction action);

    R visitSetPriority(SetPriorityAction action);

    R visitAddTags(AddTagsAction action);

    R visitTriggerWebhook(TriggerWebhookAction action);

    R visitAutoRespond(AutoRespondAction action);

    R visitEscalate(EscalateAction action);
}
