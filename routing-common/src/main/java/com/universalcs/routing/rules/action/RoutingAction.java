package com.universalcs.routing.rules.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.universalcs.routing.canonical.enums.ActionType;

/**
 * An effect applied when a routing rule matches.
 *
 * The set of actions is closed: one subclass per {@link ActionType}, each
 * carrying a typed parameters payload. Rule documents select the subclass
 * through the "type" property:
 * <pre>
 * { "type": "set_priority", "parameters": { "priority": "high" } }
 * </pre>
 * Consumers dispatch through {@link RoutingActionVisitor}, so adding an
 * action type breaks every visitor until it handles the new type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AssignToAgentAction.class, name = "assign_to_agent"),
    @JsonSubTypes.Type(value = AssignToTeamAction.class, name = "assign_to_team"),
    @JsonSubTypes.Type(value = SetPriorityAction.class, name = "set_priority"),
    @JsonSubTypes.Type(value = AddTagsAction.class, name = "add_tags"),
    @JsonSubTypes.Type(value = TriggerWebhookAction.class, name = "trigger_webhook"),
    @JsonSubTypes.Type(value = AutoRespondAction.class, name = "auto_respond"),
    @JsonSubTypes.Type(value = EscalateAction.class, name = "escalate")
})
public abstract class RoutingAction {

    public abstract ActionType getType();

    public abstract <R> R accept(RoutingActionVisitor<R> visitor);
}
