package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Submits an assignment of the message to a specific agent.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class AssignToAgentAction extends RoutingAction {
    private Parameters parameters;

    public static AssignToAgentAction of(String agentId) {
        return new AssignToAgentAction(new Parameters(agentId));
    }

    @Override
    public ActionType getType() {
        return ActionType.ASSIGN_TO_AGENT;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitAssignToAgent(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        private String agentId;
    }
}
