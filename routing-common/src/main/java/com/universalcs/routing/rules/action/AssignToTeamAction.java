package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Assigns the message to a team. Currently logged only.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class AssignToTeamAction extends RoutingAction {
    private Parameters parameters;

    public static AssignToTeamAction of(String teamId) {
        return new AssignToTeamAction(new Parameters(teamId));
    }

    @Override
    public ActionType getType() {
        return ActionType.ASSIGN_TO_TEAM;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitAssignToTeam(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        private String teamId;
    }
}
