package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Sets the conversation priority.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class SetPriorityAction extends RoutingAction {
    private Parameters parameters;

    public static SetPriorityAction of(String priority) {
        return new SetPriorityAction(new Parameters(priority));
    }

    @Override
    public ActionType getType() {
        return ActionType.SET_PRIORITY;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitSetPriority(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        private String priority;
    }
}
