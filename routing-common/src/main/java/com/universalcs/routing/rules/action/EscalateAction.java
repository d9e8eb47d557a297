package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Escalates the message. Currently logged only; no escalation protocol is defined.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class EscalateAction extends RoutingAction {
    private Parameters parameters;

    public static EscalateAction of(Integer level, String reason) {
        return new EscalateAction(new Parameters(level, reason));
    }

    @Override
    public ActionType getType() {
        return ActionType.ESCALATE;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitEscalate(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        private Integer level;

        private String reason;
    }
}
