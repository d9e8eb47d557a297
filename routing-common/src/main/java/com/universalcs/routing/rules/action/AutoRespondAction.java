package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Submits an automatic reply into the message's conversation.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class AutoRespondAction extends RoutingAction {
    private Parameters parameters;

    public static AutoRespondAction of(String template) {
        return new AutoRespondAction(new Parameters(template));
    }

    @Override
    public ActionType getType() {
        return ActionType.AUTO_RESPOND;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitAutoRespond(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        /**
         * Reply text; a default acknowledgement is sent when absent.
         */
        private String template;
    }
}
