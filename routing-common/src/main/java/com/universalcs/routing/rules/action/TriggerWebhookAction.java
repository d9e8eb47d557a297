package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Submits a webhook delivery for the routed message.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class TriggerWebhookAction extends RoutingAction {
    private Parameters parameters;

    public static TriggerWebhookAction of(String url, String event) {
        return new TriggerWebhookAction(new Parameters(url, event));
    }

    @Override
    public ActionType getType() {
        return ActionType.TRIGGER_WEBHOOK;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitTriggerWebhook(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        private String url;

        /**
         * Event name sent to the webhook; message.routed when absent.
         */
        private String event;
    }
}
