package com.universalcs.routing.rules.action;

import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tags the conversation.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class AddTagsAction extends RoutingAction {
    private Parameters parameters;

    public static AddTagsAction of(List<String> tags) {
        return new AddTagsAction(new Parameters(tags));
    }

    @Override
    public ActionType getType() {
        return ActionType.ADD_TAGS;
    }

    @Override
    public <R> R accept(RoutingActionVisitor<R> visitor) {
        return visitor.visitAddTags(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameters {
        private List<String> tags;
    }
}
