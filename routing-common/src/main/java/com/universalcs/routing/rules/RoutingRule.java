package com.universalcs.routing.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.universalcs.routing.rules.action.RoutingAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A single tenant-scoped routing rule.
 *
 * A rule matches when every condition holds. Rules are evaluated in the order
 * the rule store returns them; priority is carried for the rule-management
 * surface and is not used to order evaluation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRule {
    private String id;

    private String name;

    private String organizationId;

    private Integer priority;

    @Builder.Default
    private List<RoutingCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<RoutingAction> actions = new ArrayList<>();

    @JsonProperty("isActive")
    private boolean active;

    private Instant createdAt;

    private Instant updatedAt;
}
