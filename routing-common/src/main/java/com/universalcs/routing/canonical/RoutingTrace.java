package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Routing decision trace entry.
 *
 * Explains why a rule did or did not contribute to a routing result.
 * Each entry represents a single rule evaluation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutingTrace {
    public static final String MATCHED = "MATCHED";
    public static final String SKIPPED = "SKIPPED";
    public static final String INACTIVE = "INACTIVE";
    public static final String TENANT_MISMATCH = "TENANT_MISMATCH";

    /**
     * Rule ID that was evaluated.
     */
    private String ruleId;

    /**
     * Decision made (MATCHED, SKIPPED, INACTIVE, TENANT_MISMATCH).
     */
    private String decision;

    /**
     * Explanation of the decision.
     */
    private String reason;

    /**
     * ISO 8601 timestamp of when the decision was made.
     */
    private String timestamp;
}
