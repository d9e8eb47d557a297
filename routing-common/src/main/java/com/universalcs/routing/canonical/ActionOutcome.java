package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.universalcs.routing.canonical.enums.ActionStatus;
import com.universalcs.routing.canonical.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one routing action within a single routing pass.
 *
 * SUBMITTED means the broker accepted a work item, not that the work completed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionOutcome {
    private ActionType actionType;

    private ActionStatus status;

    /**
     * Work item id for submitted actions, error message for failed ones.
     */
    private String detail;
}
