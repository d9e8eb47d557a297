package com.universalcs.routing.engine.action;

import com.universalcs.routing.canonical.ActionOutcome;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial routing result produced by the action executor.
 *
 * Fields are written in action order, so the last action that sets a field wins.
 */
@Data
public class ActionExecutionResult {
    private String assignedTo;

    private String priority;

    private List<String> tags;

    private String autoResponse;

    private boolean webhookTriggered;

    private List<ActionOutcome> outcomes = new ArrayList<>();
}
