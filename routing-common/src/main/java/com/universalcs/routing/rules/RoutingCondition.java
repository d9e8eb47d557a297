package com.universalcs.routing.rules;

import com.universalcs.routing.canonical.enums.ConditionOperator;
import com.universalcs.routing.canonical.enums.ConditionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One atomic routing test: type selects the actual value, operator compares
 * it against value.
 *
 * value is an arbitrary JSON literal (string, number, boolean or array).
 * field is a dotted path used by ai_classification and custom conditions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingCondition {
    private ConditionType type;

    private ConditionOperator operator;

    private Object value;

    private String field;
}
