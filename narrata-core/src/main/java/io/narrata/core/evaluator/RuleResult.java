package io.narrata.core.evaluator;

import io.narrata.core.expression.RuleOperator;
import java.util.Objects;

/// Explains how one rule evaluated, for console rule details.
///
/// @param ruleId id of the evaluated rule, not null
/// @param variableRef dotted reference of the compared variable, not null
/// @param operator comparison applied, not null
/// @param expectedValue right-hand value after reference resolution, may be null
/// @param actualValue current value of the compared variable, may be null
/// @param passed whether the rule held
/// @param resolved false when the variable or the referenced operand was not found
public record RuleResult(
        String ruleId,
        String variableRef,
        RuleOperator operator,
        Object expectedValue,
        Object actualValue,
        boolean passed,
        boolean resolved) {

    public RuleResult {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(variableRef, "variableRef must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
    }
}
