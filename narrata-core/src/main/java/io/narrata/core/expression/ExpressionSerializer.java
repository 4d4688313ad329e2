package io.narrata.core.expression;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Renders structured assignments and conditions back to expression text.
///
/// The output parses back to semantically equal structures, although spacing,
/// number formatting and the spelling of negated comparisons may differ from
/// the text originally typed. Incomplete entries are skipped.
public final class ExpressionSerializer {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    /// Renders assignments as `;`-separated statements.
    ///
    /// @param assignments assignments in order, not null
    /// @return instruction text, empty for an empty list
    public String serializeAssignments(List<Assignment> assignments) {
        Objects.requireNonNull(assignments, "assignments must not be null");
        return assignments.stream()
                .filter(Assignment::isComplete)
                .map(this::serializeAssignment)
                .filter(statement -> !statement.isEmpty())
                .collect(Collectors.joining("; "));
    }

    /// Renders a single assignment, or an empty string when it has no syntax.
    public String serializeAssignment(Assignment assignment) {
        String target = assignment.reference();
        return switch (assignment.operator()) {
            case SET_TRUE -> target + " = true";
            case SET_FALSE -> target + " = false";
            case TOGGLE, CLEAR -> "";
            default ->
                    target
                            + " "
                            + assignment.operator().symbol()
                            + " "
                            + value(assignment.value(), assignment.valueType(),
                                    assignment.valueSheet());
        };
    }

    /// Renders a condition as `&&`-joined or `||`-joined terms.
    ///
    /// @param condition condition to render, may be null
    /// @return condition text, empty when there are no rules
    public String serializeCondition(Condition condition) {
        if (condition == null || condition.isEmpty()) {
            return "";
        }
        String joiner = condition.logic() == ConditionLogic.ANY ? " || " : " && ";
        return condition.rules().stream()
                .filter(Rule::isComplete)
                .map(this::serializeRule)
                .filter(term -> !term.isEmpty())
                .collect(Collectors.joining(joiner));
    }

    /// Renders one rule, or an empty string when its operator has no syntax.
    public String serializeRule(Rule rule) {
        String target = rule.reference();
        if (rule.operator() == RuleOperator.IS_TRUE) {
            return target;
        }
        if (rule.operator() == RuleOperator.IS_FALSE) {
            return "!" + target;
        }
        if (rule.operator().symbol() == null) {
            return "";
        }
        return target
                + " "
                + rule.operator().symbol()
                + " "
                + value(rule.value(), rule.valueType(), rule.valueSheet());
    }

    private static String value(String value, ValueType valueType, String valueSheet) {
        if (valueType == ValueType.VARIABLE_REF) {
            return valueSheet + "." + value;
        }
        if (value == null) {
            return "\"\"";
        }
        if (value.equals("true") || value.equals("false")) {
            return value;
        }
        if (NUMBER.matcher(value).matches()) {
            return value;
        }
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
