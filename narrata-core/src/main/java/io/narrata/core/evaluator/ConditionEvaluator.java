package io.narrata.core.evaluator;

import io.narrata.core.expression.Condition;
import io.narrata.core.expression.ConditionLogic;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.RuleOperator;
import io.narrata.core.expression.ValueType;
import io.narrata.core.variable.ReferenceResolver;
import io.narrata.core.variable.ResolvedReference;
import io.narrata.core.variable.Values;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableStore;
import io.narrata.core.variable.VariableType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;
import java.util.logging.Logger;

/// Evaluates conditions against a variable store.
///
/// ### Boolean mode
/// Rules combine under the condition's logic. Every complete rule is
/// evaluated so the console can explain each of them; the outcome equals the
/// short-circuit combination since evaluation has no side effects.
///
/// ### Switch mode
/// Rules are tried in authoring order, ignoring the logic, and the first rule
/// that holds is selected. Later rules are not evaluated.
///
/// ### Failure semantics
/// An unknown variable, an unknown referenced operand or a failed numeric
/// coercion makes the rule false. Nothing here throws for bad data.
///
/// Stateless and thread safe.
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private final ReferenceResolver resolver;

    public ConditionEvaluator(ReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /// Evaluates a condition in boolean mode.
    ///
    /// @param condition condition to evaluate, null counts as empty
    /// @param variables current variables, not null
    /// @return combined result with per-rule details, never null
    public ConditionResult evaluate(Condition condition, VariableStore variables) {
        if (condition == null) {
            return new ConditionResult(true, List.of());
        }
        List<RuleResult> details = new ArrayList<>();
        for (Rule rule : condition.rules()) {
            if (rule.isComplete()) {
                details.add(evaluateRule(rule, variables));
            }
        }
        if (details.isEmpty()) {
            return new ConditionResult(true, details);
        }
        boolean passed =
                condition.logic() == ConditionLogic.ANY
                        ? details.stream().anyMatch(RuleResult::passed)
                        : details.stream().allMatch(RuleResult::passed);
        return new ConditionResult(passed, details);
    }

    /// Evaluates a condition in switch mode.
    ///
    /// @param condition condition whose rules are the cases, null counts as empty
    /// @param variables current variables, not null
    /// @return the first rule that holds, if any, never null
    public SwitchResult evaluateSwitch(Condition condition, VariableStore variables) {
        List<RuleResult> details = new ArrayList<>();
        if (condition == null) {
            return new SwitchResult(null, -1, details);
        }
        List<Rule> rules = condition.rules();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (!rule.isComplete()) {
                continue;
            }
            RuleResult result = evaluateRule(rule, variables);
            details.add(result);
            if (result.passed()) {
                return new SwitchResult(rule, i, details);
            }
        }
        return new SwitchResult(null, -1, details);
    }

    /// Evaluates a single rule.
    public RuleResult evaluateRule(Rule rule, VariableStore variables) {
        Optional<ResolvedReference> target =
                resolver.resolve(rule.sheet(), rule.variable(), variables);
        if (target.isEmpty()) {
            logger.fine(() -> "Unresolved variable in rule " + rule.id() + ": " + rule.reference());
            return new RuleResult(
                    rule.id(), rule.reference(), rule.operator(), rule.value(), null, false,
                    false);
        }

        Variable variable = target.get().variable();
        Object actual = variable.getValue();
        Object expected = rule.value();
        if (rule.valueType() == ValueType.VARIABLE_REF) {
            Optional<ResolvedReference> operand =
                    resolver.resolve(rule.valueSheet(), rule.value(), variables);
            if (operand.isEmpty()) {
                return new RuleResult(
                        rule.id(), variable.getKey(), rule.operator(), rule.valueReference(),
                        actual, false, false);
            }
            expected = operand.get().variable().getValue();
        }

        boolean passed = compare(rule.operator(), variable.getType(), actual, expected);
        return new RuleResult(
                rule.id(), variable.getKey(), rule.operator(), expected, actual, passed, true);
    }

    private boolean compare(
            RuleOperator operator, VariableType type, Object actual, Object expected) {
        return switch (operator) {
            case IS_TRUE -> Boolean.TRUE.equals(actual);
            case IS_FALSE -> Boolean.FALSE.equals(actual);
            case IS_NIL -> actual == null;
            case IS_EMPTY -> isEmpty(actual);
            case EQUALS -> valueEquals(type, actual, expected);
            case NOT_EQUALS -> !valueEquals(type, actual, expected);
            case GREATER_THAN -> compareNumbers(actual, expected, c -> c > 0);
            case GREATER_THAN_OR_EQUAL -> compareNumbers(actual, expected, c -> c >= 0);
            case LESS_THAN -> compareNumbers(actual, expected, c -> c < 0);
            case LESS_THAN_OR_EQUAL -> compareNumbers(actual, expected, c -> c <= 0);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case STARTS_WITH ->
                    actual != null && Values.toText(actual).startsWith(Values.toText(expected));
            case ENDS_WITH ->
                    actual != null && Values.toText(actual).endsWith(Values.toText(expected));
            case BEFORE -> compareDates(actual, expected, c -> c < 0);
            case AFTER -> compareDates(actual, expected, c -> c > 0);
        };
    }

    private static boolean valueEquals(VariableType type, Object actual, Object expected) {
        switch (type) {
            case NUMBER -> {
                Optional<BigDecimal> left = Values.toNumber(actual);
                Optional<BigDecimal> right = Values.toNumber(expected);
                if (left.isPresent() && right.isPresent()) {
                    return left.get().compareTo(right.get()) == 0;
                }
            }
            case BOOLEAN -> {
                Optional<Boolean> left = Values.toBoolean(actual);
                Optional<Boolean> right = Values.toBoolean(expected);
                return left.isPresent() && left.equals(right);
            }
            case DATE -> {
                Optional<LocalDate> left = Values.toDate(actual);
                Optional<LocalDate> right = Values.toDate(expected);
                if (left.isPresent() && right.isPresent()) {
                    return left.get().isEqual(right.get());
                }
            }
            case MULTI_SELECT -> {
                if (actual instanceof Collection<?> left && expected instanceof Collection<?> right) {
                    return new HashSet<>(left).equals(new HashSet<>(right));
                }
            }
            default -> {
                // string comparison below
            }
        }
        return Values.toText(actual).equals(Values.toText(expected));
    }

    private static boolean compareNumbers(
            Object actual, Object expected, IntPredicate test) {
        Optional<BigDecimal> left = Values.toNumber(actual);
        Optional<BigDecimal> right = Values.toNumber(expected);
        return left.isPresent() && right.isPresent() && test.test(left.get().compareTo(right.get()));
    }

    private static boolean compareDates(
            Object actual, Object expected, IntPredicate test) {
        Optional<LocalDate> left = Values.toDate(actual);
        Optional<LocalDate> right = Values.toDate(expected);
        return left.isPresent() && right.isPresent() && test.test(left.get().compareTo(right.get()));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            String needle = Values.toText(expected);
            return collection.stream().anyMatch(item -> Values.toText(item).equals(needle));
        }
        return actual != null && Values.toText(actual).contains(Values.toText(expected));
    }

    private static boolean isEmpty(Object actual) {
        if (actual == null) {
            return true;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return actual instanceof String text && text.isBlank();
    }
}
