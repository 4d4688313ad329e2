package io.narrata.core.evaluator;

import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentOperator;
import io.narrata.core.expression.ValueType;
import io.narrata.core.variable.ReferenceResolver;
import io.narrata.core.variable.ResolvedReference;
import io.narrata.core.variable.Values;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import io.narrata.core.variable.VariableStore;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Applies assignments to a variable store, functionally.
///
/// Each assignment writes at most one variable and returns a new store; the
/// input store is never modified. A write moves the current value to
/// `previousValue` and tags the variable with {@link VariableSource#INSTRUCTION}.
///
/// | Operator | Effect |
/// |----------|--------|
/// | `set` | coerces the operand to the variable type and stores it |
/// | `add`, `subtract` | numeric arithmetic; non-numeric sides are skipped with a warning |
/// | `set_if_unset` | `set`, but only while the variable holds its type default |
/// | `set_true`, `set_false` | stores the boolean |
/// | `toggle` | flips a boolean, `null` becomes `true` |
/// | `clear` | restores the type default |
///
/// Unknown targets and unknown referenced operands are skipped with a warning.
///
/// Stateless and thread safe.
public class AssignmentExecutor {

    private static final Logger logger = Logger.getLogger(AssignmentExecutor.class.getName());

    private final ReferenceResolver resolver;

    public AssignmentExecutor(ReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /// Applies assignments in order, each seeing the writes of the previous ones.
    ///
    /// @param assignments assignments to apply, not null
    /// @param variables starting store, not null
    /// @return final store with every change and warning, never null
    public AssignmentOutcome applyAll(List<Assignment> assignments, VariableStore variables) {
        AssignmentOutcome outcome = AssignmentOutcome.unchanged(variables);
        for (Assignment assignment : assignments) {
            outcome = outcome.then(apply(assignment, outcome.variables()));
        }
        return outcome;
    }

    /// Applies a single assignment.
    ///
    /// @param assignment assignment to apply, not null
    /// @param variables current store, not null
    /// @return new store and the change, or the same store and a warning
    public AssignmentOutcome apply(Assignment assignment, VariableStore variables) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        if (!assignment.isComplete()) {
            logger.fine("Skipping incomplete assignment " + assignment.id());
            return AssignmentOutcome.unchanged(variables);
        }

        Optional<ResolvedReference> target =
                resolver.resolve(assignment.sheet(), assignment.variable(), variables);
        if (target.isEmpty()) {
            return AssignmentOutcome.warning(
                    variables, "Variable not found in state: " + assignment.reference());
        }
        Variable variable = target.get().variable();

        Object operand = assignment.value();
        if (assignment.operator().takesValue()
                && assignment.valueType() == ValueType.VARIABLE_REF) {
            Optional<ResolvedReference> referenced =
                    resolver.resolve(assignment.valueSheet(), assignment.value(), variables);
            if (referenced.isEmpty()) {
                return AssignmentOutcome.warning(
                        variables,
                        "Referenced variable " + assignment.valueReference() + " not found");
            }
            operand = referenced.get().variable().getValue();
        }

        Object current = variable.getValue();
        Object newValue;
        switch (assignment.operator()) {
            case SET, SET_IF_UNSET -> {
                if (assignment.operator() == AssignmentOperator.SET_IF_UNSET
                        && !variable.getType().isUnset(current)) {
                    logger.fine("Skipping ?= on " + variable.getKey() + ", value already set");
                    return AssignmentOutcome.unchanged(variables);
                }
                if (operand == null) {
                    newValue = null;
                } else {
                    Optional<Object> coerced = Values.coerce(variable.getType(), operand);
                    if (coerced.isEmpty()) {
                        return AssignmentOutcome.warning(
                                variables,
                                "Cannot set " + variable.getType().id() + " variable "
                                        + variable.getKey() + " to " + Values.display(operand));
                    }
                    newValue = coerced.get();
                }
            }
            case ADD, SUBTRACT -> {
                Optional<BigDecimal> left = Values.toNumber(current);
                Optional<BigDecimal> right = Values.toNumber(operand);
                if (left.isEmpty() || right.isEmpty()) {
                    return AssignmentOutcome.warning(
                            variables,
                            "Cannot " + assignment.operator().id() + " "
                                    + Values.display(operand) + " on " + variable.getKey()
                                    + " holding " + Values.display(current)
                                    + ": both sides must be numeric");
                }
                Optional<BigDecimal> result;
                try {
                    result = Values.toNumber(
                            assignment.operator() == AssignmentOperator.ADD
                                    ? left.get().add(right.get())
                                    : left.get().subtract(right.get()));
                } catch (ArithmeticException e) {
                    logger.fine("Arithmetic failed on " + variable.getKey() + ": " + e.getMessage());
                    result = Optional.empty();
                }
                if (result.isEmpty()) {
                    return AssignmentOutcome.warning(
                            variables,
                            "Cannot " + assignment.operator().id() + " "
                                    + Values.display(operand) + " on " + variable.getKey()
                                    + ": result is out of range");
                }
                newValue = Values.normalizeNumber(result.get());
            }
            case SET_TRUE -> newValue = Boolean.TRUE;
            case SET_FALSE -> newValue = Boolean.FALSE;
            case TOGGLE -> {
                if (current != null && !(current instanceof Boolean)) {
                    return AssignmentOutcome.warning(
                            variables, "Cannot toggle non-boolean variable " + variable.getKey());
                }
                newValue = !Boolean.TRUE.equals(current);
            }
            case CLEAR -> newValue = variable.getType().defaultValue();
            default -> throw new IllegalStateException(
                    "Unhandled operator: " + assignment.operator());
        }

        Variable updated = variable.withValue(newValue, VariableSource.INSTRUCTION);
        VariableChange change =
                new VariableChange(
                        variable.getKey(), current, updated.getValue(),
                        assignment.operator().id());
        logger.fine(
                "Applied " + assignment.operator().id() + " to " + variable.getKey() + ": "
                        + Values.display(current) + " -> " + Values.display(updated.getValue()));
        return new AssignmentOutcome(variables.with(updated), List.of(change), List.of());
    }
}
