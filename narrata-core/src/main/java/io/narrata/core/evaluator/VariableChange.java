package io.narrata.core.evaluator;

import java.util.Objects;

/// A single variable write produced by an assignment.
///
/// @param variableRef key of the written variable, not null
/// @param oldValue value before the write, may be null
/// @param newValue value after the write, may be null
/// @param operator id of the assignment operator, or `user_override`
public record VariableChange(
        String variableRef, Object oldValue, Object newValue, String operator) {

    public VariableChange {
        Objects.requireNonNull(variableRef, "variableRef must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
    }
}
