package io.narrata.core.expression;

import java.util.Objects;

/// One variable write in an instruction.
///
/// @param id stable identifier, not null
/// @param sheet sheet shortcut of the target, may be blank when incomplete
/// @param variable target variable name, may be blank when incomplete
/// @param operator write to apply, not null
/// @param value operand as text; the variable name for references; null when the
///     operator takes no value
/// @param valueType literal or variable reference, defaults to literal
/// @param valueSheet sheet of the referenced variable when `valueType` is a reference
/// @param refSpan position of the target reference in the source text, may be null
/// @param valueSpan position of the operand reference, may be null
public record Assignment(
        String id,
        String sheet,
        String variable,
        AssignmentOperator operator,
        String value,
        ValueType valueType,
        String valueSheet,
        SourceSpan refSpan,
        SourceSpan valueSpan) {

    public Assignment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        valueType = valueType != null ? valueType : ValueType.LITERAL;
    }

    /// Creates a literal assignment without source positions.
    public static Assignment of(
            String sheet, String variable, AssignmentOperator operator, String value) {
        return new Assignment(
                IdGenerator.next("assign"),
                sheet,
                variable,
                operator,
                value,
                ValueType.LITERAL,
                null,
                null,
                null);
    }

    /// Creates an assignment whose operand is another variable.
    public static Assignment ofReference(
            String sheet,
            String variable,
            AssignmentOperator operator,
            String valueSheet,
            String valueVariable) {
        return new Assignment(
                IdGenerator.next("assign"),
                sheet,
                variable,
                operator,
                valueVariable,
                ValueType.VARIABLE_REF,
                valueSheet,
                null,
                null);
    }

    public String reference() {
        return sheet + "." + variable;
    }

    public String valueReference() {
        return valueType == ValueType.VARIABLE_REF ? valueSheet + "." + value : null;
    }

    /// Returns false for half-authored entries that must be skipped.
    public boolean isComplete() {
        if (sheet == null || sheet.isBlank() || variable == null || variable.isBlank()) {
            return false;
        }
        return !operator.takesValue() || value != null;
    }

    public Assignment withId(String newId) {
        return new Assignment(
                newId, sheet, variable, operator, value, valueType, valueSheet, refSpan,
                valueSpan);
    }
}
