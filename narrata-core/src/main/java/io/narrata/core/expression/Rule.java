package io.narrata.core.expression;

import java.util.Objects;

/// One comparison in a {@link Condition}.
///
/// @param id stable identifier, also the output pin name in switch mode, not null
/// @param sheet sheet shortcut of the compared variable, may be blank when incomplete
/// @param variable variable name, may be blank when incomplete
/// @param operator comparison, not null
/// @param value right-hand value as text; the variable name for references; null for
///     unary operators
/// @param valueType literal or variable reference, defaults to literal
/// @param valueSheet sheet of the referenced variable when `valueType` is a reference
/// @param refSpan position of the left-hand reference in the source text, may be null
/// @param valueSpan position of the right-hand reference, may be null
/// @param label optional case label shown for switch-mode branches
public record Rule(
        String id,
        String sheet,
        String variable,
        RuleOperator operator,
        String value,
        ValueType valueType,
        String valueSheet,
        SourceSpan refSpan,
        SourceSpan valueSpan,
        String label) {

    public Rule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        valueType = valueType != null ? valueType : ValueType.LITERAL;
    }

    /// Creates a literal rule without source positions.
    public static Rule of(String sheet, String variable, RuleOperator operator, String value) {
        return new Rule(
                IdGenerator.next("rule"),
                sheet,
                variable,
                operator,
                value,
                ValueType.LITERAL,
                null,
                null,
                null,
                null);
    }

    /// Creates a rule comparing against another variable.
    public static Rule ofReference(
            String sheet,
            String variable,
            RuleOperator operator,
            String valueSheet,
            String valueVariable) {
        return new Rule(
                IdGenerator.next("rule"),
                sheet,
                variable,
                operator,
                valueVariable,
                ValueType.VARIABLE_REF,
                valueSheet,
                null,
                null,
                null);
    }

    /// Returns the dotted left-hand reference.
    public String reference() {
        return sheet + "." + variable;
    }

    /// Returns the dotted right-hand reference, or null for literals.
    public String valueReference() {
        return valueType == ValueType.VARIABLE_REF ? valueSheet + "." + value : null;
    }

    /// Returns false when the rule has no target variable yet.
    public boolean isComplete() {
        return sheet != null && !sheet.isBlank() && variable != null && !variable.isBlank();
    }

    public Rule withId(String newId) {
        return new Rule(
                newId, sheet, variable, operator, value, valueType, valueSheet, refSpan,
                valueSpan, label);
    }

    public Rule withLabel(String newLabel) {
        return new Rule(
                id, sheet, variable, operator, value, valueType, valueSheet, refSpan, valueSpan,
                newLabel);
    }

    /// Returns the label when set, the id otherwise.
    public String displayLabel() {
        return label != null && !label.isBlank() ? label : id;
    }
}
