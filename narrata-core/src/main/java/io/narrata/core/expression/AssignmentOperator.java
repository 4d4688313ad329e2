package io.narrata.core.expression;

import java.util.Locale;

/// Write applied by an {@link Assignment}.
///
/// `toggle` and `clear` have no expression syntax and only appear in
/// structured instructions.
public enum AssignmentOperator {
    SET("set", "="),
    ADD("add", "+="),
    SUBTRACT("subtract", "-="),
    SET_IF_UNSET("set_if_unset", "?="),
    SET_TRUE("set_true", null),
    SET_FALSE("set_false", null),
    TOGGLE("toggle", null),
    CLEAR("clear", null);

    private final String id;
    private final String symbol;

    AssignmentOperator(String id, String symbol) {
        this.id = id;
        this.symbol = symbol;
    }

    public String id() {
        return id;
    }

    public String symbol() {
        return symbol;
    }

    /// Returns true when the operator reads the assignment value.
    public boolean takesValue() {
        return this == SET || this == ADD || this == SUBTRACT || this == SET_IF_UNSET;
    }

    public static AssignmentOperator fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (AssignmentOperator operator : values()) {
            if (operator.id.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown assignment operator: " + id);
    }

    static AssignmentOperator fromSymbol(String symbol) {
        for (AssignmentOperator operator : values()) {
            if (symbol.equals(operator.symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown assignment operator: " + symbol);
    }
}
