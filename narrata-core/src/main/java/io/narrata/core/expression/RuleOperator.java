package io.narrata.core.expression;

import java.util.Locale;

/// Comparison applied by a {@link Rule}.
///
/// The first eight operators are produced by the expression parser. The
/// remaining ones exist for text, multi select and date variables and are only
/// reachable from structured (JSON) conditions.
public enum RuleOperator {
    EQUALS("equals", "=="),
    NOT_EQUALS("not_equals", "!="),
    GREATER_THAN("greater_than", ">"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", ">="),
    LESS_THAN("less_than", "<"),
    LESS_THAN_OR_EQUAL("less_than_or_equal", "<="),
    IS_TRUE("is_true", null),
    IS_FALSE("is_false", null),
    CONTAINS("contains", null),
    NOT_CONTAINS("not_contains", null),
    STARTS_WITH("starts_with", null),
    ENDS_WITH("ends_with", null),
    IS_EMPTY("is_empty", null),
    IS_NIL("is_nil", null),
    BEFORE("before", null),
    AFTER("after", null);

    private final String id;
    private final String symbol;

    RuleOperator(String id, String symbol) {
        this.id = id;
        this.symbol = symbol;
    }

    public String id() {
        return id;
    }

    /// Returns the infix symbol, or null when the operator has no expression syntax.
    public String symbol() {
        return symbol;
    }

    /// Returns true when the operator takes no right-hand value.
    public boolean isUnary() {
        return this == IS_TRUE || this == IS_FALSE || this == IS_EMPTY || this == IS_NIL;
    }

    /// Returns true for the ordering operators that coerce both sides to numbers.
    public boolean isNumeric() {
        return this == GREATER_THAN
                || this == GREATER_THAN_OR_EQUAL
                || this == LESS_THAN
                || this == LESS_THAN_OR_EQUAL;
    }

    /// Returns the logical complement, used for `!(a > b)`.
    ///
    /// @return complement operator, or null if the operator has none
    public RuleOperator negate() {
        return switch (this) {
            case EQUALS -> NOT_EQUALS;
            case NOT_EQUALS -> EQUALS;
            case GREATER_THAN -> LESS_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN;
            case LESS_THAN -> GREATER_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN;
            case IS_TRUE -> IS_FALSE;
            case IS_FALSE -> IS_TRUE;
            case CONTAINS -> NOT_CONTAINS;
            case NOT_CONTAINS -> CONTAINS;
            default -> null;
        };
    }

    public static RuleOperator fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (RuleOperator operator : values()) {
            if (operator.id.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown rule operator: " + id);
    }

    static RuleOperator fromSymbol(String symbol) {
        for (RuleOperator operator : values()) {
            if (symbol.equals(operator.symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison: " + symbol);
    }
}
