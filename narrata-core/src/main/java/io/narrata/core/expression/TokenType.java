package io.narrata.core.expression;

enum TokenType {
    IDENTIFIER,
    DOT,
    NUMBER,
    STRING,
    ASSIGN,
    ADD_ASSIGN,
    SUBTRACT_ASSIGN,
    SET_IF_UNSET_ASSIGN,
    EQ,
    NEQ,
    GT,
    GTE,
    LT,
    LTE,
    AND,
    OR,
    NOT,
    LEFT_PAREN,
    RIGHT_PAREN,
    SEMICOLON,
    INVALID,
    EOF;

    boolean isAssignmentOperator() {
        return this == ASSIGN
                || this == ADD_ASSIGN
                || this == SUBTRACT_ASSIGN
                || this == SET_IF_UNSET_ASSIGN;
    }

    boolean isComparison() {
        return this == EQ || this == NEQ || this == GT || this == GTE || this == LT
                || this == LTE;
    }
}
