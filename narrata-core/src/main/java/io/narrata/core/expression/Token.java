package io.narrata.core.expression;

/// Lexical token. For strings `value` holds the unescaped content; for
/// invalid tokens it holds the error message.
record Token(TokenType type, String text, String value, int from, int to) {

    boolean is(TokenType expected) {
        return type == expected;
    }

    /// Describes the token for error messages.
    String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
