package io.narrata.core.expression;

import java.util.ArrayList;
import java.util.List;

/// Splits expression text into tokens.
///
/// Never fails: characters that start no token become {@link TokenType#INVALID}
/// tokens and are reported by the parser at their exact position.
final class ExpressionLexer {

    private final String text;
    private int pos;

    ExpressionLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, text.length(), text.length()));
                return tokens;
            }
            tokens.add(next(tokens.isEmpty() ? null : tokens.get(tokens.size() - 1)));
        }
    }

    private Token next(Token previous) {
        int start = pos;
        char c = text.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            return token(TokenType.IDENTIFIER, start);
        }
        if (Character.isDigit(c) || (c == '-' && startsNegativeNumber(previous))) {
            return number(start);
        }
        if (c == '"') {
            return string(start);
        }

        String two = pos + 1 < text.length() ? text.substring(pos, pos + 2) : "";
        TokenType pair =
                switch (two) {
                    case "+=" -> TokenType.ADD_ASSIGN;
                    case "-=" -> TokenType.SUBTRACT_ASSIGN;
                    case "?=" -> TokenType.SET_IF_UNSET_ASSIGN;
                    case "==" -> TokenType.EQ;
                    case "!=" -> TokenType.NEQ;
                    case ">=" -> TokenType.GTE;
                    case "<=" -> TokenType.LTE;
                    case "&&" -> TokenType.AND;
                    case "||" -> TokenType.OR;
                    default -> null;
                };
        if (pair != null) {
            pos += 2;
            return token(pair, start);
        }

        TokenType single =
                switch (c) {
                    case '.' -> TokenType.DOT;
                    case '=' -> TokenType.ASSIGN;
                    case '>' -> TokenType.GT;
                    case '<' -> TokenType.LT;
                    case '!' -> TokenType.NOT;
                    case '(' -> TokenType.LEFT_PAREN;
                    case ')' -> TokenType.RIGHT_PAREN;
                    case ';' -> TokenType.SEMICOLON;
                    default -> null;
                };
        pos++;
        if (single != null) {
            return token(single, start);
        }
        return new Token(
                TokenType.INVALID,
                text.substring(start, pos),
                "Unexpected character '" + c + "'",
                start,
                pos);
    }

    private Token number(int start) {
        if (text.charAt(pos) == '-') {
            pos++;
        }
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < text.length()
                && text.charAt(pos) == '.'
                && Character.isDigit(text.charAt(pos + 1))) {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        return token(TokenType.NUMBER, start);
    }

    private Token string(int start) {
        StringBuilder content = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                char escaped = text.charAt(pos + 1);
                if (escaped == '"' || escaped == '\\') {
                    content.append(escaped);
                    pos += 2;
                    continue;
                }
            }
            if (c == '"') {
                pos++;
                return new Token(
                        TokenType.STRING, text.substring(start, pos), content.toString(), start,
                        pos);
            }
            content.append(c);
            pos++;
        }
        return new Token(
                TokenType.INVALID, text.substring(start, pos), "Unterminated string", start, pos);
    }

    /// A minus directly followed by a digit is a sign only where a value is expected.
    private boolean startsNegativeNumber(Token previous) {
        if (pos + 1 >= text.length() || !Character.isDigit(text.charAt(pos + 1))) {
            return false;
        }
        return previous != null
                && (previous.type().isAssignmentOperator() || previous.type().isComparison());
    }

    private Token token(TokenType type, int start) {
        String lexeme = text.substring(start, pos);
        return new Token(type, lexeme, lexeme, start, pos);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
