package io.narrata.core.expression;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionLexerTest {

    @Test
    void shouldTokenizeComparisonWithNegativeNumber() {
        // When
        List<Token> tokens = new ExpressionLexer("a.b >= -3").tokenize();

        // Then
        assertThat(tokens)
                .extracting(Token::type)
                .containsExactly(
                        TokenType.IDENTIFIER,
                        TokenType.DOT,
                        TokenType.IDENTIFIER,
                        TokenType.GTE,
                        TokenType.NUMBER,
                        TokenType.EOF);
        assertThat(tokens.get(4).text()).isEqualTo("-3");
    }

    @Test
    void shouldPreferSubtractAssignOverNegativeNumber() {
        List<Token> tokens = new ExpressionLexer("a.x -= -3").tokenize();

        assertThat(tokens)
                .extracting(Token::type)
                .containsExactly(
                        TokenType.IDENTIFIER,
                        TokenType.DOT,
                        TokenType.IDENTIFIER,
                        TokenType.SUBTRACT_ASSIGN,
                        TokenType.NUMBER,
                        TokenType.EOF);
    }

    @Test
    void shouldKeepDecimalPointInNumber() {
        List<Token> tokens = new ExpressionLexer("a.x = 2.5").tokenize();

        assertThat(tokens.get(4).type()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(4).text()).isEqualTo("2.5");
    }

    @Test
    void shouldUnescapeStringContent() {
        // When
        Token string = new ExpressionLexer("\"a \\\"b\\\" \\\\ c\"").tokenize().get(0);

        // Then
        assertThat(string.type()).isEqualTo(TokenType.STRING);
        assertThat(string.value()).isEqualTo("a \"b\" \\ c");
    }

    @Test
    void shouldReportUnterminatedStringAsInvalidToken() {
        Token token = new ExpressionLexer("\"open").tokenize().get(0);

        assertThat(token.type()).isEqualTo(TokenType.INVALID);
        assertThat(token.value()).isEqualTo("Unterminated string");
        assertThat(token.from()).isZero();
        assertThat(token.to()).isEqualTo(5);
    }

    @Test
    void shouldPlaceEndOfInputAtTextLength() {
        List<Token> tokens = new ExpressionLexer("a.b  ").tokenize();

        Token eof = tokens.get(tokens.size() - 1);
        assertThat(eof.type()).isEqualTo(TokenType.EOF);
        assertThat(eof.from()).isEqualTo(5);
        assertThat(eof.describe()).isEqualTo("end of input");
    }
}
