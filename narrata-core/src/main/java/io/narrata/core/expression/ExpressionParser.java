package io.narrata.core.expression;

import io.narrata.core.variable.ReferenceResolver;
import io.narrata.core.variable.ResolvedReference;
import io.narrata.core.variable.VariableStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Parses instruction and condition text into structured assignments and rules.
///
/// ### Grammar
/// ```
/// assignments := statement (";" statement)* ";"?
/// statement   := ref ("=" | "+=" | "-=" | "?=") value
/// condition   := term ("&&" term)* | term ("||" term)*
/// term        := "!" term | "(" term ")" | ref (cmp value)?
/// cmp         := "==" | "!=" | ">" | ">=" | "<" | "<="
/// value       := number | string | "true" | "false" | ref
/// ref         := ident ("." ident)+
/// ```
///
/// A bare reference is an `is_true` rule and its negation an `is_false` rule.
/// Negated comparisons are folded into the complementary operator, so
/// `!(a.b > 1)` becomes `a.b <= 1`. `= true` and `= false` fold into the
/// `set_true` and `set_false` operators.
///
/// The last segment of a reference is the variable and the rest the sheet,
/// unless a {@link VariableStore} of known variables is supplied, in which
/// case declared variables (including `table.row.column` cells) are matched
/// longest sheet first.
///
/// Every malformed statement yields a {@link ParseError} with its exact
/// character range. Parsing is pure and the parser is thread safe.
public class ExpressionParser {

    private static final Logger logger = Logger.getLogger(ExpressionParser.class.getName());

    /// Upper bound on `!` and `(` prefixes in front of a single condition.
    static final int MAX_NESTING = 256;

    private final ReferenceResolver resolver;

    public ExpressionParser() {
        this(new ReferenceResolver());
    }

    public ExpressionParser(ReferenceResolver resolver) {
        this.resolver = resolver;
    }

    public AssignmentParseResult parseAssignments(String text) {
        return parseAssignments(text, null, List.of());
    }

    public AssignmentParseResult parseAssignments(String text, VariableStore knownVariables) {
        return parseAssignments(text, knownVariables, List.of());
    }

    /// Parses `;`-separated assignment statements.
    ///
    /// @param text instruction text, null is treated as empty
    /// @param knownVariables declared variables for reference splitting, may be null
    /// @param previous result of the previous parse of the same editor, whose ids
    ///     are reused position by position, not null
    /// @return assignments and errors, never null
    public AssignmentParseResult parseAssignments(
            String text, VariableStore knownVariables, List<Assignment> previous) {
        String source = text != null ? text : "";
        Run run = new Run(source, knownVariables);
        List<Assignment> assignments = new ArrayList<>();

        while (!run.peek().is(TokenType.EOF)) {
            if (run.match(TokenType.SEMICOLON)) {
                continue;
            }
            try {
                String id =
                        assignments.size() < previous.size()
                                ? previous.get(assignments.size()).id()
                                : IdGenerator.next("assign");
                assignments.add(run.assignment(id));
                if (!run.peek().is(TokenType.EOF) && !run.peek().is(TokenType.SEMICOLON)) {
                    throw run.error(
                            run.peek(), "Expected ';' before " + run.peek().describe());
                }
            } catch (SyntaxException e) {
                run.errors.add(e.error);
                run.skipStatement();
            }
        }

        logger.fine(
                () -> "Parsed " + assignments.size() + " assignment(s) with "
                        + run.errors.size() + " error(s)");
        return new AssignmentParseResult(assignments, run.errors);
    }

    public ConditionParseResult parseCondition(String text) {
        return parseCondition(text, null, null);
    }

    public ConditionParseResult parseCondition(String text, VariableStore knownVariables) {
        return parseCondition(text, knownVariables, null);
    }

    /// Parses a condition made of `&&`-joined or `||`-joined terms.
    ///
    /// @param text condition text, null is treated as empty
    /// @param knownVariables declared variables for reference splitting, may be null
    /// @param previous previously parsed condition whose rule ids are reused, may be null
    /// @return condition and errors, never null
    public ConditionParseResult parseCondition(
            String text, VariableStore knownVariables, Condition previous) {
        String source = text != null ? text : "";
        Run run = new Run(source, knownVariables);
        List<Rule> previousRules = previous != null ? previous.rules() : List.of();
        List<Rule> rules = new ArrayList<>();
        ConditionLogic logic = null;

        if (run.peek().is(TokenType.EOF)) {
            return new ConditionParseResult(Condition.empty(), List.of());
        }

        try {
            rules.add(run.term(false, ruleId(rules, previousRules)));
            while (run.peek().is(TokenType.AND) || run.peek().is(TokenType.OR)) {
                Token operator = run.advance();
                ConditionLogic found =
                        operator.is(TokenType.AND) ? ConditionLogic.ALL : ConditionLogic.ANY;
                if (logic == null) {
                    logic = found;
                } else if (logic != found) {
                    throw run.error(operator, "Cannot mix && and || in one expression");
                }
                rules.add(run.term(false, ruleId(rules, previousRules)));
            }
            if (!run.peek().is(TokenType.EOF)) {
                throw run.error(run.peek(), "Unexpected " + run.peek().describe());
            }
        } catch (SyntaxException e) {
            run.errors.add(e.error);
        }

        Condition condition = new Condition(logic != null ? logic : ConditionLogic.ALL, rules);
        return new ConditionParseResult(condition, run.errors);
    }

    private static String ruleId(List<Rule> parsed, List<Rule> previous) {
        return parsed.size() < previous.size()
                ? previous.get(parsed.size()).id()
                : IdGenerator.next("rule");
    }

    /// Parsed reference with its source positions.
    private record Reference(List<String> segments, int from, int to) {
        SourceSpan span() {
            return new SourceSpan(from, to);
        }
    }

    /// Parsed right-hand value.
    private record Value(String text, ValueType type, String sheet, SourceSpan span,
            Boolean bool, boolean string) {}

    private static final class SyntaxException extends Exception {
        private final ParseError error;

        private SyntaxException(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }

    /// State of one parse call.
    private final class Run {
        private final List<Token> tokens;
        private final VariableStore knownVariables;
        private final List<ParseError> errors = new ArrayList<>();
        private int index;

        private Run(String text, VariableStore knownVariables) {
            this.tokens = new ExpressionLexer(text).tokenize();
            this.knownVariables = knownVariables;
        }

        private Assignment assignment(String id) throws SyntaxException {
            Reference target = reference();
            String[] split = split(target);
            Token operatorToken = advance();
            if (!operatorToken.type().isAssignmentOperator()) {
                throw error(
                        operatorToken,
                        "Expected an assignment operator (=, +=, -=, ?=) but found "
                                + operatorToken.describe());
            }
            AssignmentOperator operator = AssignmentOperator.fromSymbol(operatorToken.text());
            Value value = value(operatorToken);

            if ((operator == AssignmentOperator.ADD || operator == AssignmentOperator.SUBTRACT)
                    && (value.bool() != null || value.string())) {
                throw new SyntaxException(
                        new ParseError(
                                value.span().from(),
                                value.span().to(),
                                "'" + operator.symbol()
                                        + "' expects a number or variable reference"));
            }
            if (operator == AssignmentOperator.SET && value.bool() != null) {
                operator =
                        value.bool() ? AssignmentOperator.SET_TRUE : AssignmentOperator.SET_FALSE;
                return new Assignment(
                        id, split[0], split[1], operator, null, ValueType.LITERAL, null,
                        target.span(), null);
            }
            boolean isReference = value.type() == ValueType.VARIABLE_REF;
            return new Assignment(
                    id,
                    split[0],
                    split[1],
                    operator,
                    value.text(),
                    value.type(),
                    value.sheet(),
                    target.span(),
                    isReference ? value.span() : null);
        }

        private Rule term(boolean negated, String id) throws SyntaxException {
            int prefixes = 0;
            int openParens = 0;
            while (peek().is(TokenType.NOT) || peek().is(TokenType.LEFT_PAREN)) {
                if (++prefixes > MAX_NESTING) {
                    throw error(peek(), "Expression nested too deeply");
                }
                if (advance().is(TokenType.NOT)) {
                    negated = !negated;
                } else {
                    openParens++;
                }
            }
            Rule rule = atom(negated, id);
            for (int i = 0; i < openParens; i++) {
                if (peek().is(TokenType.AND) || peek().is(TokenType.OR)) {
                    throw error(peek(), "Nested && or || inside parentheses is not supported");
                }
                expect(TokenType.RIGHT_PAREN, "Expected ')'");
            }
            return rule;
        }

        private Rule atom(boolean negated, String id) throws SyntaxException {
            Token token = peek();
            if (!token.is(TokenType.IDENTIFIER)) {
                throw error(token, "Expected a condition but found " + token.describe());
            }

            Reference target = reference();
            String[] split = split(target);
            if (!peek().type().isComparison()) {
                RuleOperator operator = negated ? RuleOperator.IS_FALSE : RuleOperator.IS_TRUE;
                return new Rule(
                        id, split[0], split[1], operator, null, ValueType.LITERAL, null,
                        target.span(), null, null);
            }

            Token comparison = advance();
            RuleOperator operator = RuleOperator.fromSymbol(comparison.text());
            if (negated) {
                operator = operator.negate();
            }
            Value value = value(comparison);
            boolean isReference = value.type() == ValueType.VARIABLE_REF;
            String text = value.bool() != null ? value.bool().toString() : value.text();
            return new Rule(
                    id,
                    split[0],
                    split[1],
                    operator,
                    text,
                    value.type(),
                    value.sheet(),
                    target.span(),
                    isReference ? value.span() : null,
                    null);
        }

        private Value value(Token operator) throws SyntaxException {
            Token token = peek();
            switch (token.type()) {
                case NUMBER -> {
                    advance();
                    return new Value(
                            token.text(), ValueType.LITERAL, null, span(token), null, false);
                }
                case STRING -> {
                    advance();
                    return new Value(
                            token.value(), ValueType.LITERAL, null, span(token), null, true);
                }
                case INVALID -> throw error(token, token.value());
                case IDENTIFIER -> {
                    if (!peekAt(1).is(TokenType.DOT)
                            && (token.text().equals("true") || token.text().equals("false"))) {
                        advance();
                        return new Value(
                                token.text(),
                                ValueType.LITERAL,
                                null,
                                span(token),
                                Boolean.valueOf(token.text()),
                                false);
                    }
                    Reference reference = reference();
                    String[] split = split(reference);
                    return new Value(
                            split[1], ValueType.VARIABLE_REF, split[0], reference.span(), null,
                            false);
                }
                default ->
                        throw error(
                                token,
                                "Expected a value after '" + operator.text() + "' but found "
                                        + token.describe());
            }
        }

        private Reference reference() throws SyntaxException {
            Token first = peek();
            if (first.is(TokenType.INVALID)) {
                throw error(first, first.value());
            }
            if (!first.is(TokenType.IDENTIFIER)) {
                throw error(first, "Expected a variable reference but found " + first.describe());
            }
            advance();
            List<String> segments = new ArrayList<>();
            segments.add(first.text());
            int to = first.to();
            while (match(TokenType.DOT)) {
                Token segment = peek();
                if (!segment.is(TokenType.IDENTIFIER)) {
                    throw error(segment, "Expected a name after '.'");
                }
                advance();
                segments.add(segment.text());
                to = segment.to();
            }
            if (segments.size() < 2) {
                throw new SyntaxException(
                        new ParseError(
                                first.from(), to, "Expected sheet.variable reference"));
            }
            return new Reference(List.copyOf(segments), first.from(), to);
        }

        private String[] split(Reference reference) {
            if (knownVariables != null) {
                Optional<ResolvedReference> known =
                        resolver.resolve(String.join(".", reference.segments()), knownVariables);
                if (known.isPresent()) {
                    return new String[] {known.get().sheet(), known.get().variableName()};
                }
            }
            return ReferenceResolver.splitLast(reference.segments());
        }

        private void skipStatement() {
            while (!peek().is(TokenType.EOF) && !peek().is(TokenType.SEMICOLON)) {
                advance();
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token peekAt(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        private boolean match(TokenType type) {
            if (peek().is(type)) {
                advance();
                return true;
            }
            return false;
        }

        private void expect(TokenType type, String message) throws SyntaxException {
            if (!match(type)) {
                throw error(peek(), message);
            }
        }

        private SyntaxException error(Token token, String message) {
            return new SyntaxException(new ParseError(token.from(), token.to(), message));
        }

        private SourceSpan span(Token token) {
            return new SourceSpan(token.from(), token.to());
        }
    }
}
