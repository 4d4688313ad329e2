package io.narrata.core.expression;

import static io.narrata.core.TestFixtures.cell;
import static io.narrata.core.TestFixtures.number;
import static org.assertj.core.api.Assertions.assertThat;

import io.narrata.core.variable.VariableStore;
import io.narrata.core.variable.VariableType;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Nested
    class Assignments {

        @Test
        void shouldParseSubtractionWithMultiSegmentSheet() {
            // When
            AssignmentParseResult result = parser.parseAssignments("mc.jaime.health -= 10");

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.assignments()).singleElement().satisfies(assignment -> {
                assertThat(assignment.sheet()).isEqualTo("mc.jaime");
                assertThat(assignment.variable()).isEqualTo("health");
                assertThat(assignment.operator()).isEqualTo(AssignmentOperator.SUBTRACT);
                assertThat(assignment.value()).isEqualTo("10");
                assertThat(assignment.valueType()).isEqualTo(ValueType.LITERAL);
                assertThat(assignment.refSpan()).isEqualTo(new SourceSpan(0, 15));
            });
        }

        @Test
        void shouldParseOneAssignmentPerStatementWithUniqueIds() {
            // When
            AssignmentParseResult result =
                    parser.parseAssignments("a.x = 1; a.y += 2; a.z ?= \"hi\";");

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.assignments())
                    .extracting(Assignment::operator)
                    .containsExactly(
                            AssignmentOperator.SET,
                            AssignmentOperator.ADD,
                            AssignmentOperator.SET_IF_UNSET);
            assertThat(result.assignments()).extracting(Assignment::value)
                    .containsExactly("1", "2", "hi");
            assertThat(result.assignments()).extracting(Assignment::id).doesNotHaveDuplicates();
        }

        @Test
        void shouldFoldBooleanLiteralsIntoDedicatedOperators() {
            // When
            AssignmentParseResult result = parser.parseAssignments("a.on = true; a.off = false");

            // Then
            assertThat(result.assignments())
                    .extracting(Assignment::operator)
                    .containsExactly(AssignmentOperator.SET_TRUE, AssignmentOperator.SET_FALSE);
            assertThat(result.assignments()).extracting(Assignment::value)
                    .containsOnlyNulls();
        }

        @Test
        void shouldParseVariableReferenceOperand() {
            // When
            AssignmentParseResult result = parser.parseAssignments("a.x = b.y");

            // Then
            Assignment assignment = result.assignments().get(0);
            assertThat(assignment.valueType()).isEqualTo(ValueType.VARIABLE_REF);
            assertThat(assignment.valueSheet()).isEqualTo("b");
            assertThat(assignment.value()).isEqualTo("y");
            assertThat(assignment.valueSpan()).isEqualTo(new SourceSpan(6, 9));
            assertThat(assignment.valueReference()).isEqualTo("b.y");
        }

        @Test
        void shouldParseNegativeNumber() {
            AssignmentParseResult result = parser.parseAssignments("a.x -= -5");

            assertThat(result.assignments().get(0).value()).isEqualTo("-5");
        }

        @Test
        void shouldReportMissingValueAtEndOfInput() {
            // When
            AssignmentParseResult result = parser.parseAssignments("a.x =");

            // Then
            assertThat(result.isValid()).isFalse();
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.message())
                        .isEqualTo("Expected a value after '=' but found end of input");
                assertThat(error.from()).isEqualTo(5);
                assertThat(error.to()).isEqualTo(5);
            });
        }

        @Test
        void shouldRejectSingleSegmentReference() {
            AssignmentParseResult result = parser.parseAssignments("health = 1");

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.message()).isEqualTo("Expected sheet.variable reference");
                assertThat(error.from()).isZero();
                assertThat(error.to()).isEqualTo(6);
            });
        }

        @Test
        void shouldRejectTextOperandForArithmetic() {
            AssignmentParseResult result = parser.parseAssignments("a.x += \"ten\"");

            assertThat(result.errors()).singleElement()
                    .extracting(ParseError::message)
                    .isEqualTo("'+=' expects a number or variable reference");
        }

        @Test
        void shouldRecoverAtNextSemicolon() {
            // When
            AssignmentParseResult result = parser.parseAssignments("a.x = ; a.y = 2");

            // Then
            assertThat(result.errors()).hasSize(1);
            assertThat(result.assignments()).singleElement()
                    .extracting(Assignment::variable)
                    .isEqualTo("y");
        }

        @Test
        void shouldRequireSemicolonBetweenStatements() {
            AssignmentParseResult result = parser.parseAssignments("a.x = 1 a.y = 2");

            assertThat(result.errors()).singleElement()
                    .extracting(ParseError::message)
                    .isEqualTo("Expected ';' before 'a'");
        }

        @Test
        void shouldReportUnexpectedCharacter() {
            AssignmentParseResult result = parser.parseAssignments("a.x = @");

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.message()).isEqualTo("Unexpected character '@'");
                assertThat(error.from()).isEqualTo(6);
                assertThat(error.to()).isEqualTo(7);
            });
        }

        @Test
        void shouldReuseIdsOfPreviousParseByPosition() {
            // Given
            AssignmentParseResult first = parser.parseAssignments("a.x = 1; a.y = 2");

            // When
            AssignmentParseResult second =
                    parser.parseAssignments("a.x = 3; a.y = 4; a.z = 5", null, first.assignments());

            // Then
            assertThat(second.assignments().get(0).id()).isEqualTo(first.assignments().get(0).id());
            assertThat(second.assignments().get(1).id()).isEqualTo(first.assignments().get(1).id());
            assertThat(second.assignments().get(2).id())
                    .isNotIn(first.assignments().get(0).id(), first.assignments().get(1).id());
        }

        @Test
        void shouldSplitTableCellUsingKnownVariables() {
            // Given
            VariableStore known =
                    VariableStore.of(cell("inv", "items", "sword", "count", VariableType.NUMBER, 1L));

            // When
            Assignment withStore =
                    parser.parseAssignments("inv.items.sword.count = 3", known).assignments().get(0);
            Assignment withoutStore =
                    parser.parseAssignments("inv.items.sword.count = 3").assignments().get(0);

            // Then
            assertThat(withStore.sheet()).isEqualTo("inv");
            assertThat(withStore.variable()).isEqualTo("items.sword.count");
            assertThat(withoutStore.sheet()).isEqualTo("inv.items.sword");
            assertThat(withoutStore.variable()).isEqualTo("count");
        }

        @Test
        void shouldReturnNothingForBlankInput() {
            AssignmentParseResult result = parser.parseAssignments("  ;  ");

            assertThat(result.isValid()).isTrue();
            assertThat(result.assignments()).isEmpty();
        }
    }

    @Nested
    class Conditions {

        @Test
        void shouldParseConjunctionWithBareReference() {
            // When
            ConditionParseResult result =
                    parser.parseCondition("mc.jaime.health > 0 && party.present");

            // Then
            assertThat(result.isValid()).isTrue();
            Condition condition = result.condition();
            assertThat(condition.logic()).isEqualTo(ConditionLogic.ALL);
            assertThat(condition.rules()).hasSize(2);
            Rule health = condition.rules().get(0);
            assertThat(health.sheet()).isEqualTo("mc.jaime");
            assertThat(health.variable()).isEqualTo("health");
            assertThat(health.operator()).isEqualTo(RuleOperator.GREATER_THAN);
            assertThat(health.value()).isEqualTo("0");
            Rule present = condition.rules().get(1);
            assertThat(present.reference()).isEqualTo("party.present");
            assertThat(present.operator()).isEqualTo(RuleOperator.IS_TRUE);
            assertThat(present.value()).isNull();
        }

        @Test
        void shouldParseDisjunction() {
            ConditionParseResult result = parser.parseCondition("a.x == 1 || a.y == 2");

            assertThat(result.condition().logic()).isEqualTo(ConditionLogic.ANY);
            assertThat(result.condition().rules()).hasSize(2);
        }

        @Test
        void shouldRejectMixedLogicAtFirstConflictingOperator() {
            // When
            ConditionParseResult result =
                    parser.parseCondition("a.x == 1 && a.y == 2 || a.z == 3");

            // Then
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.message()).isEqualTo("Cannot mix && and || in one expression");
                assertThat(error.from()).isEqualTo(21);
                assertThat(error.to()).isEqualTo(23);
            });
        }

        @Test
        void shouldParseNegatedReferenceAsIsFalse() {
            assertThat(parser.parseCondition("!party.present").condition().rules().get(0).operator())
                    .isEqualTo(RuleOperator.IS_FALSE);
            assertThat(parser.parseCondition("!!party.present").condition().rules().get(0).operator())
                    .isEqualTo(RuleOperator.IS_TRUE);
        }

        @ParameterizedTest
        @MethodSource("io.narrata.core.expression.ExpressionParserTest#negations")
        void shouldFoldNegatedComparison(String text, RuleOperator expected) {
            ConditionParseResult result = parser.parseCondition(text);

            assertThat(result.isValid()).isTrue();
            assertThat(result.condition().rules().get(0).operator()).isEqualTo(expected);
        }

        @Test
        void shouldKeepBooleanLiteralAsText() {
            Rule rule = parser.parseCondition("a.flag == true").condition().rules().get(0);

            assertThat(rule.operator()).isEqualTo(RuleOperator.EQUALS);
            assertThat(rule.value()).isEqualTo("true");
            assertThat(rule.valueType()).isEqualTo(ValueType.LITERAL);
        }

        @Test
        void shouldUnescapeStringLiteral() {
            Rule rule =
                    parser.parseCondition("a.line == \"say \\\"hi\\\"\"").condition().rules().get(0);

            assertThat(rule.value()).isEqualTo("say \"hi\"");
        }

        @Test
        void shouldReportUnterminatedString() {
            ConditionParseResult result = parser.parseCondition("a.name == \"abc");

            assertThat(result.errors()).singleElement()
                    .extracting(ParseError::message)
                    .isEqualTo("Unterminated string");
        }

        @Test
        void shouldRejectNestedLogicInParentheses() {
            ConditionParseResult result = parser.parseCondition("(a.x == 1 && a.y == 2)");

            assertThat(result.errors()).singleElement()
                    .extracting(ParseError::message)
                    .isEqualTo("Nested && or || inside parentheses is not supported");
        }

        @Test
        void shouldKeepNegatedParenthesizedComparison() {
            ConditionParseResult result = parser.parseCondition("!(a.x > 1) && ((!a.flag))");

            assertThat(result.isValid()).isTrue();
            assertThat(result.condition().rules())
                    .extracting(Rule::operator)
                    .containsExactly(RuleOperator.LESS_THAN_OR_EQUAL, RuleOperator.IS_FALSE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"!", "("})
        void shouldReportDeepNestingAsParseError(String prefix) {
            // Given
            String text = prefix.repeat(200_000) + "a.b";

            // When
            ConditionParseResult result = parser.parseCondition(text);

            // Then
            assertThat(result.errors()).singleElement()
                    .satisfies(error -> {
                        assertThat(error.message()).isEqualTo("Expression nested too deeply");
                        assertThat(error.from()).isEqualTo(ExpressionParser.MAX_NESTING);
                    });
        }

        @Test
        void shouldAcceptNestingAtLimit() {
            String text = "(".repeat(ExpressionParser.MAX_NESTING) + "a.b"
                    + ")".repeat(ExpressionParser.MAX_NESTING);

            assertThat(parser.parseCondition(text).isValid()).isTrue();
        }

        @Test
        void shouldReportTrailingToken() {
            ConditionParseResult result = parser.parseCondition("a.x == 1)");

            assertThat(result.errors()).singleElement()
                    .extracting(ParseError::message)
                    .isEqualTo("Unexpected ')'");
        }

        @Test
        void shouldReturnEmptyConditionForBlankText() {
            ConditionParseResult result = parser.parseCondition("   ");

            assertThat(result.isValid()).isTrue();
            assertThat(result.condition().isEmpty()).isTrue();
        }

        @Test
        void shouldReuseRuleIdsFromPreviousCondition() {
            // Given
            Condition previous = parser.parseCondition("a.x == 1").condition();

            // When
            Condition next = parser.parseCondition("a.x == 2 && a.y", null, previous).condition();

            // Then
            assertThat(next.rules().get(0).id()).isEqualTo(previous.rules().get(0).id());
            assertThat(next.rules().get(1).id()).isNotEqualTo(previous.rules().get(0).id());
        }

        @Test
        void shouldResolveLongestKnownSheet() {
            // Given
            VariableStore known = VariableStore.of(number("mc.jaime", "health", 10));

            // When
            Rule rule = parser.parseCondition("mc.jaime.health > 1", known).condition().rules().get(0);

            // Then
            assertThat(rule.sheet()).isEqualTo("mc.jaime");
            assertThat(rule.variable()).isEqualTo("health");
        }
    }

    static Stream<Arguments> negations() {
        return Stream.of(
                Arguments.of("!(a.x > 1)", RuleOperator.LESS_THAN_OR_EQUAL),
                Arguments.of("!(a.x >= 1)", RuleOperator.LESS_THAN),
                Arguments.of("!(a.x < 1)", RuleOperator.GREATER_THAN_OR_EQUAL),
                Arguments.of("!(a.x <= 1)", RuleOperator.GREATER_THAN),
                Arguments.of("!(a.x == 1)", RuleOperator.NOT_EQUALS),
                Arguments.of("!(a.x != 1)", RuleOperator.EQUALS));
    }
}
