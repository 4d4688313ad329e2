package io.narrata.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentOperator;
import io.narrata.core.expression.ConditionLogic;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.RuleOperator;
import io.narrata.core.expression.ValueType;
import io.narrata.core.flow.Connection;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.ConditionNode;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.InstructionNode;
import io.narrata.core.flow.node.JumpNode;
import io.narrata.core.flow.node.Node;
import io.narrata.core.flow.node.NodeType;
import io.narrata.core.flow.node.SubflowNode;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import io.narrata.core.variable.VariableStore;
import io.narrata.core.variable.VariableType;
import java.time.LocalDate;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FlowSerializerTest {

    @Nested
    class RoundTrip {

        @Test
        void shouldKeepNodesInOrderWithTheirTypes() {
            // Given
            FlowGraph original = SampleFlows.tavern();

            // When
            FlowGraph restored = FlowSerializer.fromJson(FlowSerializer.toJson(original));

            // Then
            assertThat(restored.getId()).isEqualTo("tavern");
            assertThat(restored.getName()).isEqualTo("The Tavern");
            assertThat(restored.getNodes().keySet())
                    .containsExactlyElementsOf(original.getNodes().keySet());
            assertThat(restored.getNodes().values())
                    .extracting(Node::getNodeType)
                    .containsExactlyElementsOf(
                            original.getNodes().values().stream()
                                    .map(Node::getNodeType)
                                    .toList());
            assertThat(restored.getConnections())
                    .containsExactlyElementsOf(original.getConnections());
        }

        @Test
        void shouldKeepConditionsWithRuleIdsAndLabels() {
            // Given
            FlowGraph original = SampleFlows.tavern();

            // When
            FlowGraph restored = FlowSerializer.fromJson(FlowSerializer.toJson(original));

            // Then
            ConditionNode check = (ConditionNode) restored.getNode("check").orElseThrow();
            assertThat(check.isSwitchMode()).isFalse();
            assertThat(check.getCondition().logic()).isEqualTo(ConditionLogic.ANY);
            assertThat(check.getCondition().rules())
                    .containsExactly(SampleFlows.LOW_HEALTH, SampleFlows.HAS_SWORD);

            ConditionNode switchNode = (ConditionNode) restored.getNode("switch").orElseThrow();
            assertThat(switchNode.isSwitchMode()).isTrue();
            assertThat(switchNode.getCondition().rule("sword").label()).isEqualTo("Armed");
        }

        @Test
        void shouldKeepDialoguePayload() {
            // Given
            FlowGraph original = SampleFlows.tavern();

            // When
            FlowGraph restored = FlowSerializer.fromJson(FlowSerializer.toJson(original));

            // Then
            DialogueNode talk = (DialogueNode) restored.getNode("talk").orElseThrow();
            assertThat(talk.getSpeaker()).isEqualTo("Barkeep");
            assertThat(talk.getText()).isEqualTo("<p>What'll it be?</p>");
            assertThat(talk.getInputCondition().rules()).containsExactly(SampleFlows.HAS_SWORD);
            assertThat(talk.getOutputInstruction()).containsExactly(SampleFlows.HEAL);
            assertThat(talk.getResponses()).hasSize(2);
            assertThat(talk.getResponses().get(0).condition().isEmpty()).isTrue();
            assertThat(talk.getResponses().get(1).instruction()).containsExactly(SampleFlows.HEAL);
        }

        @Test
        void shouldKeepFlowCallTargets() {
            // Given
            FlowGraph original = SampleFlows.tavern();

            // When
            FlowGraph restored = FlowSerializer.fromJson(FlowSerializer.toJson(original));

            // Then
            SubflowNode call = (SubflowNode) restored.getNode("call").orElseThrow();
            assertThat(call.getTargetFlowId()).isEqualTo("cellar");
            assertThat(call.getTargetNodeId()).isNull();

            JumpNode jump = (JumpNode) restored.getNode("jump").orElseThrow();
            assertThat(jump.getTargetNodeId()).isEqualTo("stairs");
        }
    }

    @Nested
    class Writing {

        @Test
        void shouldWriteLowercaseIdentifiers() {
            // When
            String json = FlowSerializer.toJson(SampleFlows.tavern());

            // Then
            assertThat(json)
                    .contains("\"type\" : \"condition\"")
                    .contains("\"logic\" : \"any\"")
                    .contains("\"operator\" : \"less_than\"")
                    .contains("\"operator\" : \"add\"")
                    .doesNotContain("LESS_THAN");
        }

        @Test
        void shouldOmitLiteralValueTypeAndEmptyConditions() {
            // When
            String json = FlowSerializer.toJson(SampleFlows.tavern());

            // Then
            assertThat(json).doesNotContain("valueType").doesNotContain("refSpan");
        }
    }

    @Nested
    class ExpressionText {

        @Test
        void shouldParseConditionAndInstructionText() {
            // Given
            String json = """
                    {
                      "id": "f",
                      "nodes": [
                        {"id": "c", "type": "condition", "condition": "mc.jaime.health < 50 && inv.sword"},
                        {"id": "i", "type": "instruction", "assignments": "mc.jaime.health += 5; inv.sword = false"}
                      ],
                      "connections": [
                        {"sourceNodeId": "c", "sourcePin": "true", "targetNodeId": "i"}
                      ]
                    }
                    """;

            // When
            FlowGraph flow = FlowSerializer.fromJson(json);

            // Then
            ConditionNode condition = (ConditionNode) flow.getNode("c").orElseThrow();
            assertThat(condition.getCondition().logic()).isEqualTo(ConditionLogic.ALL);
            assertThat(condition.getCondition().rules())
                    .extracting(Rule::reference, Rule::operator)
                    .containsExactly(
                            tuple("mc.jaime.health", RuleOperator.LESS_THAN),
                            tuple("inv.sword", RuleOperator.IS_TRUE));

            InstructionNode instruction = (InstructionNode) flow.getNode("i").orElseThrow();
            assertThat(instruction.getAssignments())
                    .extracting(Assignment::operator)
                    .containsExactly(AssignmentOperator.ADD, AssignmentOperator.SET_FALSE);

            assertThat(flow.getConnections())
                    .containsExactly(new Connection("c", "true", "i", "input"));
        }

        @Test
        void shouldGenerateIdsForStructuredRulesWithoutOne() {
            // Given
            String json = """
                    {"id": "f", "nodes": [{"id": "c", "type": "condition",
                      "condition": {"rules": [{"sheet": "a", "variable": "b", "operator": "greater_than",
                                               "value": 3, "valueType": "variable_ref", "valueSheet": "c"}]}}]}
                    """;

            // When
            FlowGraph flow = FlowSerializer.fromJson(json);

            // Then
            ConditionNode condition = (ConditionNode) flow.getNode("c").orElseThrow();
            assertThat(condition.getCondition().logic()).isEqualTo(ConditionLogic.ALL);
            assertThat(condition.getCondition().rules()).singleElement().satisfies(rule -> {
                assertThat(rule.id()).startsWith("rule_");
                assertThat(rule.value()).isEqualTo("3");
                assertThat(rule.valueType()).isEqualTo(ValueType.VARIABLE_REF);
                assertThat(rule.valueReference()).isEqualTo("c.3");
            });
        }

        @Test
        void shouldRejectConditionTextThatDoesNotParse() {
            // Given
            String json = """
                    {"id": "f", "nodes": [{"id": "c", "type": "condition", "condition": "a.b > && c.d"}]}
                    """;

            // When / Then
            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Failed to deserialize flow")
                    .hasMessageContaining("Invalid condition in 'condition'");
        }

        @Test
        void shouldRejectUnknownNodeType() {
            // Given
            String json = """
                    {"id": "f", "nodes": [{"id": "x", "type": "teleport"}]}
                    """;

            // When / Then
            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown node type: teleport");
        }

        @Test
        void shouldRejectDuplicateNodeIds() {
            // Given
            String json = """
                    {"id": "f", "nodes": [{"id": "x", "type": "hub"}, {"id": "x", "type": "scene"}]}
                    """;

            // When / Then
            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate node id: x");
        }

        @Test
        void shouldIgnoreUnknownFields() {
            // Given
            String json = """
                    {"id": "f", "color": "red", "nodes": [{"id": "e", "type": "entry", "x": 10}]}
                    """;

            // When
            FlowGraph flow = FlowSerializer.fromJson(json);

            // Then
            assertThat(flow.getName()).isEqualTo("f");
            assertThat(flow.getEntryNode()).get()
                    .extracting(Node::getNodeType)
                    .isEqualTo(NodeType.ENTRY);
        }
    }

    @Nested
    class Variables {

        @Test
        void shouldRoundTripEveryVariableType() {
            // Given
            VariableStore original = SampleFlows.variables();

            // When
            VariableStore restored =
                    FlowSerializer.variablesFromJson(FlowSerializer.variablesToJson(original));

            // Then
            assertThat(restored).isEqualTo(original);
            assertThat(restored.get("world.day")).get()
                    .extracting(Variable::getValue)
                    .isEqualTo(LocalDate.of(1212, 3, 4));
            assertThat(restored.get("mc.jaime.attributes.strength.value")).get()
                    .satisfies(cell -> {
                        assertThat(cell.isTableCell()).isTrue();
                        assertThat(cell.getRowName()).isEqualTo("strength");
                        assertThat(cell.getValue()).isEqualTo(7.5);
                    });
        }

        @Test
        void shouldWriteDatesAsIsoText() {
            // When
            String json = FlowSerializer.variablesToJson(SampleFlows.variables());

            // Then
            assertThat(json).contains("\"1212-03-04\"").contains("\"table\" : \"attributes\"");
        }

        @Test
        void shouldKeepSessionStateOfModifiedVariables() {
            // Given
            Variable changed = SampleFlows.variable("mc.jaime", "health", VariableType.NUMBER, 40L)
                    .withValue(25L, VariableSource.USER_OVERRIDE);

            // When
            VariableStore restored = FlowSerializer.variablesFromJson(
                    FlowSerializer.variablesToJson(VariableStore.of(changed)));

            // Then
            Variable health = restored.get("mc.jaime.health").orElseThrow();
            assertThat(health.getValue()).isEqualTo(25L);
            assertThat(health.getInitialValue()).isEqualTo(40L);
            assertThat(health.getPreviousValue()).isEqualTo(40L);
            assertThat(health.getSource()).isEqualTo(VariableSource.USER_OVERRIDE);
        }

        @Test
        void shouldCoerceValuesToTheDeclaredType() {
            // Given
            String json = """
                    [{"sheet": "mc", "name": "gold", "type": "number", "value": "12"},
                     {"sheet": "mc", "name": "brave", "type": "boolean", "value": "true"}]
                    """;

            // When
            VariableStore store = FlowSerializer.variablesFromJson(json);

            // Then
            assertThat(store.get("mc.gold")).get().extracting(Variable::getValue).isEqualTo(12L);
            assertThat(store.get("mc.brave")).get().extracting(Variable::getValue)
                    .isEqualTo(true);
        }

        @Test
        void shouldRejectValueThatDoesNotFitItsType() {
            // Given
            String json = """
                    [{"sheet": "mc", "name": "gold", "type": "number", "value": "lots"}]
                    """;

            // When / Then
            assertThatThrownBy(() -> FlowSerializer.variablesFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("is not a valid number");
        }

        @Test
        void shouldReadEmptyArray() {
            assertThat(FlowSerializer.variablesFromJson("[]").isEmpty()).isTrue();
        }
    }
}
