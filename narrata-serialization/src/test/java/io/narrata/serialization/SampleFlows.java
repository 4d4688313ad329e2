package io.narrata.serialization;

import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentOperator;
import io.narrata.core.expression.Condition;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.RuleOperator;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.ConditionNode;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.EntryNode;
import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.flow.node.HubNode;
import io.narrata.core.flow.node.InstructionNode;
import io.narrata.core.flow.node.JumpNode;
import io.narrata.core.flow.node.Response;
import io.narrata.core.flow.node.SceneNode;
import io.narrata.core.flow.node.SubflowNode;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableStore;
import io.narrata.core.variable.VariableType;
import java.time.LocalDate;
import java.util.List;

/// Flows and variables covering every node type and variable type.
final class SampleFlows {

    static final Rule LOW_HEALTH =
            Rule.of("mc.jaime", "health", RuleOperator.LESS_THAN, "50").withId("low");
    static final Rule HAS_SWORD =
            Rule.of("inv", "sword", RuleOperator.IS_TRUE, null).withId("sword").withLabel("Armed");
    static final Assignment HEAL =
            Assignment.of("mc.jaime", "health", AssignmentOperator.ADD, "10");

    private SampleFlows() {}

    static FlowGraph tavern() {
        return FlowGraph.builder()
                .id("tavern")
                .name("The Tavern")
                .node(EntryNode.of("start"))
                .node(SceneNode.builder().id("scene").text("INT. TAVERN - NIGHT").build())
                .node(ConditionNode.builder()
                        .id("check")
                        .condition(Condition.any(LOW_HEALTH, HAS_SWORD))
                        .build())
                .node(ConditionNode.builder()
                        .id("switch")
                        .condition(Condition.all(LOW_HEALTH, HAS_SWORD))
                        .switchMode(true)
                        .build())
                .node(InstructionNode.builder().id("heal").assignments(HEAL).build())
                .node(DialogueNode.builder()
                        .id("talk")
                        .speaker("Barkeep")
                        .text("<p>What'll it be?</p>")
                        .inputCondition(Condition.all(HAS_SWORD))
                        .outputInstruction(List.of(HEAL))
                        .responses(
                                Response.of("r1", "Ale"),
                                new Response("r2", "Fight", Condition.all(HAS_SWORD), List.of(HEAL)))
                        .build())
                .node(HubNode.of("hub"))
                .node(SubflowNode.builder().id("call").targetFlowId("cellar").build())
                .node(JumpNode.builder()
                        .id("jump")
                        .targetFlowId("cellar")
                        .targetNodeId("stairs")
                        .build())
                .node(ExitNode.of("end"))
                .connect("start", "default", "scene")
                .connect("scene", "default", "check")
                .connect("check", "true", "talk")
                .connect("check", "false", "switch")
                .connect("switch", "sword", "heal")
                .connect("switch", "default", "hub")
                .connect("talk", "r1", "call")
                .connect("talk", "r2", "jump")
                .connect("heal", "default", "hub")
                .connect("hub", "out1", "end")
                .connect("call", "default", "end")
                .build();
    }

    static VariableStore variables() {
        return VariableStore.of(
                variable("mc.jaime", "health", VariableType.NUMBER, 40L),
                variable("mc.jaime", "name", VariableType.TEXT, "Jaime"),
                variable("inv", "sword", VariableType.BOOLEAN, true),
                variable("world", "day", VariableType.DATE, LocalDate.of(1212, 3, 4)),
                variable("world", "tags", VariableType.MULTI_SELECT, List.of("rain", "fog")),
                Variable.builder()
                        .sheetShortcut("mc.jaime")
                        .tableCell("attributes", "strength", "value")
                        .type(VariableType.NUMBER)
                        .value(7.5)
                        .build());
    }

    static Variable variable(String sheet, String name, VariableType type, Object value) {
        return Variable.builder()
                .sheetShortcut(sheet)
                .variableName(name)
                .type(type)
                .value(value)
                .build();
    }
}
