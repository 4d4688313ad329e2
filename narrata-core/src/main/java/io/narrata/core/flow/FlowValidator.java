package io.narrata.core.flow;

import io.narrata.core.expression.Rule;
import io.narrata.core.flow.FlowIssue.Severity;
import io.narrata.core.flow.node.ConditionNode;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.EntryNode;
import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.flow.node.FlowCallNode;
import io.narrata.core.flow.node.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Reports structural problems in a flow graph without rejecting it.
///
/// Checks entry nodes, dangling connections, nodes without outputs, switch
/// pins that name no rule and call targets that do not exist.
public class FlowValidator {

    private final FlowRepository flowRepository;

    /// @param flowRepository used to check call targets, may be null to skip that check
    public FlowValidator(FlowRepository flowRepository) {
        this.flowRepository = flowRepository;
    }

    /// Validates a graph.
    ///
    /// @param graph graph to check, not null
    /// @return issues in discovery order, never null (empty when the graph is clean)
    public List<FlowIssue> validate(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        List<FlowIssue> issues = new ArrayList<>();

        long entries = graph.getNodes().values().stream().filter(EntryNode.class::isInstance)
                .count();
        if (entries == 0) {
            issues.add(new FlowIssue(Severity.ERROR, null, "Flow has no entry node"));
        } else if (entries > 1) {
            issues.add(
                    new FlowIssue(
                            Severity.WARNING, null,
                            "Flow has " + entries + " entry nodes, the first one is used"));
        }

        for (Connection connection : graph.getConnections()) {
            if (graph.getNode(connection.sourceNodeId()).isEmpty()) {
                issues.add(
                        new FlowIssue(
                                Severity.WARNING, connection.sourceNodeId(),
                                "Connection leaves unknown node " + connection.sourceNodeId()));
            }
            if (graph.getNode(connection.targetNodeId()).isEmpty()) {
                issues.add(
                        new FlowIssue(
                                Severity.ERROR, connection.sourceNodeId(),
                                "Connection from pin '" + connection.sourcePin()
                                        + "' targets unknown node " + connection.targetNodeId()));
            }
        }

        for (Node node : graph.getNodes().values()) {
            checkNode(graph, node, issues);
        }
        return issues;
    }

    private void checkNode(FlowGraph graph, Node node, List<FlowIssue> issues) {
        List<Connection> outgoing = graph.connectionsFrom(node.getId());
        boolean terminal =
                node instanceof ExitNode
                        || (node instanceof DialogueNode dialogue
                                && !dialogue.getResponses().isEmpty());
        if (outgoing.isEmpty() && !terminal && !(node instanceof FlowCallNode)) {
            issues.add(
                    new FlowIssue(
                            Severity.WARNING, node.getId(),
                            "Node '" + node.getLabel() + "' has no outgoing connection"));
        }

        if (node instanceof ConditionNode condition && condition.isSwitchMode()) {
            List<String> ruleIds =
                    condition.getCondition().rules().stream().map(Rule::id).toList();
            for (Connection connection : outgoing) {
                if (!ruleIds.contains(connection.sourcePin())
                        && !connection.sourcePin().equals(Pins.DEFAULT)) {
                    issues.add(
                            new FlowIssue(
                                    Severity.WARNING, node.getId(),
                                    "Switch pin '" + connection.sourcePin()
                                            + "' matches no rule"));
                }
            }
        }

        if (node instanceof FlowCallNode call && flowRepository != null) {
            if (flowRepository.getFlowGraph(call.getTargetFlowId()).isEmpty()) {
                issues.add(
                        new FlowIssue(
                                Severity.ERROR, node.getId(),
                                "Target flow " + call.getTargetFlowId() + " does not exist"));
            } else if (call.getTargetNodeId() != null
                    && flowRepository
                            .getNodeByTechnicalId(call.getTargetFlowId(), call.getTargetNodeId())
                            .isEmpty()) {
                issues.add(
                        new FlowIssue(
                                Severity.ERROR, node.getId(),
                                "Target node " + call.getTargetNodeId() + " does not exist in "
                                        + call.getTargetFlowId()));
            }
        }
    }
}
