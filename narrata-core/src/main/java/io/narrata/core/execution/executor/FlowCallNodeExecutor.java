package io.narrata.core.execution.executor;

import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.FlowCallNode;
import io.narrata.core.flow.node.Node;
import io.narrata.core.state.CallFrame;
import io.narrata.core.state.ExecutionState;
import java.util.Optional;

/// Shared behaviour of jump and sub-flow nodes.
///
/// Resolves the target flow and start node, then asks the engine to push a
/// frame for the current flow and enter the target. The return path is the
/// same for both node types: the target flow's exit pops the frame.
///
/// @param <T> the call node type
public abstract class FlowCallNodeExecutor<T extends FlowCallNode> implements NodeExecutor<T> {

    @Override
    public Transition execute(T node, StepContext context) {
        Optional<FlowGraph> target = context.getFlowRepository().getFlowGraph(node.getTargetFlowId());
        if (target.isEmpty()) {
            return context.stall(node, "Target flow " + node.getTargetFlowId() + " not found");
        }
        FlowGraph graph = target.get();

        Optional<Node> start;
        if (node.getTargetNodeId() != null) {
            start = context.getFlowRepository()
                    .getNodeByTechnicalId(graph.getId(), node.getTargetNodeId());
            if (start.isEmpty()) {
                return context.stall(
                        node,
                        "Target node " + node.getTargetNodeId() + " not found in " + graph.getName());
            }
        } else {
            start = graph.getEntryNode();
            if (start.isEmpty()) {
                return context.stall(node, "Target flow " + graph.getName() + " has no entry node");
            }
        }

        ExecutionState state = context.getState();
        context.info(node, describe(graph));
        CallFrame frame =
                new CallFrame(state.getCurrentFlowId(), state.getCurrentFlowName(), node.getId());
        return new Transition.EnterFlow(frame, graph.getId(), graph.getName(), start.get().getId());
    }

    /// Returns the console message for entering the target flow.
    protected abstract String describe(FlowGraph target);
}
