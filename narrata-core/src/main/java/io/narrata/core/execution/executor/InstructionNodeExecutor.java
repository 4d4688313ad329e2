package io.narrata.core.execution.executor;

import io.narrata.core.evaluator.AssignmentOutcome;
import io.narrata.core.flow.node.InstructionNode;

/// Applies every assignment of the node in order, then follows the output.
public class InstructionNodeExecutor implements NodeExecutor<InstructionNode> {

    @Override
    public Class<InstructionNode> getNodeType() {
        return InstructionNode.class;
    }

    @Override
    public Transition execute(InstructionNode node, StepContext context) {
        AssignmentOutcome outcome = context.applyAssignments(node, node.getAssignments());
        if (outcome.hasChanges()) {
            context.info(node, "Instruction → " + StepContext.describeChanges(outcome.changes()));
        } else {
            context.info(node, "Instruction → no changes");
        }
        return context.followOutput(node);
    }
}
