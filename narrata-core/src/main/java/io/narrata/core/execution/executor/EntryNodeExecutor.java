package io.narrata.core.execution.executor;

import io.narrata.core.flow.node.EntryNode;

public class EntryNodeExecutor implements NodeExecutor<EntryNode> {

    @Override
    public Class<EntryNode> getNodeType() {
        return EntryNode.class;
    }

    @Override
    public Transition execute(EntryNode node, StepContext context) {
        if (context.getState().getDepth() == 0) {
            context.info(node, "Execution started");
        } else {
            context.info(node, "Entered flow " + context.getGraph().getName());
        }
        return context.followOutput(node);
    }
}
