package io.narrata.core.execution.executor;

import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.SubflowNode;

public class SubflowNodeExecutor extends FlowCallNodeExecutor<SubflowNode> {

    @Override
    public Class<SubflowNode> getNodeType() {
        return SubflowNode.class;
    }

    @Override
    protected String describe(FlowGraph target) {
        return "Entering sub-flow " + target.getName();
    }
}
