package io.narrata.core.execution.executor;

import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.JumpNode;

public class JumpNodeExecutor extends FlowCallNodeExecutor<JumpNode> {

    @Override
    public Class<JumpNode> getNodeType() {
        return JumpNode.class;
    }

    @Override
    protected String describe(FlowGraph target) {
        return "Jump → " + target.getName();
    }
}
