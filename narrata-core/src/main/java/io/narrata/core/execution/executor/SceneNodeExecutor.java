package io.narrata.core.execution.executor;

import io.narrata.core.flow.node.SceneNode;

public class SceneNodeExecutor implements NodeExecutor<SceneNode> {

    @Override
    public Class<SceneNode> getNodeType() {
        return SceneNode.class;
    }

    @Override
    public Transition execute(SceneNode node, StepContext context) {
        context.info(node, "Scene: " + node.getLabel());
        return context.followOutput(node);
    }
}
