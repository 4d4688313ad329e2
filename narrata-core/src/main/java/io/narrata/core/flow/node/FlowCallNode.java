package io.narrata.core.flow.node;

import java.util.Objects;

/// A node that transfers control into another flow.
///
/// Both subclasses push a call frame and enter the target; the target flow's
/// exit node pops the frame and resumes after this node. They differ only in
/// authoring intent: a {@link SubflowNode} is expected to return, a
/// {@link JumpNode} usually is not.
public abstract sealed class FlowCallNode extends Node permits JumpNode, SubflowNode {

    private final String targetFlowId;
    private final String targetNodeId;

    /// @param targetFlowId flow to enter, not null
    /// @param targetNodeId node to start at, or null for the target's entry node
    protected FlowCallNode(String id, String text, String targetFlowId, String targetNodeId) {
        super(id, text);
        this.targetFlowId = Objects.requireNonNull(targetFlowId, "targetFlowId must not be null");
        this.targetNodeId = targetNodeId;
    }

    public String getTargetFlowId() {
        return targetFlowId;
    }

    /// Returns the explicit start node in the target flow, or null.
    public String getTargetNodeId() {
        return targetNodeId;
    }
}
