package io.narrata.core.flow.node;

/// Runs another flow and returns here when it exits.
public final class SubflowNode extends FlowCallNode {

    private SubflowNode(Builder builder) {
        super(builder.id, builder.text, builder.targetFlowId, builder.targetNodeId);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.SUBFLOW;
    }

    public static final class Builder {
        private String id;
        private String text;
        private String targetFlowId;
        private String targetNodeId;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder targetFlowId(String targetFlowId) {
            this.targetFlowId = targetFlowId;
            return this;
        }

        public Builder targetNodeId(String targetNodeId) {
            this.targetNodeId = targetNodeId;
            return this;
        }

        public SubflowNode build() {
            return new SubflowNode(this);
        }
    }
}
