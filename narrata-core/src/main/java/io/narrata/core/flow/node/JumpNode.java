package io.narrata.core.flow.node;

/// Jumps to another flow, or to a specific node in it.
public final class JumpNode extends FlowCallNode {

    private JumpNode(Builder builder) {
        super(builder.id, builder.text, builder.targetFlowId, builder.targetNodeId);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.JUMP;
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

        public JumpNode build() {
            return new JumpNode(this);
        }
    }
}
