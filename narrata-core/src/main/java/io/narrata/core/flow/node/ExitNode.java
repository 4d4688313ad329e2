package io.narrata.core.flow.node;

/// End of a flow. Returns to the calling flow, or finishes the session at the top level.
public final class ExitNode extends Node {

    private ExitNode(Builder builder) {
        super(builder.id, builder.text);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ExitNode of(String id) {
        return builder().id(id).build();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.EXIT;
    }

    public static final class Builder {
        private String id;
        private String text;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public ExitNode build() {
            return new ExitNode(this);
        }
    }
}
