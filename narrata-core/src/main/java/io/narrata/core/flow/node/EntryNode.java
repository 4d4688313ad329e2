package io.narrata.core.flow.node;

/// Start of a flow. Every flow has exactly one; sessions and sub-flow calls begin here.
public final class EntryNode extends Node {

    private EntryNode(Builder builder) {
        super(builder.id, builder.text);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EntryNode of(String id) {
        return builder().id(id).build();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.ENTRY;
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

        public EntryNode build() {
            return new EntryNode(this);
        }
    }
}
