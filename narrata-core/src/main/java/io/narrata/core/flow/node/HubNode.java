package io.narrata.core.flow.node;

/// Merge and fan-out point with up to four outputs (`out1`..`out4`).
///
/// A hub has no branching logic: it forwards to the first connected output.
public final class HubNode extends Node {

    private HubNode(Builder builder) {
        super(builder.id, builder.text);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HubNode of(String id) {
        return builder().id(id).build();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.HUB;
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

        public HubNode build() {
            return new HubNode(this);
        }
    }
}
