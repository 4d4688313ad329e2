package io.narrata.core.flow.node;

/// Scene heading. Sets the stage for the dialogue that follows and passes through.
public final class SceneNode extends Node {

    private SceneNode(Builder builder) {
        super(builder.id, builder.text);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SceneNode of(String id) {
        return builder().id(id).build();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.SCENE;
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

        public SceneNode build() {
            return new SceneNode(this);
        }
    }
}
