package io.narrata.core.flow.node;

import io.narrata.core.expression.Condition;

/// Branches on a {@link Condition}.
///
/// In boolean mode the node has `true` and `false` outputs. In switch mode it
/// has one output per rule, named by the rule id, plus an optional `default`
/// output taken when no rule holds.
///
/// @implNote Immutable and thread-safe after construction.
public final class ConditionNode extends Node {

    private final Condition condition;
    private final boolean switchMode;

    private ConditionNode(Builder builder) {
        super(builder.id, builder.text);
        this.condition = builder.condition != null ? builder.condition : Condition.empty();
        this.switchMode = builder.switchMode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Condition getCondition() {
        return condition;
    }

    public boolean isSwitchMode() {
        return switchMode;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION;
    }

    public static final class Builder {
        private String id;
        private String text;
        private Condition condition;
        private boolean switchMode;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder condition(Condition condition) {
            this.condition = condition;
            return this;
        }

        public Builder switchMode(boolean switchMode) {
            this.switchMode = switchMode;
            return this;
        }

        public ConditionNode build() {
            return new ConditionNode(this);
        }
    }
}
