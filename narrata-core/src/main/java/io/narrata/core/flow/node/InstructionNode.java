package io.narrata.core.flow.node;

import io.narrata.core.expression.Assignment;
import java.util.List;

/// Applies a list of assignments in order, then continues on its single output.
///
/// @implNote Immutable and thread-safe after construction.
public final class InstructionNode extends Node {

    private final List<Assignment> assignments;

    private InstructionNode(Builder builder) {
        super(builder.id, builder.text);
        this.assignments =
                builder.assignments != null ? List.copyOf(builder.assignments) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INSTRUCTION;
    }

    public static final class Builder {
        private String id;
        private String text;
        private List<Assignment> assignments;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder assignments(List<Assignment> assignments) {
            this.assignments = assignments;
            return this;
        }

        public Builder assignments(Assignment... assignments) {
            this.assignments = List.of(assignments);
            return this;
        }

        public InstructionNode build() {
            return new InstructionNode(this);
        }
    }
}
