package io.narrata.core.flow.node;

import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.Condition;
import java.util.List;
import java.util.Optional;

/// A line of dialogue, optionally followed by player responses.
///
/// ### Visit order
/// 1. `inputCondition` is checked and reported; a failure is a warning only
/// 2. `outputInstruction` is applied
/// 3. responses are filtered by their own conditions; if any pass the session
///    waits for a choice, otherwise the output connection is followed
///
/// @implNote Immutable and thread-safe after construction.
/// @see io.narrata.core.execution.executor.DialogueNodeExecutor
public final class DialogueNode extends Node {

    private final String speaker;
    private final Condition inputCondition;
    private final List<Assignment> outputInstruction;
    private final List<Response> responses;

    private DialogueNode(Builder builder) {
        super(builder.id, builder.text);
        this.speaker = builder.speaker;
        this.inputCondition =
                builder.inputCondition != null ? builder.inputCondition : Condition.empty();
        this.outputInstruction =
                builder.outputInstruction != null
                        ? List.copyOf(builder.outputInstruction)
                        : List.of();
        this.responses = builder.responses != null ? List.copyOf(builder.responses) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the speaking character's name, or null for narration.
    public String getSpeaker() {
        return speaker;
    }

    public Condition getInputCondition() {
        return inputCondition;
    }

    public List<Assignment> getOutputInstruction() {
        return outputInstruction;
    }

    public List<Response> getResponses() {
        return responses;
    }

    public Optional<Response> getResponse(String responseId) {
        return responses.stream().filter(r -> r.id().equals(responseId)).findFirst();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DIALOGUE;
    }

    public static final class Builder {
        private String id;
        private String text;
        private String speaker;
        private Condition inputCondition;
        private List<Assignment> outputInstruction;
        private List<Response> responses;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder speaker(String speaker) {
            this.speaker = speaker;
            return this;
        }

        public Builder inputCondition(Condition inputCondition) {
            this.inputCondition = inputCondition;
            return this;
        }

        public Builder outputInstruction(List<Assignment> outputInstruction) {
            this.outputInstruction = outputInstruction;
            return this;
        }

        public Builder responses(List<Response> responses) {
            this.responses = responses;
            return this;
        }

        public Builder responses(Response... responses) {
            this.responses = List.of(responses);
            return this;
        }

        public DialogueNode build() {
            return new DialogueNode(this);
        }
    }
}
