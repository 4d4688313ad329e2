package io.narrata.core.debug;

import java.util.Objects;

/// A user action on a {@link DebugSession}.
///
/// Lets front ends queue or replay actions as values. Each command maps
/// one-to-one onto a session method.
///
/// {@snippet :
/// DebugView view = new DebugCommand.ChooseResponse("r1").apply(session);
/// }
public sealed interface DebugCommand {

    /// Applies the command and returns the resulting view.
    DebugView apply(DebugSession session);

    record Step() implements DebugCommand {
        @Override
        public DebugView apply(DebugSession session) {
            return session.step();
        }
    }

    record StepBack() implements DebugCommand {
        @Override
        public DebugView apply(DebugSession session) {
            return session.stepBack();
        }
    }

    record Play() implements DebugCommand {
        @Override
        public DebugView apply(DebugSession session) {
            return session.play();
        }
    }

    record Pause() implements DebugCommand {
        @Override
        public DebugView apply(DebugSession session) {
            return session.pause();
        }
    }

    record ToggleBreakpoint(String nodeId) implements DebugCommand {
        public ToggleBreakpoint {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }

        @Override
        public DebugView apply(DebugSession session) {
            return session.toggleBreakpoint(nodeId);
        }
    }

    /// User override from raw editor text; the text is parsed per variable type.
    record SetVariable(String key, String rawValue) implements DebugCommand {
        public SetVariable {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public DebugView apply(DebugSession session) {
            return session.setVariableFromText(key, rawValue);
        }
    }

    record ChooseResponse(String responseId) implements DebugCommand {
        public ChooseResponse {
            Objects.requireNonNull(responseId, "responseId must not be null");
        }

        @Override
        public DebugView apply(DebugSession session) {
            return session.chooseResponse(responseId);
        }
    }

    record ContinuePastLimit() implements DebugCommand {
        @Override
        public DebugView apply(DebugSession session) {
            return session.continuePastLimit();
        }
    }

    record Reset() implements DebugCommand {
        @Override
        public DebugView apply(DebugSession session) {
            return session.reset();
        }
    }
}
