package io.narrata.core.execution.executor;

import io.narrata.core.state.CallFrame;
import io.narrata.core.state.PendingChoice;
import java.util.List;
import java.util.Objects;

/// Where execution goes after a node visit.
///
/// Executors return a transition; the {@link io.narrata.core.execution.StepEngine}
/// applies it to the session state.
///
/// ### Permitted Implementations
/// - {@link Advance} - move to another node in the current flow
/// - {@link AwaitChoice} - wait for the player to pick a response
/// - {@link EnterFlow} - push a call frame and enter another flow
/// - {@link ReturnToCaller} - pop the innermost call frame
/// - {@link Finish} - end the session
/// - {@link Stall} - stay on the node and pause; the graph needs fixing
public sealed interface Transition
        permits Transition.Advance,
                Transition.AwaitChoice,
                Transition.EnterFlow,
                Transition.ReturnToCaller,
                Transition.Finish,
                Transition.Stall {

    static Transition advance(String targetNodeId) {
        return new Advance(targetNodeId);
    }

    static Transition finish() {
        return new Finish();
    }

    static Transition stall(String reason) {
        return new Stall(reason);
    }

    record Advance(String targetNodeId) implements Transition {
        public Advance {
            Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
        }
    }

    record AwaitChoice(List<PendingChoice> choices) implements Transition {
        public AwaitChoice {
            choices = List.copyOf(choices);
        }
    }

    /// @param frame caller context to push, not null
    /// @param flowId flow to enter, not null
    /// @param flowName name of the entered flow, may be null
    /// @param nodeId node to continue at in the entered flow, not null
    record EnterFlow(CallFrame frame, String flowId, String flowName, String nodeId)
            implements Transition {
        public EnterFlow {
            Objects.requireNonNull(frame, "frame must not be null");
            Objects.requireNonNull(flowId, "flowId must not be null");
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }
    }

    record ReturnToCaller() implements Transition {}

    record Finish() implements Transition {}

    record Stall(String reason) implements Transition {
        public Stall {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
