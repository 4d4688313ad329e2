package io.narrata.core.state;

import io.narrata.core.variable.VariableStore;
import java.util.List;
import java.util.Objects;

/// Point-in-time copy of the mutable parts of an {@link ExecutionState}.
///
/// Variables are held by reference: {@link VariableStore} is immutable, so the
/// copy is structural. Append-only lists are recorded by length and truncated
/// on restore.
public record Snapshot(
        VariableStore variables,
        String currentNodeId,
        String currentFlowId,
        String currentFlowName,
        List<CallFrame> callStack,
        int consoleLength,
        int executionLogLength,
        int historyLength,
        ExecutionStatus status,
        int stepCount,
        List<PendingChoice> pendingChoices) {

    public Snapshot {
        Objects.requireNonNull(variables, "variables must not be null");
        Objects.requireNonNull(status, "status must not be null");
        callStack = callStack != null ? List.copyOf(callStack) : List.of();
        pendingChoices = pendingChoices != null ? List.copyOf(pendingChoices) : List.of();
    }
}
