package io.narrata.core.debug;

import io.narrata.core.state.CallFrame;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ConsoleEntry;
import io.narrata.core.state.ExecutionLogEntry;
import io.narrata.core.state.ExecutionState;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.state.PendingChoice;
import io.narrata.core.variable.VariableStore;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Immutable subset of the session state needed to render a debugger.
///
/// Returned by every {@link DebugSession} operation.
public record DebugView(
        String sessionId,
        ExecutionStatus status,
        int stepCount,
        int maxSteps,
        boolean stepLimitReached,
        String currentFlowId,
        String currentFlowName,
        String currentNodeId,
        VariableStore variables,
        List<ConsoleEntry> console,
        List<ExecutionLogEntry> executionLog,
        List<ChangeRecord> history,
        Set<String> breakpoints,
        List<CallFrame> callStack,
        List<PendingChoice> pendingChoices,
        boolean canStepBack,
        boolean autoPlaying,
        long autoPlayDelayMillis) {

    public DebugView {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        console = List.copyOf(console);
        executionLog = List.copyOf(executionLog);
        history = List.copyOf(history);
        breakpoints = Set.copyOf(breakpoints);
        callStack = List.copyOf(callStack);
        pendingChoices = List.copyOf(pendingChoices);
    }

    static DebugView of(ExecutionState state, boolean autoPlaying, long autoPlayDelayMillis) {
        return new DebugView(
                state.getSessionId(),
                state.getStatus(),
                state.getStepCount(),
                state.getMaxSteps(),
                state.isStepLimitReached(),
                state.getCurrentFlowId(),
                state.getCurrentFlowName(),
                state.getCurrentNodeId(),
                state.getVariables(),
                state.getConsole(),
                state.getExecutionLog(),
                state.getHistory(),
                state.getBreakpoints(),
                state.getCallStack(),
                state.getPendingChoices(),
                state.canStepBack(),
                autoPlaying,
                autoPlayDelayMillis);
    }

    /// Returns the most recent console entry, if any.
    public ConsoleEntry lastConsoleEntry() {
        return console.isEmpty() ? null : console.get(console.size() - 1);
    }

    public boolean isFinished() {
        return status == ExecutionStatus.FINISHED;
    }

    public boolean isWaitingForInput() {
        return status == ExecutionStatus.WAITING_INPUT;
    }
}
