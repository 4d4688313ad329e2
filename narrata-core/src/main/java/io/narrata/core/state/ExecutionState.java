package io.narrata.core.state;

import io.narrata.core.evaluator.RuleResult;
import io.narrata.core.execution.ExecutionListener;
import io.narrata.core.variable.VariableStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/// Mutable state of one debug session.
///
/// Tracks the current position, variables, call stack and the append-only
/// console, execution log and change history. Snapshots capture everything
/// a step may change, so {@link #restoreLatestSnapshot()} undoes a step exactly.
///
/// ### State Components
/// - **Immutable**: `sessionId`, `projectId`, `initialVariables`
/// - **Position**: `currentFlowId`, `currentNodeId`, `callStack`
/// - **Values**: `variables`, replaced as a whole on every write
/// - **Append-only**: `console`, `executionLog`, `history`
/// - **Control**: `status`, `stepCount`, `maxSteps`, `breakpoints`, `pendingChoices`
///
/// @implNote **Not thread-safe**. Owned by a single
/// {@link io.narrata.core.debug.DebugSession}, which serializes all access.
public final class ExecutionState {

    private final String sessionId;
    private final String projectId;
    private final VariableStore initialVariables;
    private final long startedAtNanos;
    private final String startFlowId;
    private final String startFlowName;
    private final String startNodeId;

    private ExecutionStatus status = ExecutionStatus.PAUSED;
    private int stepCount;
    private int maxSteps;
    private String currentFlowId;
    private String currentFlowName;
    private String currentNodeId;
    private VariableStore variables;
    private List<PendingChoice> pendingChoices = List.of();

    private final List<CallFrame> callStack = new ArrayList<>();
    private final Deque<Snapshot> snapshots = new ArrayDeque<>();
    private final List<ConsoleEntry> console = new ArrayList<>();
    private final List<ExecutionLogEntry> executionLog = new ArrayList<>();
    private final List<ChangeRecord> history = new ArrayList<>();
    private final Set<String> breakpoints = new LinkedHashSet<>();

    private ExecutionListener listener = ExecutionListener.NOOP;

    private ExecutionState(Builder builder) {
        this.sessionId =
                builder.sessionId != null ? builder.sessionId : UUID.randomUUID().toString();
        this.projectId = builder.projectId;
        this.initialVariables =
                Objects.requireNonNull(builder.initialVariables, "initialVariables must not be null");
        this.startFlowId = Objects.requireNonNull(builder.startFlowId, "startFlowId must not be null");
        this.startFlowName = builder.startFlowName != null ? builder.startFlowName : startFlowId;
        this.startNodeId = Objects.requireNonNull(builder.startNodeId, "startNodeId must not be null");
        if (builder.maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        this.maxSteps = builder.maxSteps;
        this.startedAtNanos = System.nanoTime();
        this.currentFlowId = startFlowId;
        this.currentFlowName = startFlowName;
        this.currentNodeId = startNodeId;
        this.variables = initialVariables;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters

    public String getSessionId() {
        return sessionId;
    }

    public String getProjectId() {
        return projectId;
    }

    public VariableStore getInitialVariables() {
        return initialVariables;
    }

    public String getStartFlowId() {
        return startFlowId;
    }

    public String getStartNodeId() {
        return startNodeId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public int getStepCount() {
        return stepCount;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /// Returns true once the step count has reached the step limit.
    public boolean isStepLimitReached() {
        return stepCount >= maxSteps;
    }

    public String getCurrentFlowId() {
        return currentFlowId;
    }

    public String getCurrentFlowName() {
        return currentFlowName;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public VariableStore getVariables() {
        return variables;
    }

    public List<PendingChoice> getPendingChoices() {
        return pendingChoices;
    }

    public Optional<PendingChoice> getPendingChoice(String responseId) {
        return pendingChoices.stream()
                .filter(choice -> choice.responseId().equals(responseId))
                .findFirst();
    }

    /// Returns the call stack, outermost caller first.
    public List<CallFrame> getCallStack() {
        return Collections.unmodifiableList(callStack);
    }

    /// Returns the call-stack depth: 0 in the starting flow.
    public int getDepth() {
        return callStack.size();
    }

    public List<ConsoleEntry> getConsole() {
        return Collections.unmodifiableList(console);
    }

    public List<ExecutionLogEntry> getExecutionLog() {
        return Collections.unmodifiableList(executionLog);
    }

    public List<ChangeRecord> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Set<String> getBreakpoints() {
        return Collections.unmodifiableSet(breakpoints);
    }

    public int getSnapshotCount() {
        return snapshots.size();
    }

    public boolean canStepBack() {
        return !snapshots.isEmpty();
    }

    /// Milliseconds elapsed since the session started, used as entry timestamps.
    public long elapsedMillis() {
        return (System.nanoTime() - startedAtNanos) / 1_000_000L;
    }

    // Mutators

    public ExecutionListener getListener() {
        return listener;
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public void incrementStepCount() {
        ++stepCount;
    }

    /// Raises the step limit by the given amount.
    public void raiseMaxSteps(int increment) {
        if (increment <= 0) {
            throw new IllegalArgumentException("increment must be positive");
        }
        maxSteps += increment;
    }

    public void setCurrentNode(String nodeId) {
        this.currentNodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
    }

    /// Moves to a node in another flow without touching the call stack.
    public void setCurrentPosition(String flowId, String flowName, String nodeId) {
        this.currentFlowId = Objects.requireNonNull(flowId, "flowId must not be null");
        this.currentFlowName = flowName != null ? flowName : flowId;
        this.currentNodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
    }

    public void setVariables(VariableStore variables) {
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
    }

    public void setPendingChoices(List<PendingChoice> pendingChoices) {
        this.pendingChoices = pendingChoices != null ? List.copyOf(pendingChoices) : List.of();
    }

    public void clearPendingChoices() {
        this.pendingChoices = List.of();
    }

    public void pushFrame(CallFrame frame) {
        callStack.add(Objects.requireNonNull(frame, "frame must not be null"));
    }

    /// Pops the innermost call frame.
    ///
    /// @return the popped frame, or empty at the top level
    public Optional<CallFrame> popFrame() {
        if (callStack.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(callStack.remove(callStack.size() - 1));
    }

    /// Appends a console entry for the current node context and notifies the listener.
    public ConsoleEntry addConsole(
            ConsoleLevel level, String nodeId, String nodeLabel, String message,
            List<RuleResult> ruleDetails) {
        ConsoleEntry entry =
                new ConsoleEntry(elapsedMillis(), level, nodeId, nodeLabel, message, ruleDetails);
        console.add(entry);
        listener.onConsoleEntry(entry);
        return entry;
    }

    /// Appends a session-level console entry.
    public ConsoleEntry addConsole(ConsoleLevel level, String message) {
        return addConsole(level, null, null, message, List.of());
    }

    public void appendLog(ExecutionLogEntry entry) {
        executionLog.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    public void recordChange(ChangeRecord change) {
        history.add(Objects.requireNonNull(change, "change must not be null"));
        listener.onVariableChanged(change);
    }

    /// Adds the node to the breakpoints, or removes it if present.
    ///
    /// @return true if the node now has a breakpoint
    public boolean toggleBreakpoint(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        if (breakpoints.remove(nodeId)) {
            return false;
        }
        breakpoints.add(nodeId);
        return true;
    }

    // Snapshots

    /// Captures the current state and pushes it on the undo stack.
    public Snapshot pushSnapshot() {
        Snapshot snapshot =
                new Snapshot(
                        variables,
                        currentNodeId,
                        currentFlowId,
                        currentFlowName,
                        callStack,
                        console.size(),
                        executionLog.size(),
                        history.size(),
                        status,
                        stepCount,
                        pendingChoices);
        snapshots.push(snapshot);
        return snapshot;
    }

    /// Pops the latest snapshot and restores it verbatim.
    ///
    /// The console, execution log and history are truncated to the recorded
    /// lengths rather than recomputed.
    ///
    /// @return the restored snapshot, or empty if there is none
    public Optional<Snapshot> restoreLatestSnapshot() {
        Snapshot snapshot = snapshots.poll();
        if (snapshot == null) {
            return Optional.empty();
        }
        variables = snapshot.variables();
        currentNodeId = snapshot.currentNodeId();
        currentFlowId = snapshot.currentFlowId();
        callStack.clear();
        callStack.addAll(snapshot.callStack());
        currentFlowName = snapshot.currentFlowName();
        truncate(console, snapshot.consoleLength());
        truncate(executionLog, snapshot.executionLogLength());
        truncate(history, snapshot.historyLength());
        status = snapshot.status();
        stepCount = snapshot.stepCount();
        pendingChoices = snapshot.pendingChoices();
        return Optional.of(snapshot);
    }

    /// Returns every session field to its starting value, keeping breakpoints.
    ///
    /// @param newMaxSteps step limit for the fresh run, positive
    public void reset(int newMaxSteps) {
        if (newMaxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        status = ExecutionStatus.PAUSED;
        stepCount = 0;
        maxSteps = newMaxSteps;
        currentFlowId = startFlowId;
        currentFlowName = startFlowName;
        currentNodeId = startNodeId;
        variables = initialVariables;
        pendingChoices = List.of();
        callStack.clear();
        snapshots.clear();
        console.clear();
        executionLog.clear();
        history.clear();
    }

    private static void truncate(List<?> list, int length) {
        if (list.size() > length) {
            list.subList(length, list.size()).clear();
        }
    }

    public static final class Builder {
        private String sessionId;
        private String projectId;
        private VariableStore initialVariables = VariableStore.empty();
        private String startFlowId;
        private String startFlowName;
        private String startNodeId;
        private int maxSteps = 1000;

        private Builder() {}

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder initialVariables(VariableStore initialVariables) {
            this.initialVariables = initialVariables;
            return this;
        }

        public Builder startFlow(String flowId, String flowName) {
            this.startFlowId = flowId;
            this.startFlowName = flowName;
            return this;
        }

        public Builder startNodeId(String startNodeId) {
            this.startNodeId = startNodeId;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public ExecutionState build() {
            return new ExecutionState(this);
        }
    }
}
