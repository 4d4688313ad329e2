package io.narrata.core.execution.executor;

import io.narrata.core.evaluator.AssignmentExecutor;
import io.narrata.core.evaluator.AssignmentOutcome;
import io.narrata.core.evaluator.ConditionEvaluator;
import io.narrata.core.evaluator.ConditionResult;
import io.narrata.core.evaluator.RuleResult;
import io.narrata.core.evaluator.SwitchResult;
import io.narrata.core.evaluator.VariableChange;
import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.Condition;
import io.narrata.core.flow.Connection;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.FlowRepository;
import io.narrata.core.flow.Pins;
import io.narrata.core.flow.node.Node;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionState;
import io.narrata.core.variable.Values;
import io.narrata.core.variable.VariableSource;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Everything a {@link NodeExecutor} may use during one step.
///
/// Executors read the session through this context and write to it only
/// through {@link #applyAssignments} and the logging methods, which keep the
/// console, the change history and the listener in step.
public final class StepContext {

    private final ExecutionState state;
    private final FlowGraph graph;
    private final FlowRepository flowRepository;
    private final ConditionEvaluator conditionEvaluator;
    private final AssignmentExecutor assignmentExecutor;

    public StepContext(
            ExecutionState state,
            FlowGraph graph,
            FlowRepository flowRepository,
            ConditionEvaluator conditionEvaluator,
            AssignmentExecutor assignmentExecutor) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.flowRepository = Objects.requireNonNull(flowRepository, "flowRepository must not be null");
        this.conditionEvaluator =
                Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
        this.assignmentExecutor =
                Objects.requireNonNull(assignmentExecutor, "assignmentExecutor must not be null");
    }

    public ExecutionState getState() {
        return state;
    }

    /// Returns the graph of the flow the current node belongs to.
    public FlowGraph getGraph() {
        return graph;
    }

    public FlowRepository getFlowRepository() {
        return flowRepository;
    }

    // Evaluation

    public ConditionResult evaluate(Condition condition) {
        return conditionEvaluator.evaluate(condition, state.getVariables());
    }

    public SwitchResult evaluateSwitch(Condition condition) {
        return conditionEvaluator.evaluateSwitch(condition, state.getVariables());
    }

    /// Applies assignments to the session variables on behalf of a node.
    ///
    /// Every change is appended to the history with `instruction` provenance
    /// and every skipped assignment is logged as a warning.
    ///
    /// @param node node the assignments belong to, not null
    /// @param assignments assignments in order, not null
    /// @return the applied outcome, never null
    public AssignmentOutcome applyAssignments(Node node, List<Assignment> assignments) {
        AssignmentOutcome outcome = assignmentExecutor.applyAll(assignments, state.getVariables());
        state.setVariables(outcome.variables());
        for (VariableChange change : outcome.changes()) {
            state.recordChange(
                    new ChangeRecord(
                            state.elapsedMillis(),
                            node.getId(),
                            node.getLabel(),
                            change.variableRef(),
                            change.oldValue(),
                            change.newValue(),
                            VariableSource.INSTRUCTION,
                            change.operator()));
        }
        for (String warning : outcome.warnings()) {
            warn(node, warning);
        }
        return outcome;
    }

    /// Renders changes as `ref: old → new` separated by commas.
    public static String describeChanges(List<VariableChange> changes) {
        return changes.stream()
                .map(c -> c.variableRef() + ": " + Values.display(c.oldValue()) + " → "
                        + Values.display(c.newValue()))
                .collect(Collectors.joining(", "));
    }

    // Connections

    /// Finds the node wired to a specific output pin.
    public Optional<String> targetOf(Node node, String pin) {
        return graph.connectionFrom(node.getId(), pin).map(Connection::targetNodeId);
    }

    /// Finds the node wired to the main output: `default`, then `output`, then
    /// the only connection leaving the node.
    public Optional<String> outputTarget(Node node) {
        return outputTarget(graph, node.getId());
    }

    /// Finds the main output of a node in any graph.
    public static Optional<String> outputTarget(FlowGraph graph, String nodeId) {
        Optional<Connection> connection =
                graph.connectionFrom(nodeId, Pins.DEFAULT)
                        .or(() -> graph.connectionFrom(nodeId, Pins.OUTPUT));
        if (connection.isEmpty()) {
            List<Connection> outgoing = graph.connectionsFrom(nodeId);
            if (outgoing.size() == 1) {
                connection = Optional.of(outgoing.get(0));
            }
        }
        return connection.map(Connection::targetNodeId);
    }

    /// Continues on the main output, or stalls with an error entry when unwired.
    public Transition followOutput(Node node) {
        Optional<String> target = outputTarget(node);
        if (target.isPresent()) {
            return Transition.advance(target.get());
        }
        return stall(node, "No outgoing connection from " + node.getLabel());
    }

    /// Logs an error and stalls on the node.
    public Transition stall(Node node, String reason) {
        error(node, reason);
        return Transition.stall(reason);
    }

    // Console

    public void info(Node node, String message) {
        log(node, ConsoleLevel.INFO, message, List.of());
    }

    public void warn(Node node, String message) {
        log(node, ConsoleLevel.WARNING, message, List.of());
    }

    public void error(Node node, String message) {
        log(node, ConsoleLevel.ERROR, message, List.of());
    }

    public void log(Node node, ConsoleLevel level, String message, List<RuleResult> details) {
        state.addConsole(level, node.getId(), node.getLabel(), message, details);
    }
}
