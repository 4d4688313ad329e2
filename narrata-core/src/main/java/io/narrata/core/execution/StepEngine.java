package io.narrata.core.execution;

import io.narrata.core.evaluator.AssignmentExecutor;
import io.narrata.core.evaluator.AssignmentOutcome;
import io.narrata.core.evaluator.ConditionEvaluator;
import io.narrata.core.execution.executor.NodeExecutor;
import io.narrata.core.execution.executor.NodeExecutorNotFound;
import io.narrata.core.execution.executor.NodeExecutorRegistry;
import io.narrata.core.execution.executor.StepContext;
import io.narrata.core.execution.executor.Transition;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.FlowRepository;
import io.narrata.core.flow.Pins;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.Node;
import io.narrata.core.flow.node.Response;
import io.narrata.core.state.CallFrame;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionLogEntry;
import io.narrata.core.state.ExecutionState;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.state.PendingChoice;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Graph state machine: one call to {@link #step} is one node visit.
///
/// ### Step sequence
/// 1. Refuse when the session is finished, waiting for input or at its step limit
/// 2. Count the step and look up the current node
/// 3. Append `{node, depth}` to the execution log
/// 4. Dispatch to the node's executor through the {@link NodeExecutorRegistry}
/// 5. Apply the returned {@link Transition} to the state
/// 6. Pause when the step limit has just been reached
///
/// The engine never throws for bad graph data. Unknown flows, unknown nodes and
/// unwired outputs produce an error console entry and leave the session paused
/// on the offending node, so the graph can be fixed and the step retried.
///
/// Snapshots are not taken here; the debug session pushes one before each
/// call that may mutate state.
///
/// @implNote Stateless and thread-safe. All mutable state lives in the
/// {@link ExecutionState} passed in, which callers must not share between threads.
public class StepEngine {

    private static final Logger logger = Logger.getLogger(StepEngine.class.getName());

    private final FlowRepository flowRepository;
    private final NodeExecutorRegistry executorRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final AssignmentExecutor assignmentExecutor;

    public StepEngine(
            FlowRepository flowRepository,
            NodeExecutorRegistry executorRegistry,
            ConditionEvaluator conditionEvaluator,
            AssignmentExecutor assignmentExecutor) {
        this.flowRepository = Objects.requireNonNull(flowRepository, "flowRepository must not be null");
        this.executorRegistry =
                Objects.requireNonNull(executorRegistry, "executorRegistry must not be null");
        this.conditionEvaluator =
                Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
        this.assignmentExecutor =
                Objects.requireNonNull(assignmentExecutor, "assignmentExecutor must not be null");
    }

    /// Checks whether a step may run.
    ///
    /// @param state session state, not null
    /// @return the reason the step is refused, or empty if it may run
    public Optional<String> checkCanStep(ExecutionState state) {
        if (state.getStatus() == ExecutionStatus.FINISHED) {
            return Optional.of("Execution finished");
        }
        if (state.getStatus() == ExecutionStatus.WAITING_INPUT) {
            return Optional.of("Waiting for a response");
        }
        if (state.isStepLimitReached()) {
            return Optional.of("Step limit of " + state.getMaxSteps() + " reached");
        }
        return Optional.empty();
    }

    /// Executes the current node and moves on.
    ///
    /// @param state session state, not null
    /// @return what happened, never null
    public StepOutcome step(ExecutionState state) {
        Optional<String> refusal = checkCanStep(state);
        if (refusal.isPresent()) {
            logger.fine("Step refused: " + refusal.get());
            return StepOutcome.REFUSED;
        }

        state.incrementStepCount();
        String flowId = state.getCurrentFlowId();
        String nodeId = state.getCurrentNodeId();

        Optional<FlowGraph> graph = flowRepository.getFlowGraph(flowId);
        Optional<Node> current = graph.flatMap(g -> g.getNode(nodeId));
        if (current.isEmpty()) {
            String message =
                    graph.isEmpty()
                            ? "Flow " + flowId + " not found"
                            : "Node " + nodeId + " not found in flow " + graph.get().getName();
            state.appendLog(new ExecutionLogEntry(nodeId, flowId, null, state.getDepth()));
            state.addConsole(ConsoleLevel.ERROR, nodeId, null, message, List.of());
            logger.warning(message);
            return finishStep(state, apply(state, Transition.stall(message)));
        }

        Node node = current.get();
        state.appendLog(
                new ExecutionLogEntry(node.getId(), flowId, node.getLabel(), state.getDepth()));
        logger.info("Step " + state.getStepCount() + ": " + node.getNodeType().id() + " "
                + node.getId() + " in " + flowId);

        StepContext context =
                new StepContext(
                        state, graph.get(), flowRepository, conditionEvaluator, assignmentExecutor);
        state.getListener().onNodeStart(node);
        Transition transition = dispatch(node, context);
        state.getListener().onNodeComplete(node, transition);

        return finishStep(state, apply(state, transition));
    }

    /// Checks whether a response may be chosen.
    ///
    /// @param state session state, not null
    /// @param responseId response to choose, not null
    /// @return the reason the choice is refused, or empty if it may be made
    public Optional<String> checkCanChoose(ExecutionState state, String responseId) {
        if (state.getStatus() != ExecutionStatus.WAITING_INPUT) {
            return Optional.of("Not waiting for a response");
        }
        Optional<PendingChoice> choice = state.getPendingChoice(responseId);
        if (choice.isEmpty()) {
            return Optional.of("Unknown response " + responseId);
        }
        if (!choice.get().valid()) {
            return Optional.of("Response " + responseId + " is not available");
        }
        Optional<DialogueNode> dialogue = currentDialogue(state);
        if (dialogue.isEmpty()) {
            return Optional.of("Current node is not a dialogue");
        }
        if (responseTarget(state, dialogue.get(), responseId).isEmpty()) {
            return Optional.of("No connection for response " + responseId);
        }
        return Optional.empty();
    }

    /// Resolves a pending dialogue choice.
    ///
    /// Applies the response instruction, logs the selection and follows the
    /// output named after the response id, or `resp_<id>`. Does not count as a
    /// step and does not touch the execution log.
    ///
    /// @param state session state, not null
    /// @param responseId response to choose, not null
    /// @return {@link StepOutcome#ADVANCED}, or {@link StepOutcome#REFUSED} with no change
    public StepOutcome chooseResponse(ExecutionState state, String responseId) {
        Optional<String> refusal = checkCanChoose(state, responseId);
        if (refusal.isPresent()) {
            logger.fine("Choice refused: " + refusal.get());
            return StepOutcome.REFUSED;
        }
        DialogueNode dialogue = currentDialogue(state).orElseThrow();
        Response response = dialogue.getResponse(responseId).orElseThrow();
        FlowGraph graph = flowRepository.getFlowGraph(state.getCurrentFlowId()).orElseThrow();
        String target = responseTarget(state, dialogue, responseId).orElseThrow();

        StepContext context =
                new StepContext(state, graph, flowRepository, conditionEvaluator, assignmentExecutor);
        String text = response.text() != null ? response.text() : response.id();
        AssignmentOutcome outcome = context.applyAssignments(dialogue, response.instruction());
        String message = "Selected: \"" + text + "\"";
        if (outcome.hasChanges()) {
            message += " → " + StepContext.describeChanges(outcome.changes());
        }
        context.info(dialogue, message);

        state.clearPendingChoices();
        state.setCurrentNode(target);
        state.setStatus(ExecutionStatus.PAUSED);
        return StepOutcome.ADVANCED;
    }

    private <T extends Node> Transition dispatch(T node, StepContext context) {
        try {
            NodeExecutor<T> executor = executorRegistry.getExecutorFor(node);
            return executor.execute(node, context);
        } catch (NodeExecutorNotFound e) {
            return context.stall(node, e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Executor failed on node " + node.getId(), e);
            return context.stall(node, "Internal error: " + e.getMessage());
        }
    }

    private StepOutcome apply(ExecutionState state, Transition transition) {
        if (transition instanceof Transition.Advance advance) {
            state.setCurrentNode(advance.targetNodeId());
            return StepOutcome.ADVANCED;
        }
        if (transition instanceof Transition.AwaitChoice await) {
            state.setPendingChoices(await.choices());
            state.setStatus(ExecutionStatus.WAITING_INPUT);
            return StepOutcome.WAITING_INPUT;
        }
        if (transition instanceof Transition.EnterFlow enter) {
            state.pushFrame(enter.frame());
            state.setCurrentPosition(enter.flowId(), enter.flowName(), enter.nodeId());
            return StepOutcome.ADVANCED;
        }
        if (transition instanceof Transition.ReturnToCaller) {
            return returnToCaller(state);
        }
        if (transition instanceof Transition.Finish) {
            state.clearPendingChoices();
            state.setStatus(ExecutionStatus.FINISHED);
            logger.info("Session " + state.getSessionId() + " finished after "
                    + state.getStepCount() + " steps");
            return StepOutcome.FINISHED;
        }
        state.setStatus(ExecutionStatus.PAUSED);
        return StepOutcome.STALLED;
    }

    /// Pops the innermost frame and resumes after its call site.
    private StepOutcome returnToCaller(ExecutionState state) {
        Optional<CallFrame> popped = state.popFrame();
        if (popped.isEmpty()) {
            return apply(state, Transition.finish());
        }
        CallFrame frame = popped.get();
        state.setCurrentPosition(frame.flowId(), frame.flowName(), frame.returnNodeId());

        Optional<FlowGraph> caller = flowRepository.getFlowGraph(frame.flowId());
        if (caller.isEmpty()) {
            String message = "Calling flow " + frame.flowId() + " not found";
            state.addConsole(ConsoleLevel.ERROR, frame.returnNodeId(), null, message, List.of());
            return apply(state, Transition.stall(message));
        }
        Optional<String> next = StepContext.outputTarget(caller.get(), frame.returnNodeId());
        if (next.isEmpty()) {
            state.addConsole(
                    ConsoleLevel.INFO, frame.returnNodeId(), null, "Execution finished",
                    List.of());
            return apply(state, Transition.finish());
        }
        state.setCurrentNode(next.get());
        return StepOutcome.ADVANCED;
    }

    private StepOutcome finishStep(ExecutionState state, StepOutcome outcome) {
        if (state.isStepLimitReached() && state.getStatus() != ExecutionStatus.FINISHED) {
            state.addConsole(
                    ConsoleLevel.WARNING,
                    "Step limit of " + state.getMaxSteps()
                            + " reached. Continue to allow more steps.");
            if (state.getStatus() == ExecutionStatus.RUNNING) {
                state.setStatus(ExecutionStatus.PAUSED);
            }
            logger.warning("Session " + state.getSessionId() + " reached its step limit");
        }
        return outcome;
    }

    private Optional<DialogueNode> currentDialogue(ExecutionState state) {
        return flowRepository
                .getNodeByTechnicalId(state.getCurrentFlowId(), state.getCurrentNodeId())
                .filter(DialogueNode.class::isInstance)
                .map(DialogueNode.class::cast);
    }

    private Optional<String> responseTarget(
            ExecutionState state, DialogueNode dialogue, String responseId) {
        return flowRepository
                .getFlowGraph(state.getCurrentFlowId())
                .flatMap(
                        graph ->
                                graph.connectionFrom(dialogue.getId(), responseId)
                                        .or(() -> graph.connectionFrom(
                                                dialogue.getId(), Pins.responsePin(responseId))))
                .map(connection -> connection.targetNodeId());
    }
}
