package io.narrata.core;

import io.narrata.core.autocomplete.VariableCompletionSource;
import io.narrata.core.debug.DebugSession;
import io.narrata.core.evaluator.AssignmentExecutor;
import io.narrata.core.evaluator.ConditionEvaluator;
import io.narrata.core.execution.StepEngine;
import io.narrata.core.execution.executor.NodeExecutorRegistry;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.expression.ExpressionSerializer;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.FlowNotFoundException;
import io.narrata.core.flow.FlowRepository;
import io.narrata.core.flow.FlowValidator;
import io.narrata.core.flow.node.Node;
import io.narrata.core.sheet.SheetRepository;
import io.narrata.core.state.ExecutionState;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Container holding the wired Narrata components.
///
/// Opens {@link DebugSession}s and closes every session it opened on
/// {@link #close()}.
///
/// @apiNote Create instances via {@link NarrataFactory#bootstrap} rather than
/// direct construction.
public final class NarrataEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(NarrataEnvironment.class.getName());

    private final NarrataConfig config;
    private final ExpressionParser expressionParser;
    private final ExpressionSerializer expressionSerializer;
    private final ConditionEvaluator conditionEvaluator;
    private final AssignmentExecutor assignmentExecutor;
    private final NodeExecutorRegistry nodeExecutorRegistry;
    private final StepEngine stepEngine;
    private final FlowRepository flowRepository;
    private final SheetRepository sheetRepository;
    private final VariableCompletionSource completionSource;
    private final List<DebugSession> sessions = new ArrayList<>();

    NarrataEnvironment(
            NarrataConfig config,
            ExpressionParser expressionParser,
            ExpressionSerializer expressionSerializer,
            ConditionEvaluator conditionEvaluator,
            AssignmentExecutor assignmentExecutor,
            NodeExecutorRegistry nodeExecutorRegistry,
            StepEngine stepEngine,
            FlowRepository flowRepository,
            SheetRepository sheetRepository,
            VariableCompletionSource completionSource) {
        this.config = config;
        this.expressionParser = expressionParser;
        this.expressionSerializer = expressionSerializer;
        this.conditionEvaluator = conditionEvaluator;
        this.assignmentExecutor = assignmentExecutor;
        this.nodeExecutorRegistry = nodeExecutorRegistry;
        this.stepEngine = stepEngine;
        this.flowRepository = flowRepository;
        this.sheetRepository = sheetRepository;
        this.completionSource = completionSource;
    }

    /// Starts a debug session at the flow's entry node.
    ///
    /// @param flowId flow to debug, not null
    /// @return a new paused session, never null
    /// @throws FlowNotFoundException if the flow does not exist
    /// @throws IllegalStateException if the flow has no entry node
    public DebugSession openSession(String flowId) throws FlowNotFoundException {
        return openSession(flowId, null);
    }

    /// Starts a debug session at a given node.
    ///
    /// Variables are seeded from the sheet store for the configured project.
    ///
    /// @param flowId flow to debug, not null
    /// @param startNodeId node to start at, or null for the entry node
    /// @return a new paused session, never null
    /// @throws FlowNotFoundException if the flow does not exist
    /// @throws IllegalStateException if no start node is given and the flow has no entry node
    public DebugSession openSession(String flowId, String startNodeId)
            throws FlowNotFoundException {
        FlowGraph graph =
                flowRepository
                        .getFlowGraph(flowId)
                        .orElseThrow(() -> new FlowNotFoundException("Flow not found: " + flowId));
        String startNode = startNodeId;
        if (startNode == null) {
            startNode =
                    graph.getEntryNode()
                            .map(Node::getId)
                            .orElseThrow(() -> new IllegalStateException(
                                    "Flow " + flowId + " has no entry node"));
        }
        ExecutionState state =
                ExecutionState.builder()
                        .projectId(config.getProjectId())
                        .initialVariables(
                                sheetRepository.buildInitialVariables(config.getProjectId()))
                        .startFlow(graph.getId(), graph.getName())
                        .startNodeId(startNode)
                        .maxSteps(config.getMaxSteps())
                        .build();
        DebugSession session = new DebugSession(state, stepEngine, config);
        synchronized (sessions) {
            sessions.add(session);
        }
        return session;
    }

    /// Returns a validator bound to this environment's flow repository.
    public FlowValidator flowValidator() {
        return new FlowValidator(flowRepository);
    }

    public NarrataConfig getConfig() {
        return config;
    }

    public ExpressionParser getExpressionParser() {
        return expressionParser;
    }

    public ExpressionSerializer getExpressionSerializer() {
        return expressionSerializer;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    public AssignmentExecutor getAssignmentExecutor() {
        return assignmentExecutor;
    }

    public NodeExecutorRegistry getNodeExecutorRegistry() {
        return nodeExecutorRegistry;
    }

    public StepEngine getStepEngine() {
        return stepEngine;
    }

    public FlowRepository getFlowRepository() {
        return flowRepository;
    }

    public SheetRepository getSheetRepository() {
        return sheetRepository;
    }

    public VariableCompletionSource getCompletionSource() {
        return completionSource;
    }

    /// Closes every session opened through this environment.
    @Override
    public void close() {
        List<DebugSession> open;
        synchronized (sessions) {
            open = new ArrayList<>(sessions);
            sessions.clear();
        }
        open.forEach(DebugSession::close);
        logger.fine("Closed " + open.size() + " debug sessions");
    }
}
