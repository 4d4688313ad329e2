package io.narrata.core;

import io.narrata.core.autocomplete.VariableCompletionSource;
import io.narrata.core.evaluator.AssignmentExecutor;
import io.narrata.core.evaluator.ConditionEvaluator;
import io.narrata.core.execution.StepEngine;
import io.narrata.core.execution.executor.DefaultNodeExecutorRegistry;
import io.narrata.core.execution.executor.NodeExecutorRegistry;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.expression.ExpressionSerializer;
import io.narrata.core.flow.FlowRepository;
import io.narrata.core.flow.InMemoryFlowRepository;
import io.narrata.core.sheet.InMemorySheetRepository;
import io.narrata.core.sheet.SheetRepository;
import io.narrata.core.variable.ReferenceResolver;
import java.util.Objects;

/// Factory wiring a {@link NarrataEnvironment}.
///
/// {@snippet :
/// try (var env = NarrataFactory.bootstrap(NarrataConfig.builder().maxSteps(200).build(),
///         flowRepository, sheetRepository)) {
///     DebugSession session = env.openSession("intro");
///     session.step();
/// }
/// }
///
/// @implNote Utility class. Every component is created here and passed to its
/// consumers through constructors; the parser and evaluators share one resolver.
public final class NarrataFactory {

    private NarrataFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and empty in-memory stores.
    ///
    /// @return a wired environment, never null
    public static NarrataEnvironment bootstrap() {
        return bootstrap(
                new NarrataConfig(), new InMemoryFlowRepository(), new InMemorySheetRepository());
    }

    /// Creates an environment over the given stores.
    ///
    /// @param config configuration, not null
    /// @param flowRepository flow store, not null
    /// @param sheetRepository sheet store seeding session variables, not null
    /// @return a wired environment, never null
    public static NarrataEnvironment bootstrap(
            NarrataConfig config, FlowRepository flowRepository, SheetRepository sheetRepository) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(flowRepository, "flowRepository must not be null");
        Objects.requireNonNull(sheetRepository, "sheetRepository must not be null");

        ReferenceResolver resolver = new ReferenceResolver();
        ConditionEvaluator conditionEvaluator = new ConditionEvaluator(resolver);
        AssignmentExecutor assignmentExecutor = new AssignmentExecutor(resolver);
        NodeExecutorRegistry registry = new DefaultNodeExecutorRegistry();
        StepEngine engine =
                new StepEngine(flowRepository, registry, conditionEvaluator, assignmentExecutor);

        return new NarrataEnvironment(
                config,
                new ExpressionParser(resolver),
                new ExpressionSerializer(),
                conditionEvaluator,
                assignmentExecutor,
                registry,
                engine,
                flowRepository,
                sheetRepository,
                new VariableCompletionSource());
    }
}
