package io.narrata.core.execution.executor;

import io.narrata.core.flow.node.Node;

/// Strategy interface for executing flow nodes.
///
/// Each node type has a corresponding executor that decides what a visit to
/// the node does and where execution goes next. Executors are stateless; all
/// session state is reached through the {@link StepContext}.
///
/// ### Example implementation
/// {@snippet :
/// public class SceneNodeExecutor implements NodeExecutor<SceneNode> {
///     public Class<SceneNode> getNodeType() {
///         return SceneNode.class;
///     }
///
///     public Transition execute(SceneNode node, StepContext context) {
///         context.info(node, "Scene: " + node.getLabel());
///         return context.followOutput(node);
///     }
/// }
/// }
///
/// @param <T> the node type this executor handles
public interface NodeExecutor<T extends Node> {

    /// Returns the node type this executor handles. Used for registry lookups.
    Class<T> getNodeType();

    /// Executes one visit to the node.
    ///
    /// Executors log at least one console entry and never throw for bad graph
    /// data: a missing pin or target becomes an error entry and a
    /// {@link Transition.Stall}.
    ///
    /// @param node the node to execute, not null
    /// @param context the step context, not null
    /// @return where execution goes next, never null
    Transition execute(T node, StepContext context);
}
