package io.narrata.core.execution.executor;

import io.narrata.core.flow.node.Node;
import java.util.Optional;

/// Registry for node executors: the central node class to handler dispatch table.
///
/// ### Example usage
/// {@snippet :
/// NodeExecutor<HubNode> executor = registry.getExecutorOrThrow(HubNode.class);
/// registry.register(new MyHubNodeExecutor());
/// }
public interface NodeExecutorRegistry {

    /// Get executor for the given node type.
    ///
    /// @param nodeType the node class
    /// @param <T> the node type
    /// @return Optional containing the executor if found
    <T extends Node> Optional<NodeExecutor<T>> getExecutor(Class<T> nodeType);

    /// Get executor for the given node type, throwing if not found.
    ///
    /// @throws NodeExecutorNotFound if no executor is registered
    <T extends Node> NodeExecutor<T> getExecutorOrThrow(Class<T> nodeType)
            throws NodeExecutorNotFound;

    /// Get executor for the given node instance.
    ///
    /// @param node the node instance
    /// @param <T> the node type
    /// @return the executor
    /// @throws NodeExecutorNotFound if no executor is registered
    @SuppressWarnings("unchecked")
    default <T extends Node> NodeExecutor<T> getExecutorFor(T node) throws NodeExecutorNotFound {
        return (NodeExecutor<T>) getExecutorOrThrow(node.getClass());
    }

    /// Register a node executor under {@link NodeExecutor#getNodeType()},
    /// replacing any executor registered for that type.
    <T extends Node> void register(NodeExecutor<T> executor);

    boolean hasExecutor(Class<? extends Node> nodeType);
}
