package io.narrata.core.execution.executor;

import io.narrata.core.flow.node.Node;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of NodeExecutorRegistry.
///
/// Registers an executor for every built-in node type. All built-in executors
/// are stateless, which makes the registry shareable between sessions.
public class DefaultNodeExecutorRegistry implements NodeExecutorRegistry {

    private final Map<Class<? extends Node>, NodeExecutor<?>> registry =
            new ConcurrentHashMap<>();

    /// Creates a registry with all built-in executors pre-registered.
    public DefaultNodeExecutorRegistry() {
        register(new EntryNodeExecutor());
        register(new ExitNodeExecutor());
        register(new DialogueNodeExecutor());
        register(new HubNodeExecutor());
        register(new ConditionNodeExecutor());
        register(new InstructionNodeExecutor());
        register(new SceneNodeExecutor());
        register(new JumpNodeExecutor());
        register(new SubflowNodeExecutor());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends Node> Optional<NodeExecutor<T>> getExecutor(Class<T> nodeType) {
        return Optional.ofNullable((NodeExecutor<T>) registry.get(nodeType));
    }

    @Override
    public <T extends Node> NodeExecutor<T> getExecutorOrThrow(Class<T> nodeType)
            throws NodeExecutorNotFound {
        return getExecutor(nodeType)
                .orElseThrow(
                        () ->
                                new NodeExecutorNotFound(
                                        "No executor registered for node type: "
                                                + nodeType.getSimpleName()));
    }

    @Override
    public <T extends Node> void register(NodeExecutor<T> executor) {
        registry.put(executor.getNodeType(), executor);
    }

    @Override
    public boolean hasExecutor(Class<? extends Node> nodeType) {
        return registry.containsKey(nodeType);
    }
}
