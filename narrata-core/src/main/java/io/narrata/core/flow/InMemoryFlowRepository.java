package io.narrata.core.flow;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory flow repository.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryFlowRepository implements FlowRepository {

    private final Map<String, FlowGraph> storage = new ConcurrentHashMap<>();

    public InMemoryFlowRepository(FlowGraph... graphs) {
        for (FlowGraph graph : graphs) {
            save(graph);
        }
    }

    @Override
    public Optional<FlowGraph> getFlowGraph(String flowId) {
        Objects.requireNonNull(flowId, "flowId must not be null");
        return Optional.ofNullable(storage.get(flowId));
    }

    @Override
    public void save(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        storage.put(graph.getId(), graph);
    }

    @Override
    public List<FlowGraph> findAll() {
        return List.copyOf(storage.values());
    }
}
