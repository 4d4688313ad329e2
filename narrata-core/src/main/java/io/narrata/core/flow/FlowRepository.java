package io.narrata.core.flow;

import io.narrata.core.flow.node.Node;
import java.util.List;
import java.util.Optional;

/// Source of flow graphs for debug sessions.
///
/// Flow persistence lives outside the engine; this interface is the whole of
/// what the engine needs from it.
///
/// @see InMemoryFlowRepository for the in-memory implementation
public interface FlowRepository {

    /// Loads a flow graph.
    ///
    /// @param flowId flow identifier, not null
    /// @return the graph, or empty if no flow has the id
    Optional<FlowGraph> getFlowGraph(String flowId);

    /// Loads a single node of a flow.
    ///
    /// Used to resolve the explicit target of jump and sub-flow nodes.
    ///
    /// @param flowId flow identifier, not null
    /// @param nodeId node identifier within the flow, not null
    /// @return the node, or empty if either the flow or the node is unknown
    default Optional<Node> getNodeByTechnicalId(String flowId, String nodeId) {
        return getFlowGraph(flowId).flatMap(graph -> graph.getNode(nodeId));
    }

    /// Stores a flow graph, replacing any graph with the same id.
    ///
    /// @param graph graph to store, not null
    void save(FlowGraph graph);

    /// Lists all stored flows.
    ///
    /// @return flows, never null (may be empty)
    List<FlowGraph> findAll();
}
