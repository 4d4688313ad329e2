package io.narrata.core.flow;

import io.narrata.core.flow.node.EntryNode;
import io.narrata.core.flow.node.Node;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Nodes and connections of one flow.
///
/// Built once and immutable afterwards. The graph is not required to be
/// well formed: dangling connections and missing entries are reported by
/// {@link FlowValidator} and handled by the step engine at run time, so a
/// designer can debug a graph that is still being edited.
public final class FlowGraph {

    private final String id;
    private final String name;
    private final Map<String, Node> nodes;
    private final List<Connection> connections;

    private FlowGraph(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Flow ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.connections = List.copyOf(builder.connections);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, Node> getNodes() {
        return nodes;
    }

    public List<Connection> getConnections() {
        return connections;
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// Returns the first entry node in declaration order.
    public Optional<Node> getEntryNode() {
        return nodes.values().stream().filter(EntryNode.class::isInstance).findFirst();
    }

    /// Returns the connections leaving a node, in declaration order.
    public List<Connection> connectionsFrom(String nodeId) {
        return connections.stream().filter(c -> c.sourceNodeId().equals(nodeId)).toList();
    }

    /// Finds the connection leaving a node through a pin.
    public Optional<Connection> connectionFrom(String nodeId, String pin) {
        return connections.stream()
                .filter(c -> c.sourceNodeId().equals(nodeId) && c.sourcePin().equals(pin))
                .findFirst();
    }

    /// Builder for {@link FlowGraph}.
    ///
    /// Node ids must be unique; duplicates are rejected.
    public static final class Builder {
        private String id;
        private String name;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final List<Connection> connections = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder node(Node node) {
            Objects.requireNonNull(node, "node must not be null");
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
            return this;
        }

        public Builder nodes(Collection<? extends Node> newNodes) {
            newNodes.forEach(this::node);
            return this;
        }

        public Builder connection(Connection connection) {
            connections.add(Objects.requireNonNull(connection, "connection must not be null"));
            return this;
        }

        /// Connects a source pin to a target node's input pin.
        public Builder connect(String sourceNodeId, String sourcePin, String targetNodeId) {
            return connection(Connection.of(sourceNodeId, sourcePin, targetNodeId));
        }

        public Builder connections(Collection<Connection> newConnections) {
            newConnections.forEach(this::connection);
            return this;
        }

        public FlowGraph build() {
            return new FlowGraph(this);
        }
    }
}
