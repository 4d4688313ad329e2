package io.narrata.core.state;

import java.util.Objects;

/// One visited node in the execution trace.
///
/// @param nodeId visited node, not null
/// @param flowId flow the node belongs to, not null
/// @param nodeLabel label of the node at visit time, may be null
/// @param depth call-stack depth at visit time, 0 for the starting flow
public record ExecutionLogEntry(String nodeId, String flowId, String nodeLabel, int depth) {

    public ExecutionLogEntry {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(flowId, "flowId must not be null");
    }
}
