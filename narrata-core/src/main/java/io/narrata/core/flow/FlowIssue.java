package io.narrata.core.flow;

import java.util.Objects;

/// A problem found in a flow graph.
///
/// @param severity how serious the problem is, not null
/// @param nodeId node the problem is attached to, or null for graph-level problems
/// @param message description, not null
public record FlowIssue(Severity severity, String nodeId, String message) {

    public enum Severity {
        /// The session will stall or fail to start on this graph.
        ERROR,
        /// Suspicious but executable.
        WARNING
    }

    public FlowIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
