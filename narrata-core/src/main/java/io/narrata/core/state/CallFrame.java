package io.narrata.core.state;

import java.util.Objects;

/// Caller context saved when a jump or sub-flow node enters another flow.
///
/// @param flowId calling flow, not null
/// @param flowName name of the calling flow, for breadcrumbs
/// @param returnNodeId call-site node; execution resumes at its output, not null
public record CallFrame(String flowId, String flowName, String returnNodeId) {

    public CallFrame {
        Objects.requireNonNull(flowId, "flowId must not be null");
        Objects.requireNonNull(returnNodeId, "returnNodeId must not be null");
    }
}
