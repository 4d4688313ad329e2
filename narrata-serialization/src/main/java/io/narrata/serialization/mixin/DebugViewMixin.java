package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.narrata.core.state.ConsoleEntry;

/// Mixin for {@link io.narrata.core.debug.DebugView}.
///
/// Keeps the record components and hides the derived accessors, which repeat
/// information already present in `status` and `console`.
@JsonPropertyOrder({"sessionId", "status", "stepCount", "maxSteps", "currentFlowId", "currentNodeId"})
public abstract class DebugViewMixin {

    @JsonIgnore
    abstract boolean isFinished();

    @JsonIgnore
    abstract boolean isWaitingForInput();

    @JsonIgnore
    abstract ConsoleEntry lastConsoleEntry();
}
