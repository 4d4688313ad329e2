package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/// Writes {@link io.narrata.core.state.ExecutionStatus} by its lowercase id.
public abstract class ExecutionStatusMixin {

    @JsonValue
    abstract String id();
}
