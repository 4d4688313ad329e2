package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.narrata.core.variable.VariableType;

/// Binds {@link VariableType} to its lowercase id, for example `multi_select`.
public abstract class VariableTypeMixin {

    @JsonValue
    abstract String id();

    @JsonCreator
    static VariableType fromId(String id) {
        return VariableType.fromId(id);
    }
}
