package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.narrata.core.variable.VariableSource;

/// Binds {@link VariableSource} to its lowercase id, for example `user_override`.
public abstract class VariableSourceMixin {

    @JsonValue
    abstract String id();

    @JsonCreator
    static VariableSource fromId(String id) {
        return VariableSource.fromId(id);
    }
}
