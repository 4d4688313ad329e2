package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.narrata.core.expression.ValueType;

/// Binds {@link ValueType} to its lowercase id, for example `variable_ref`.
public abstract class ValueTypeMixin {

    @JsonValue
    abstract String id();

    @JsonCreator
    static ValueType fromId(String id) {
        return ValueType.fromId(id);
    }
}
