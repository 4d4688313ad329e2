package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.narrata.core.expression.ConditionLogic;

/// Binds {@link ConditionLogic} to its lowercase id, for example `any`.
public abstract class ConditionLogicMixin {

    @JsonValue
    abstract String id();

    @JsonCreator
    static ConditionLogic fromId(String id) {
        return ConditionLogic.fromId(id);
    }
}
