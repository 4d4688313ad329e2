package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.narrata.core.expression.RuleOperator;

/// Binds {@link RuleOperator} to its lowercase id, for example `greater_than`.
public abstract class RuleOperatorMixin {

    @JsonValue
    abstract String id();

    @JsonCreator
    static RuleOperator fromId(String id) {
        return RuleOperator.fromId(id);
    }
}
