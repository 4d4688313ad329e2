package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.narrata.core.expression.AssignmentOperator;

/// Binds {@link AssignmentOperator} to its lowercase id, for example `set_if_unset`.
public abstract class AssignmentOperatorMixin {

    @JsonValue
    abstract String id();

    @JsonCreator
    static AssignmentOperator fromId(String id) {
        return AssignmentOperator.fromId(id);
    }
}
