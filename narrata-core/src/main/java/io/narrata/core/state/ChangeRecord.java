package io.narrata.core.state;

import io.narrata.core.variable.VariableSource;
import java.util.Objects;

/// Provenance entry appended whenever a variable's value changes.
///
/// @param ts milliseconds since the session started
/// @param nodeId node that caused the change, or null for user overrides
/// @param nodeLabel label of that node, or null
/// @param variableRef key of the changed variable, not null
/// @param oldValue value before the change, may be null
/// @param newValue value after the change, may be null
/// @param source why the value changed, not null
/// @param operator assignment operator id, or `user_override`
public record ChangeRecord(
        long ts,
        String nodeId,
        String nodeLabel,
        String variableRef,
        Object oldValue,
        Object newValue,
        VariableSource source,
        String operator) {

    public ChangeRecord {
        Objects.requireNonNull(variableRef, "variableRef must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
