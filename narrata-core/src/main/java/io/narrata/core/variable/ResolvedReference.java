package io.narrata.core.variable;

import java.util.Objects;

/// A dotted reference split into sheet and variable, with the matching variable.
///
/// @param sheet sheet shortcut part of the reference, not null
/// @param variableName variable part of the reference, not null
/// @param variable the variable the reference points to, not null
public record ResolvedReference(String sheet, String variableName, Variable variable) {

    public ResolvedReference {
        Objects.requireNonNull(sheet, "sheet must not be null");
        Objects.requireNonNull(variableName, "variableName must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
    }

    public String key() {
        return variable.getKey();
    }
}
