package io.narrata.core.sheet;

import io.narrata.core.variable.VariableStore;

/// Source of the variables a debug session starts from.
///
/// Sheets, blocks and tables are authored elsewhere; the engine only needs
/// the flattened variables of a project with their initial values.
public interface SheetRepository {

    /// Builds the initial variables of a project.
    ///
    /// Every returned variable has `source = initial` and its initial value
    /// equal to its current value.
    ///
    /// @param projectId project identifier, not null
    /// @return variables, never null (empty for an unknown project)
    VariableStore buildInitialVariables(String projectId);
}
