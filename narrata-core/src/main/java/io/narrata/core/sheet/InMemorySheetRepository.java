package io.narrata.core.sheet;

import io.narrata.core.variable.VariableStore;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory sheet repository holding one variable store per project.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemorySheetRepository implements SheetRepository {

    private final Map<String, VariableStore> projects = new ConcurrentHashMap<>();

    /// Registers the variables of a project, replacing earlier ones.
    ///
    /// Stored variables are reset to their initial values.
    public void save(String projectId, VariableStore variables) {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        projects.put(projectId, variables.reset());
    }

    @Override
    public VariableStore buildInitialVariables(String projectId) {
        Objects.requireNonNull(projectId, "projectId must not be null");
        return projects.getOrDefault(projectId, VariableStore.empty());
    }
}
