package io.narrata.core.evaluator;

import io.narrata.core.variable.VariableStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Result of applying assignments: the new store plus what changed.
///
/// @param variables store after the writes, not null
/// @param changes writes that happened, in order
/// @param warnings assignments that were skipped and why
public record AssignmentOutcome(
        VariableStore variables, List<VariableChange> changes, List<String> warnings) {

    public AssignmentOutcome {
        Objects.requireNonNull(variables, "variables must not be null");
        changes = changes != null ? List.copyOf(changes) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    static AssignmentOutcome unchanged(VariableStore variables) {
        return new AssignmentOutcome(variables, List.of(), List.of());
    }

    static AssignmentOutcome warning(VariableStore variables, String warning) {
        return new AssignmentOutcome(variables, List.of(), List.of(warning));
    }

    /// Appends another outcome applied on top of this one.
    AssignmentOutcome then(AssignmentOutcome next) {
        List<VariableChange> allChanges = new ArrayList<>(changes);
        allChanges.addAll(next.changes);
        List<String> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(next.warnings);
        return new AssignmentOutcome(next.variables, allChanges, allWarnings);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }
}
