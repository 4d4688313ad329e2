package io.narrata.core.variable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Immutable view of every project variable, keyed by composite reference.
///
/// Writes return a new store and leave the receiver untouched, so a store
/// can be kept in a snapshot as is and restored by substitution.
///
/// Iteration follows declaration order.
public final class VariableStore {

    private static final Logger logger = Logger.getLogger(VariableStore.class.getName());
    private static final VariableStore EMPTY = new VariableStore(Map.of());

    private final Map<String, Variable> variables;

    private VariableStore(Map<String, Variable> variables) {
        this.variables = variables;
    }

    public static VariableStore empty() {
        return EMPTY;
    }

    /// Creates a store from variable definitions.
    ///
    /// Definitions sharing a key are resolved in favour of the one with the
    /// longest sheet shortcut, matching reference resolution order.
    ///
    /// @param definitions variables in declaration order, not null
    /// @return new store, never null
    public static VariableStore of(Collection<Variable> definitions) {
        Objects.requireNonNull(definitions, "definitions must not be null");
        Map<String, Variable> map = new LinkedHashMap<>();
        for (Variable variable : definitions) {
            Variable existing = map.get(variable.getKey());
            if (existing != null) {
                logger.warning("Duplicate variable key: " + variable.getKey());
                if (existing.getSheetShortcut().length()
                        >= variable.getSheetShortcut().length()) {
                    continue;
                }
            }
            map.put(variable.getKey(), variable);
        }
        return new VariableStore(Collections.unmodifiableMap(map));
    }

    public static VariableStore of(Variable... definitions) {
        return of(List.of(definitions));
    }

    public Optional<Variable> get(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    /// Finds the variable declared on an exact sheet under an exact name.
    ///
    /// @param sheet sheet shortcut, not null
    /// @param variableName variable name, `table.row.column` for cells, not null
    /// @return the variable, or empty if no definition matches both parts
    public Optional<Variable> find(String sheet, String variableName) {
        Variable variable = variables.get(sheet + "." + variableName);
        if (variable != null
                && variable.getSheetShortcut().equals(sheet)
                && variable.getVariableName().equals(variableName)) {
            return Optional.of(variable);
        }
        return Optional.empty();
    }

    public boolean contains(String key) {
        return variables.containsKey(key);
    }

    /// Returns a store with the variable added or replaced under its key.
    public VariableStore with(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        Map<String, Variable> copy = new LinkedHashMap<>(variables);
        copy.put(variable.getKey(), variable);
        return new VariableStore(Collections.unmodifiableMap(copy));
    }

    /// Returns a store with every variable restored to its initial value.
    public VariableStore reset() {
        Map<String, Variable> copy = new LinkedHashMap<>();
        variables.forEach((key, variable) -> copy.put(key, variable.reset()));
        return new VariableStore(Collections.unmodifiableMap(copy));
    }

    public Collection<Variable> values() {
        return variables.values();
    }

    public Set<String> keys() {
        return variables.keySet();
    }

    /// Returns an unmodifiable key to variable map.
    public Map<String, Variable> asMap() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableStore other)) return false;
        return variables.equals(other.variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "VariableStore" + variables.values();
    }
}
