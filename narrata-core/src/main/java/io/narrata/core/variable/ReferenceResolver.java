package io.narrata.core.variable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Resolves dotted references against a {@link VariableStore}.
///
/// Sheet shortcuts may themselves contain dots (`mc.jaime`), and table cells
/// add three trailing segments (`table.row.column`). A reference is therefore
/// split at every possible position, trying the longest sheet first and
/// backing off one segment at a time until a declared variable matches:
///
/// ```
/// mc.jaime.attributes.strength.value
///   sheet=mc.jaime.attributes.strength  variable=value
///   sheet=mc.jaime.attributes           variable=strength.value
///   sheet=mc.jaime                      variable=attributes.strength.value  <- match
/// ```
///
/// Stateless and thread safe.
public final class ReferenceResolver {

    /// Resolves a full dotted reference.
    ///
    /// @param reference reference such as `mc.jaime.health`, not null
    /// @param variables store to resolve against, not null
    /// @return the first split, longest sheet first, naming a declared variable
    public Optional<ResolvedReference> resolve(String reference, VariableStore variables) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        List<String> segments = List.of(reference.split("\\.", -1));
        for (int split = segments.size() - 1; split >= 1; split--) {
            String sheet = String.join(".", segments.subList(0, split));
            String name = String.join(".", segments.subList(split, segments.size()));
            Optional<Variable> match = variables.find(sheet, name);
            if (match.isPresent()) {
                return Optional.of(new ResolvedReference(sheet, name, match.get()));
            }
        }
        return Optional.empty();
    }

    /// Resolves a reference that was already split into sheet and variable.
    ///
    /// The exact split is tried first. When it does not match, the joined
    /// reference is resolved as a whole, so a rule parsed without knowledge of
    /// the declared variables still finds a table cell.
    ///
    /// @param sheet sheet part, not null
    /// @param variableName variable part, not null
    /// @param variables store to resolve against, not null
    /// @return the resolved reference, or empty if nothing matches
    public Optional<ResolvedReference> resolve(
            String sheet, String variableName, VariableStore variables) {
        Objects.requireNonNull(sheet, "sheet must not be null");
        Objects.requireNonNull(variableName, "variableName must not be null");
        Optional<Variable> exact = variables.find(sheet, variableName);
        if (exact.isPresent()) {
            return Optional.of(new ResolvedReference(sheet, variableName, exact.get()));
        }
        return resolve(sheet + "." + variableName, variables);
    }

    /// Splits a reference without a store: the last segment is the variable.
    ///
    /// @param segments dot segments of the reference, at least two
    /// @return `[sheet, variable]`
    public static String[] splitLast(List<String> segments) {
        if (segments.size() < 2) {
            throw new IllegalArgumentException("Reference needs at least two segments");
        }
        String sheet = String.join(".", segments.subList(0, segments.size() - 1));
        return new String[] {sheet, segments.get(segments.size() - 1)};
    }
}
