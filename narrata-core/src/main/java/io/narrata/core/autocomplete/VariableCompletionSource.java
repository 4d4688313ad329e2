package io.narrata.core.autocomplete;

import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/// Ranked completions for partially typed variable references.
///
/// The namespace level follows the text typed so far:
///
/// ```
/// ""                    -> sheets
/// "mc.jaime."           -> variables and tables of sheet mc.jaime
/// "inv.items."          -> rows of table items
/// "inv.items.sword."    -> columns of row sword
/// ```
///
/// Prefix matches rank before substring matches; ties are alphabetical.
/// Matching ignores case.
public final class VariableCompletionSource {

    public List<Completion> complete(String prefix, VariableStore variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        return complete(prefix, variables.values());
    }

    /// Returns completions for a partial reference.
    ///
    /// @param prefix text typed so far, null treated as empty
    /// @param variables candidate variables, not null
    /// @return ranked completions, empty when nothing matches
    public List<Completion> complete(String prefix, Collection<Variable> variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        String text = prefix != null ? prefix.trim() : "";

        List<Ranked> ranked = new ArrayList<>();
        TreeSet<String> sheets = new TreeSet<>();
        variables.forEach(variable -> sheets.add(variable.getSheetShortcut()));

        Optional<String> sheet = enclosingSheet(text, sheets);
        for (String candidate : sheets) {
            if (sheet.isPresent() && !candidate.startsWith(text)) {
                continue;
            }
            rank(candidate, text).ifPresent(r -> ranked.add(
                    new Ranked(new Completion(candidate, candidate + ".", Completion.Kind.SHEET, null), r)));
        }
        sheet.ifPresent(s -> completeInSheet(s, text.substring(s.length() + 1), variables, ranked));

        ranked.sort(Comparator.comparingInt(Ranked::rank)
                .thenComparing(r -> r.completion().label())
                .thenComparing(r -> r.completion().apply()));
        return ranked.stream().map(Ranked::completion).toList();
    }

    private void completeInSheet(
            String sheet, String rest, Collection<Variable> variables, List<Ranked> ranked) {
        String[] parts = rest.split("\\.", -1);
        Map<String, Completion> candidates = new LinkedHashMap<>();
        for (Variable variable : variables) {
            if (!variable.getSheetShortcut().equals(sheet)) {
                continue;
            }
            if (!variable.isTableCell()) {
                if (parts.length == 1) {
                    candidates.putIfAbsent(
                            "v:" + variable.getVariableName(),
                            new Completion(
                                    variable.getVariableName(),
                                    variable.getKey(),
                                    Completion.Kind.VARIABLE,
                                    detail(variable)));
                }
                continue;
            }
            String table = variable.getTableName();
            String row = variable.getRowName();
            String column = variable.getColumnName();
            switch (parts.length) {
                case 1 -> candidates.putIfAbsent(
                        "t:" + table,
                        new Completion(table, sheet + "." + table + ".", Completion.Kind.TABLE, null));
                case 2 -> {
                    if (table.equals(parts[0])) {
                        candidates.putIfAbsent(
                                "r:" + row,
                                new Completion(
                                        row, sheet + "." + table + "." + row + ".",
                                        Completion.Kind.ROW, null));
                    }
                }
                case 3 -> {
                    if (table.equals(parts[0]) && row.equals(parts[1])) {
                        candidates.putIfAbsent(
                                "c:" + column,
                                new Completion(
                                        column, variable.getKey(), Completion.Kind.COLUMN,
                                        detail(variable)));
                    }
                }
                default -> {
                    // deeper than a table cell: nothing to offer
                }
            }
        }
        String typed = parts[parts.length - 1];
        for (Completion completion : candidates.values()) {
            rank(completion.label(), typed).ifPresent(r -> ranked.add(new Ranked(completion, r)));
        }
    }

    /// Finds the longest sheet that the text continues with a dot.
    private static Optional<String> enclosingSheet(String text, Collection<String> sheets) {
        String best = null;
        for (String sheet : sheets) {
            if (text.startsWith(sheet + ".") && (best == null || sheet.length() > best.length())) {
                best = sheet;
            }
        }
        return Optional.ofNullable(best);
    }

    private static Optional<Integer> rank(String candidate, String typed) {
        String c = candidate.toLowerCase(Locale.ROOT);
        String t = typed.toLowerCase(Locale.ROOT);
        if (c.startsWith(t)) {
            return Optional.of(0);
        }
        if (c.contains(t)) {
            return Optional.of(1);
        }
        return Optional.empty();
    }

    private static String detail(Variable variable) {
        return "(" + variable.getType().id() + ")";
    }

    private record Ranked(Completion completion, int rank) {}
}
