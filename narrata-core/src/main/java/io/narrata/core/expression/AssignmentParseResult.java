package io.narrata.core.expression;

import java.util.List;

/// Outcome of parsing instruction text.
///
/// When {@link #errors()} is not empty the statements that did parse are
/// still reported for highlighting, but they must not be applied.
public record AssignmentParseResult(List<Assignment> assignments, List<ParseError> errors) {

    public AssignmentParseResult {
        assignments = assignments != null ? List.copyOf(assignments) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
