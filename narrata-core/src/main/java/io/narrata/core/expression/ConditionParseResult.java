package io.narrata.core.expression;

import java.util.List;

/// Outcome of parsing condition text.
///
/// When {@link #errors()} is not empty the condition is partial and must not
/// be applied.
public record ConditionParseResult(Condition condition, List<ParseError> errors) {

    public ConditionParseResult {
        condition = condition != null ? condition : Condition.empty();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
