package io.narrata.core.evaluator;

import java.util.List;

/// Outcome of a boolean-mode condition evaluation.
///
/// @param passed combined result under the condition's logic
/// @param details one entry per complete rule, in rule order
public record ConditionResult(boolean passed, List<RuleResult> details) {

    public ConditionResult {
        details = details != null ? List.copyOf(details) : List.of();
    }

    public long passedCount() {
        return details.stream().filter(RuleResult::passed).count();
    }

    /// Returns true when some rule referenced a variable that does not exist.
    public boolean hasUnresolved() {
        return details.stream().anyMatch(detail -> !detail.resolved());
    }
}
