package io.narrata.core.evaluator;

import io.narrata.core.expression.Rule;
import java.util.List;

/// Outcome of a switch-mode condition evaluation.
///
/// @param matchedRule first rule that held, or null when none did
/// @param matchedIndex position of the matched rule, or -1
/// @param details entries for every rule evaluated up to and including the match
public record SwitchResult(Rule matchedRule, int matchedIndex, List<RuleResult> details) {

    public SwitchResult {
        details = details != null ? List.copyOf(details) : List.of();
    }

    public boolean matched() {
        return matchedRule != null;
    }
}
