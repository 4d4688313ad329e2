package io.narrata.core.state;

import io.narrata.core.evaluator.RuleResult;
import java.util.List;
import java.util.Objects;

/// A dialogue response offered while the session waits for input.
///
/// @param responseId response identifier, not null
/// @param text response text, may be null
/// @param valid whether the response condition passed; invalid ones are shown greyed
/// @param ruleDetails evaluation of the response condition, never null
public record PendingChoice(
        String responseId, String text, boolean valid, List<RuleResult> ruleDetails) {

    public PendingChoice {
        Objects.requireNonNull(responseId, "responseId must not be null");
        ruleDetails = ruleDetails != null ? List.copyOf(ruleDetails) : List.of();
    }
}
