package io.narrata.core.state;

import io.narrata.core.evaluator.RuleResult;
import java.util.List;
import java.util.Objects;

/// A line in the debug console.
///
/// @param ts milliseconds since the session started
/// @param level severity, not null
/// @param nodeId node the entry is about, or null for session-level entries
/// @param nodeLabel plain-text label of that node, or null
/// @param message text shown to the designer, not null
/// @param ruleDetails per-rule explanation of a condition evaluation, never null
public record ConsoleEntry(
        long ts,
        ConsoleLevel level,
        String nodeId,
        String nodeLabel,
        String message,
        List<RuleResult> ruleDetails) {

    public ConsoleEntry {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(message, "message must not be null");
        ruleDetails = ruleDetails != null ? List.copyOf(ruleDetails) : List.of();
    }

    public boolean hasRuleDetails() {
        return !ruleDetails.isEmpty();
    }
}
