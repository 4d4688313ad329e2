package io.narrata.core.expression;

import java.util.List;
import java.util.Objects;

/// A list of rules combined with a single logic level.
///
/// A condition without rules is vacuously true under either logic.
///
/// @param logic how rules combine in boolean mode, not null
/// @param rules rules in authoring order, never null
public record Condition(ConditionLogic logic, List<Rule> rules) {

    private static final Condition EMPTY = new Condition(ConditionLogic.ALL, List.of());

    public Condition {
        logic = logic != null ? logic : ConditionLogic.ALL;
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public static Condition empty() {
        return EMPTY;
    }

    public static Condition all(Rule... rules) {
        return new Condition(ConditionLogic.ALL, List.of(rules));
    }

    public static Condition any(Rule... rules) {
        return new Condition(ConditionLogic.ANY, List.of(rules));
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /// Returns the rule with the given id.
    ///
    /// @throws IllegalArgumentException if no rule has the id
    public Rule rule(String ruleId) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        return rules.stream()
                .filter(rule -> rule.id().equals(ruleId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No rule with id " + ruleId));
    }
}
