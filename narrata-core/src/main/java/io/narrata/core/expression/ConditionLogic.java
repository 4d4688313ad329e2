package io.narrata.core.expression;

import java.util.Locale;

/// How the rules of a boolean-mode {@link Condition} combine.
public enum ConditionLogic {
    /// Every rule must pass (`&&`).
    ALL("all"),
    /// At least one rule must pass (`||`).
    ANY("any");

    private final String id;

    ConditionLogic(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ConditionLogic fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ConditionLogic logic : values()) {
            if (logic.id.equals(normalized)) {
                return logic;
            }
        }
        throw new IllegalArgumentException("Unknown condition logic: " + id);
    }
}
