package io.narrata.core.expression;

import java.util.Locale;

/// How the right-hand value of a rule or assignment is interpreted.
public enum ValueType {
    /// The value is used as written.
    LITERAL("literal"),
    /// The value names another variable whose current value is used.
    VARIABLE_REF("variable_ref");

    private final String id;

    ValueType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ValueType fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ValueType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + id);
    }
}
