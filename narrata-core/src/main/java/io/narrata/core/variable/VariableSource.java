package io.narrata.core.variable;

import java.util.Locale;

/// Provenance of a variable's current value.
public enum VariableSource {
    /// Seeded from the sheet when the session started.
    INITIAL("initial"),
    /// Written by an assignment in an instruction, dialogue or response.
    INSTRUCTION("instruction"),
    /// Set directly by the user from the debugger.
    USER_OVERRIDE("user_override");

    private final String id;

    VariableSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static VariableSource fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (VariableSource source : values()) {
            if (source.id.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown variable source: " + id);
    }
}
