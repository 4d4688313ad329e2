package io.narrata.core.flow.node;

import java.util.Locale;

public enum NodeType {
    ENTRY,
    EXIT,
    DIALOGUE,
    HUB,
    CONDITION,
    INSTRUCTION,
    JUMP,
    SCENE,
    SUBFLOW;

    /// Returns the lowercase identifier used in flow files.
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeType fromId(String id) {
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node type: " + id, e);
        }
    }
}
