package io.narrata.core.variable;

import java.util.Collection;
import java.util.Locale;

/// Declared type of a project variable.
///
/// The type drives comparison semantics in conditions, coercion of assignment
/// operands and the notion of an "unset" value used by `?=`.
///
/// | Type | Default |
/// |------|---------|
/// | `number` | `0` |
/// | `boolean` | `false` |
/// | `text`, `rich_text` | `""` |
/// | `date`, `select`, `multi_select` | `null` |
public enum VariableType {
    NUMBER("number"),
    TEXT("text"),
    RICH_TEXT("rich_text"),
    BOOLEAN("boolean"),
    DATE("date"),
    SELECT("select"),
    MULTI_SELECT("multi_select");

    private final String id;

    VariableType(String id) {
        this.id = id;
    }

    /// Returns the lowercase identifier used in flow and variable files.
    public String id() {
        return id;
    }

    /// Looks up a type by identifier, ignoring case.
    ///
    /// @param id type identifier such as `number` or `multi_select`, not null
    /// @return matching type, never null
    /// @throws IllegalArgumentException if the identifier is unknown
    public static VariableType fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (VariableType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable type: " + id);
    }

    /// Returns the value a freshly declared variable of this type holds.
    public Object defaultValue() {
        return switch (this) {
            case NUMBER -> 0L;
            case BOOLEAN -> Boolean.FALSE;
            case TEXT, RICH_TEXT -> "";
            case DATE, SELECT, MULTI_SELECT -> null;
        };
    }

    /// Checks whether a value counts as unset for this type.
    ///
    /// `null` is always unset, as is the type default and, for multi select,
    /// an empty selection.
    ///
    /// @param value current variable value, may be null
    /// @return true if a `set_if_unset` assignment may overwrite the value
    public boolean isUnset(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case NUMBER -> Values.toNumber(value).map(n -> n.signum() == 0).orElse(false);
            case BOOLEAN -> Boolean.FALSE.equals(value);
            case TEXT, RICH_TEXT, SELECT -> value instanceof String s && s.isEmpty();
            case MULTI_SELECT -> value instanceof Collection<?> c && c.isEmpty();
            case DATE -> false;
        };
    }
}
