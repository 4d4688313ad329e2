package io.narrata.core.variable;

import java.util.Objects;

/// A single project variable as seen by a debug session.
///
/// Variables are immutable. A mutation produces a new instance through
/// {@link #withValue(Object, VariableSource)}, which moves the current value
/// into {@link #getPreviousValue()} and keeps {@link #getInitialValue()}
/// untouched for the whole session.
///
/// The key is `sheetShortcut.variableName`. Table cells use the compound
/// variable name `table.row.column`, giving keys such as
/// `mc.jaime.attributes.strength.value`.
///
/// @see VariableStore for the flat key to variable map
public final class Variable {

    private final String sheetShortcut;
    private final String variableName;
    private final String key;
    private final VariableType type;
    private final Object value;
    private final Object initialValue;
    private final Object previousValue;
    private final VariableSource source;
    private final String ownerBlockId;
    private final String tableName;
    private final String rowName;
    private final String columnName;

    private Variable(Builder builder) {
        this.sheetShortcut =
                Objects.requireNonNull(builder.sheetShortcut, "sheetShortcut must not be null");
        this.variableName =
                Objects.requireNonNull(builder.variableName, "variableName must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.key = sheetShortcut + "." + variableName;
        this.value = Values.normalize(builder.value);
        this.initialValue =
                builder.initialValueSet ? Values.normalize(builder.initialValue) : this.value;
        this.previousValue = Values.normalize(builder.previousValue);
        this.source = builder.source != null ? builder.source : VariableSource.INITIAL;
        this.ownerBlockId = builder.ownerBlockId;
        this.tableName = builder.tableName;
        this.rowName = builder.rowName;
        this.columnName = builder.columnName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getKey() {
        return key;
    }

    public String getSheetShortcut() {
        return sheetShortcut;
    }

    public String getVariableName() {
        return variableName;
    }

    public VariableType getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public Object getInitialValue() {
        return initialValue;
    }

    public Object getPreviousValue() {
        return previousValue;
    }

    public VariableSource getSource() {
        return source;
    }

    public String getOwnerBlockId() {
        return ownerBlockId;
    }

    /// Returns the table name for table cells, or null for plain variables.
    public String getTableName() {
        return tableName;
    }

    public String getRowName() {
        return rowName;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isTableCell() {
        return tableName != null;
    }

    /// Returns a copy holding a new value.
    ///
    /// @param newValue the value to store, may be null
    /// @param newSource provenance of the write, not null
    /// @return new variable with the old value moved to `previousValue`
    public Variable withValue(Object newValue, VariableSource newSource) {
        Objects.requireNonNull(newSource, "newSource must not be null");
        return toBuilder().value(newValue).previousValue(value).source(newSource).build();
    }

    /// Returns a copy restored to its initial value with `initial` provenance.
    public Variable reset() {
        return toBuilder().value(initialValue).previousValue(null).source(VariableSource.INITIAL)
                .build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.sheetShortcut = sheetShortcut;
        builder.variableName = variableName;
        builder.type = type;
        builder.value = value;
        builder.initialValue = initialValue;
        builder.initialValueSet = true;
        builder.previousValue = previousValue;
        builder.source = source;
        builder.ownerBlockId = ownerBlockId;
        builder.tableName = tableName;
        builder.rowName = rowName;
        builder.columnName = columnName;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable other)) return false;
        return key.equals(other.key)
                && sheetShortcut.equals(other.sheetShortcut)
                && type == other.type
                && Objects.equals(value, other.value)
                && Objects.equals(initialValue, other.initialValue)
                && Objects.equals(previousValue, other.previousValue)
                && source == other.source
                && Objects.equals(ownerBlockId, other.ownerBlockId)
                && Objects.equals(tableName, other.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, type, value, source);
    }

    @Override
    public String toString() {
        return "Variable{"
                + key
                + " ("
                + type.id()
                + ") = "
                + Values.display(value)
                + ", source="
                + source.id()
                + '}';
    }

    public static final class Builder {
        private String sheetShortcut;
        private String variableName;
        private VariableType type;
        private Object value;
        private Object initialValue;
        private boolean initialValueSet;
        private Object previousValue;
        private VariableSource source;
        private String ownerBlockId;
        private String tableName;
        private String rowName;
        private String columnName;

        private Builder() {}

        public Builder sheetShortcut(String sheetShortcut) {
            this.sheetShortcut = sheetShortcut;
            return this;
        }

        public Builder variableName(String variableName) {
            this.variableName = variableName;
            return this;
        }

        /// Declares a table cell; the variable name becomes `table.row.column`.
        public Builder tableCell(String table, String row, String column) {
            this.tableName = Objects.requireNonNull(table, "table must not be null");
            this.rowName = Objects.requireNonNull(row, "row must not be null");
            this.columnName = Objects.requireNonNull(column, "column must not be null");
            this.variableName = table + "." + row + "." + column;
            return this;
        }

        public Builder type(VariableType type) {
            this.type = type;
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        /// Sets the initial value explicitly. Defaults to the first value.
        public Builder initialValue(Object initialValue) {
            this.initialValue = initialValue;
            this.initialValueSet = true;
            return this;
        }

        public Builder previousValue(Object previousValue) {
            this.previousValue = previousValue;
            return this;
        }

        public Builder source(VariableSource source) {
            this.source = source;
            return this;
        }

        public Builder ownerBlockId(String ownerBlockId) {
            this.ownerBlockId = ownerBlockId;
            return this;
        }

        public Variable build() {
            return new Variable(this);
        }
    }
}
