package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.writeIfNotNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import java.io.IOException;
import java.io.Serial;
import java.util.Objects;

/// Writes a variable.
///
/// Plain variables are written as `{sheet, name, type, value}`, table cells as
/// `{sheet, table, row, column, type, value}`. `initialValue`, `previousValue`
/// and `source` are written only when they differ from a freshly loaded
/// variable, so a sheet file stays minimal.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class VariableSerializer extends StdSerializer<Variable> {

    @Serial private static final long serialVersionUID = -8410937755120236409L;

    VariableSerializer() {
        super(Variable.class);
    }

    @Override
    public void serialize(Variable variable, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("sheet", variable.getSheetShortcut());
        if (variable.isTableCell()) {
            gen.writeStringField("table", variable.getTableName());
            gen.writeStringField("row", variable.getRowName());
            gen.writeStringField("column", variable.getColumnName());
        } else {
            gen.writeStringField("name", variable.getVariableName());
        }
        gen.writeStringField("type", variable.getType().id());
        provider.defaultSerializeField("value", variable.getValue(), gen);

        if (!Objects.equals(variable.getInitialValue(), variable.getValue())) {
            provider.defaultSerializeField("initialValue", variable.getInitialValue(), gen);
        }
        if (variable.getPreviousValue() != null) {
            provider.defaultSerializeField("previousValue", variable.getPreviousValue(), gen);
        }
        if (variable.getSource() != VariableSource.INITIAL) {
            gen.writeStringField("source", variable.getSource().id());
        }
        writeIfNotNull(gen, "ownerBlockId", variable.getOwnerBlockId());
        gen.writeEndObject();
    }
}
