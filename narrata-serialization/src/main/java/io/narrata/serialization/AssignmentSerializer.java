package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.writeIfNotNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.ValueType;
import java.io.IOException;
import java.io.Serial;

/// Writes an assignment as `{id, sheet, variable, operator, value, valueType, valueSheet}`.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class AssignmentSerializer extends StdSerializer<Assignment> {

    @Serial private static final long serialVersionUID = 8815470125609331283L;

    AssignmentSerializer() {
        super(Assignment.class);
    }

    @Override
    public void serialize(Assignment assignment, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", assignment.id());
        writeIfNotNull(gen, "sheet", assignment.sheet());
        writeIfNotNull(gen, "variable", assignment.variable());
        gen.writeStringField("operator", assignment.operator().id());
        writeIfNotNull(gen, "value", assignment.value());
        if (assignment.valueType() == ValueType.VARIABLE_REF) {
            gen.writeStringField("valueType", assignment.valueType().id());
            writeIfNotNull(gen, "valueSheet", assignment.valueSheet());
        }
        gen.writeEndObject();
    }
}
