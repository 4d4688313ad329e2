package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.writeIfNotNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.ValueType;
import java.io.IOException;
import java.io.Serial;

/// Writes a rule as `{id, sheet, variable, operator, value, valueType, valueSheet, label}`.
///
/// `valueType` and `valueSheet` are written only for variable references.
/// Source spans are editor state and are not written.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class RuleSerializer extends StdSerializer<Rule> {

    @Serial private static final long serialVersionUID = 2748115903871276564L;

    RuleSerializer() {
        super(Rule.class);
    }

    @Override
    public void serialize(Rule rule, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", rule.id());
        writeIfNotNull(gen, "sheet", rule.sheet());
        writeIfNotNull(gen, "variable", rule.variable());
        gen.writeStringField("operator", rule.operator().id());
        writeIfNotNull(gen, "value", rule.value());
        if (rule.valueType() == ValueType.VARIABLE_REF) {
            gen.writeStringField("valueType", rule.valueType().id());
            writeIfNotNull(gen, "valueSheet", rule.valueSheet());
        }
        writeIfNotNull(gen, "label", rule.label());
        gen.writeEndObject();
    }
}
