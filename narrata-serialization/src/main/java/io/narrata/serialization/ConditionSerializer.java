package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.expression.Condition;
import io.narrata.core.expression.Rule;
import java.io.IOException;
import java.io.Serial;

/// Writes a condition in structured form: `{"logic": "all", "rules": [...]}`.
///
/// The structured form keeps rule ids and case labels, which switch-mode
/// connections refer to; expression text would lose both.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class ConditionSerializer extends StdSerializer<Condition> {

    @Serial private static final long serialVersionUID = -1660214402290360311L;

    ConditionSerializer() {
        super(Condition.class);
    }

    @Override
    public void serialize(Condition condition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("logic", condition.logic().id());
        gen.writeArrayFieldStart("rules");
        for (Rule rule : condition.rules()) {
            provider.defaultSerializeValue(rule, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
