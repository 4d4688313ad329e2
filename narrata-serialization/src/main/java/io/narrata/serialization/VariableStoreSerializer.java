package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableStore;
import java.io.IOException;
import java.io.Serial;

/// Writes a variable store as an array of variables in key order.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class VariableStoreSerializer extends StdSerializer<VariableStore> {

    @Serial private static final long serialVersionUID = 3071522946370848215L;

    VariableStoreSerializer() {
        super(VariableStore.class);
    }

    @Override
    public void serialize(VariableStore store, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (Variable variable : store.values()) {
            provider.defaultSerializeValue(variable, gen);
        }
        gen.writeEndArray();
    }
}
