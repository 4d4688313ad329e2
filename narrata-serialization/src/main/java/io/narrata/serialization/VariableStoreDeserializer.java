package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableStore;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads a variable store from an array of variables.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
/// @see VariableStoreSerializer for the inverse operation
class VariableStoreDeserializer extends StdDeserializer<VariableStore> {

    @Serial private static final long serialVersionUID = -5316250470093012258L;

    VariableStoreDeserializer() {
        super(VariableStore.class);
    }

    @Override
    public VariableStore deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isArray()) {
            throw JsonMappingException.from(p, "Variables must be an array");
        }
        List<Variable> variables = new ArrayList<>();
        for (JsonNode element : root) {
            variables.add(mapper.treeToValue(element, Variable.class));
        }
        return VariableStore.of(variables);
    }
}
