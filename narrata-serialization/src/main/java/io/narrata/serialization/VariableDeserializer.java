package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.requiredText;
import static io.narrata.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.variable.Values;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import io.narrata.core.variable.VariableType;
import java.io.IOException;
import java.io.Serial;

/// Reads a variable written by {@link VariableSerializer}.
///
/// Values are coerced to the declared type, so `"5"` for a number becomes
/// `5` and an ISO string for a date becomes a `LocalDate`. A value that does
/// not fit its type fails deserialization.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class VariableDeserializer extends StdDeserializer<Variable> {

    @Serial private static final long serialVersionUID = 1939950377285470221L;

    VariableDeserializer() {
        super(Variable.class);
    }

    @Override
    public Variable deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Variable must be an object");
        }

        VariableType type;
        try {
            type = VariableType.fromId(requiredText(p, root, "type"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }

        Variable.Builder builder =
                Variable.builder().sheetShortcut(requiredText(p, root, "sheet")).type(type);
        if (root.has("table")) {
            builder.tableCell(
                    requiredText(p, root, "table"),
                    requiredText(p, root, "row"),
                    requiredText(p, root, "column"));
        } else {
            builder.variableName(requiredText(p, root, "name"));
        }

        builder.value(readValue(p, mapper, root, "value", type));
        if (root.has("initialValue")) {
            builder.initialValue(readValue(p, mapper, root, "initialValue", type));
        }
        if (root.has("previousValue")) {
            builder.previousValue(readValue(p, mapper, root, "previousValue", type));
        }
        String source = textOrNull(root, "source");
        if (source != null) {
            try {
                builder.source(VariableSource.fromId(source));
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }
        builder.ownerBlockId(textOrNull(root, "ownerBlockId"));
        return builder.build();
    }

    private static Object readValue(
            JsonParser p, ObjectMapper mapper, JsonNode root, String field, VariableType type)
            throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        Object raw = mapper.treeToValue(node, Object.class);
        return Values.coerce(type, raw)
                .orElseThrow(() -> JsonMappingException.from(
                        p, "Value of '" + field + "' is not a valid " + type.id() + ": " + node));
    }
}
