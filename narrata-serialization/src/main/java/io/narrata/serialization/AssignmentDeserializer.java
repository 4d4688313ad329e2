package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.requiredText;
import static io.narrata.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentOperator;
import io.narrata.core.expression.IdGenerator;
import io.narrata.core.expression.ValueType;
import java.io.IOException;
import java.io.Serial;

/// Reads a structured assignment. A missing `id` is generated.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
/// @see AssignmentSerializer for the inverse operation
class AssignmentDeserializer extends StdDeserializer<Assignment> {

    @Serial private static final long serialVersionUID = 4393650188201541947L;

    AssignmentDeserializer() {
        super(Assignment.class);
    }

    @Override
    public Assignment deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Assignment must be an object");
        }
        String id = textOrNull(root, "id");
        String valueType = textOrNull(root, "valueType");
        try {
            return new Assignment(
                    id != null ? id : IdGenerator.next("assign"),
                    textOrNull(root, "sheet"),
                    textOrNull(root, "variable"),
                    AssignmentOperator.fromId(requiredText(p, root, "operator")),
                    textOrNull(root, "value"),
                    valueType != null ? ValueType.fromId(valueType) : ValueType.LITERAL,
                    textOrNull(root, "valueSheet"),
                    null,
                    null);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
