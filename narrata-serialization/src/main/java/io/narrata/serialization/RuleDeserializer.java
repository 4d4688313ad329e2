package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.requiredText;
import static io.narrata.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.expression.IdGenerator;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.RuleOperator;
import io.narrata.core.expression.ValueType;
import java.io.IOException;
import java.io.Serial;

/// Reads a structured rule. A missing `id` is generated.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
/// @see RuleSerializer for the inverse operation
class RuleDeserializer extends StdDeserializer<Rule> {

    @Serial private static final long serialVersionUID = -3350935577000162718L;

    RuleDeserializer() {
        super(Rule.class);
    }

    @Override
    public Rule deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Rule must be an object");
        }
        String id = textOrNull(root, "id");
        String valueType = textOrNull(root, "valueType");
        try {
            return new Rule(
                    id != null ? id : IdGenerator.next("rule"),
                    textOrNull(root, "sheet"),
                    textOrNull(root, "variable"),
                    RuleOperator.fromId(requiredText(p, root, "operator")),
                    textOrNull(root, "value"),
                    valueType != null ? ValueType.fromId(valueType) : ValueType.LITERAL,
                    textOrNull(root, "valueSheet"),
                    null,
                    null,
                    textOrNull(root, "label"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
