package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.expression.Condition;
import io.narrata.core.expression.ConditionLogic;
import io.narrata.core.expression.ConditionParseResult;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.expression.Rule;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads a condition from expression text or from `{logic, rules}`.
///
/// A missing `logic` means `all`.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
/// @see ConditionSerializer for the inverse operation
class ConditionDeserializer extends StdDeserializer<Condition> {

    @Serial private static final long serialVersionUID = 6021876904735102219L;

    private final transient ExpressionParser parser;

    ConditionDeserializer(ExpressionParser parser) {
        super(Condition.class);
        this.parser = parser;
    }

    @Override
    public Condition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (root.isTextual()) {
            ConditionParseResult result = parser.parseCondition(root.asText());
            if (!result.isValid()) {
                throw JsonMappingException.from(
                        p, "Invalid condition: " + JsonFields.describe(result.errors()));
            }
            return result.condition();
        }
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Condition must be expression text or an object");
        }

        String logic = JsonFields.textOrNull(root, "logic");
        List<Rule> rules = new ArrayList<>();
        JsonNode array = root.get("rules");
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                rules.add(mapper.treeToValue(element, Rule.class));
            }
        }
        return new Condition(logic != null ? ConditionLogic.fromId(logic) : ConditionLogic.ALL, rules);
    }
}
