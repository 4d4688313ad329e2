package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentParseResult;
import io.narrata.core.expression.Condition;
import io.narrata.core.expression.ConditionParseResult;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.expression.ParseError;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Field helpers shared by the Narrata serializers and deserializers.
///
/// Conditions and instructions may be written either as expression text or
/// in structured form; the `read*` methods accept both.
final class JsonFields {

    private JsonFields() {}

    static String textOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    static String requiredText(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        String value = textOrNull(root, field);
        if (value == null) {
            throw JsonMappingException.from(p, "Missing required field '" + field + "'");
        }
        return value;
    }

    static void writeIfNotNull(JsonGenerator gen, String field, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }

    /// Reads a condition field given as text or as `{logic, rules}`.
    ///
    /// @return the condition, or empty when the field is absent or null
    static Condition readCondition(
            JsonParser p, ObjectMapper mapper, ExpressionParser parser, JsonNode root,
            String field) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return Condition.empty();
        }
        if (value.isTextual()) {
            ConditionParseResult result = parser.parseCondition(value.asText());
            if (!result.isValid()) {
                throw JsonMappingException.from(
                        p, "Invalid condition in '" + field + "': " + describe(result.errors()));
            }
            return result.condition();
        }
        return mapper.treeToValue(value, Condition.class);
    }

    /// Reads an instruction field given as text or as an array of assignments.
    ///
    /// @return the assignments, empty when the field is absent or null
    static List<Assignment> readAssignments(
            JsonParser p, ObjectMapper mapper, ExpressionParser parser, JsonNode root,
            String field) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            AssignmentParseResult result = parser.parseAssignments(value.asText());
            if (!result.isValid()) {
                throw JsonMappingException.from(
                        p, "Invalid instruction in '" + field + "': " + describe(result.errors()));
            }
            return result.assignments();
        }
        if (!value.isArray()) {
            throw JsonMappingException.from(
                    p, "Field '" + field + "' must be expression text or an array");
        }
        List<Assignment> assignments = new ArrayList<>();
        for (JsonNode element : value) {
            assignments.add(mapper.treeToValue(element, Assignment.class));
        }
        return assignments;
    }

    static String describe(List<ParseError> errors) {
        return errors.stream()
                .map(e -> e.message() + " at " + e.from())
                .collect(Collectors.joining("; "));
    }
}
