package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.requiredText;
import static io.narrata.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.flow.Connection;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.Node;
import java.io.IOException;
import java.io.Serial;

/// Reads a flow written by {@link FlowGraphSerializer}.
///
/// Connection pins default to `default` and `input` when omitted. Duplicate
/// node ids fail deserialization.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class FlowGraphDeserializer extends StdDeserializer<FlowGraph> {

    @Serial private static final long serialVersionUID = 3457201339465113870L;

    FlowGraphDeserializer() {
        super(FlowGraph.class);
    }

    @Override
    public FlowGraph deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Flow must be an object");
        }

        FlowGraph.Builder builder = FlowGraph.builder()
                .id(requiredText(p, root, "id"))
                .name(textOrNull(root, "name"));

        try {
            for (JsonNode element : root.path("nodes")) {
                builder.node(mapper.treeToValue(element, Node.class));
            }
            for (JsonNode element : root.path("connections")) {
                builder.connection(new Connection(
                        requiredText(p, element, "sourceNodeId"),
                        textOrNull(element, "sourcePin"),
                        requiredText(p, element, "targetNodeId"),
                        textOrNull(element, "targetPin")));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
