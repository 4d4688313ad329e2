package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.flow.Connection;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.Node;
import java.io.IOException;
import java.io.Serial;

/// Writes a flow as `{id, name, nodes, connections}`.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class FlowGraphSerializer extends StdSerializer<FlowGraph> {

    @Serial private static final long serialVersionUID = -6612998270330317120L;

    FlowGraphSerializer() {
        super(FlowGraph.class);
    }

    @Override
    public void serialize(FlowGraph graph, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", graph.getId());
        gen.writeStringField("name", graph.getName());

        gen.writeArrayFieldStart("nodes");
        for (Node node : graph.getNodes().values()) {
            provider.defaultSerializeValue(node, gen);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("connections");
        for (Connection connection : graph.getConnections()) {
            gen.writeStartObject();
            gen.writeStringField("sourceNodeId", connection.sourceNodeId());
            gen.writeStringField("sourcePin", connection.sourcePin());
            gen.writeStringField("targetNodeId", connection.targetNodeId());
            gen.writeStringField("targetPin", connection.targetPin());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
