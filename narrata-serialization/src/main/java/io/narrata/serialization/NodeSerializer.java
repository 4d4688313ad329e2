package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.writeIfNotNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.narrata.core.flow.node.ConditionNode;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.FlowCallNode;
import io.narrata.core.flow.node.InstructionNode;
import io.narrata.core.flow.node.Node;
import io.narrata.core.flow.node.Response;
import java.io.IOException;
import java.io.Serial;

/// Serializes {@link Node} instances to JSON with a `"type"` discriminator.
///
/// Writes `id`, `type` and `text` for every node, then the type-specific
/// payload. Empty conditions and instructions are omitted.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 7710262440175036519L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("type", node.getNodeType().id());
        writeIfNotNull(gen, "text", node.getText());

        if (node instanceof ConditionNode condition) {
            provider.defaultSerializeField("condition", condition.getCondition(), gen);
            if (condition.isSwitchMode()) {
                gen.writeBooleanField("switchMode", true);
            }
        } else if (node instanceof InstructionNode instruction) {
            provider.defaultSerializeField("assignments", instruction.getAssignments(), gen);
        } else if (node instanceof DialogueNode dialogue) {
            writeDialogue(dialogue, gen, provider);
        } else if (node instanceof FlowCallNode call) {
            gen.writeStringField("targetFlowId", call.getTargetFlowId());
            writeIfNotNull(gen, "targetNodeId", call.getTargetNodeId());
        }

        gen.writeEndObject();
    }

    private void writeDialogue(DialogueNode dialogue, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        writeIfNotNull(gen, "speaker", dialogue.getSpeaker());
        if (!dialogue.getInputCondition().isEmpty()) {
            provider.defaultSerializeField("inputCondition", dialogue.getInputCondition(), gen);
        }
        if (!dialogue.getOutputInstruction().isEmpty()) {
            provider.defaultSerializeField(
                    "outputInstruction", dialogue.getOutputInstruction(), gen);
        }
        gen.writeArrayFieldStart("responses");
        for (Response response : dialogue.getResponses()) {
            gen.writeStartObject();
            gen.writeStringField("id", response.id());
            writeIfNotNull(gen, "text", response.text());
            if (!response.condition().isEmpty()) {
                provider.defaultSerializeField("condition", response.condition(), gen);
            }
            if (!response.instruction().isEmpty()) {
                provider.defaultSerializeField("instruction", response.instruction(), gen);
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
