package io.narrata.serialization;

import static io.narrata.serialization.JsonFields.readAssignments;
import static io.narrata.serialization.JsonFields.readCondition;
import static io.narrata.serialization.JsonFields.requiredText;
import static io.narrata.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.flow.node.ConditionNode;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.EntryNode;
import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.flow.node.HubNode;
import io.narrata.core.flow.node.InstructionNode;
import io.narrata.core.flow.node.JumpNode;
import io.narrata.core.flow.node.Node;
import io.narrata.core.flow.node.NodeType;
import io.narrata.core.flow.node.Response;
import io.narrata.core.flow.node.SceneNode;
import io.narrata.core.flow.node.SubflowNode;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes {@link Node} instances from JSON using the `"type"` field as a discriminator.
///
/// Conditions and instructions may be given as expression text, for example
/// `"condition": "mc.jaime.health < 50"`, or in the structured form written
/// by {@link NodeSerializer}.
///
/// @implNote Package-private. Registered by {@link NarrataJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -2098544106117382644L;

    private final transient ExpressionParser parser;

    NodeDeserializer(ExpressionParser parser) {
        super(Node.class);
        this.parser = parser;
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Node must be an object");
        }

        String id = requiredText(p, root, "id");
        String text = textOrNull(root, "text");

        NodeType type;
        try {
            type = NodeType.fromId(requiredText(p, root, "type"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage() + " (node " + id + ")", e);
        }

        return switch (type) {
            case ENTRY -> EntryNode.builder().id(id).text(text).build();
            case EXIT -> ExitNode.builder().id(id).text(text).build();
            case HUB -> HubNode.builder().id(id).text(text).build();
            case SCENE -> SceneNode.builder().id(id).text(text).build();
            case CONDITION -> ConditionNode.builder()
                    .id(id)
                    .text(text)
                    .condition(readCondition(p, mapper, parser, root, "condition"))
                    .switchMode(root.path("switchMode").asBoolean(false))
                    .build();
            case INSTRUCTION -> InstructionNode.builder()
                    .id(id)
                    .text(text)
                    .assignments(readAssignments(p, mapper, parser, root, "assignments"))
                    .build();
            case DIALOGUE -> DialogueNode.builder()
                    .id(id)
                    .text(text)
                    .speaker(textOrNull(root, "speaker"))
                    .inputCondition(readCondition(p, mapper, parser, root, "inputCondition"))
                    .outputInstruction(
                            readAssignments(p, mapper, parser, root, "outputInstruction"))
                    .responses(readResponses(p, mapper, root))
                    .build();
            case JUMP -> JumpNode.builder()
                    .id(id)
                    .text(text)
                    .targetFlowId(requiredText(p, root, "targetFlowId"))
                    .targetNodeId(textOrNull(root, "targetNodeId"))
                    .build();
            case SUBFLOW -> SubflowNode.builder()
                    .id(id)
                    .text(text)
                    .targetFlowId(requiredText(p, root, "targetFlowId"))
                    .targetNodeId(textOrNull(root, "targetNodeId"))
                    .build();
        };
    }

    private List<Response> readResponses(JsonParser p, ObjectMapper mapper, JsonNode root)
            throws IOException {
        JsonNode array = root.get("responses");
        if (array == null || array.isNull()) {
            return List.of();
        }
        List<Response> responses = new ArrayList<>();
        for (JsonNode element : array) {
            responses.add(new Response(
                    requiredText(p, element, "id"),
                    textOrNull(element, "text"),
                    readCondition(p, mapper, parser, element, "condition"),
                    readAssignments(p, mapper, parser, element, "instruction")));
        }
        return responses;
    }
}
