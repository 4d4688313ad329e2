package io.narrata.core.flow.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NodeTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "<p>Hello <b>there</b></p>         | Hello there",
        "Fish &amp; chips &lt;3            | Fish & chips <3",
        "<p></p>                           | Scene"
    })
    void shouldDeriveLabelFromText(String text, String expected) {
        SceneNode node = SceneNode.builder().id("n").text(text).build();

        assertThat(node.getLabel()).isEqualTo(expected);
    }

    @Test
    void shouldCollapseWhitespace() {
        SceneNode node = SceneNode.builder().id("n").text("  spaced\n\tout  ").build();

        assertThat(node.getLabel()).isEqualTo("spaced out");
    }

    @Test
    void shouldTruncateLongLabels() {
        String text = "a".repeat(60);

        String label = HubNode.builder().id("n").text(text).build().getLabel();

        assertThat(label).hasSize(40);
    }

    @Test
    void shouldFallBackToCapitalizedType() {
        assertThat(HubNode.of("h").getLabel()).isEqualTo("Hub");
        assertThat(SubflowNode.builder().id("s").targetFlowId("f").build().getLabel())
                .isEqualTo("Subflow");
    }

    @Test
    void shouldRequireId() {
        assertThatThrownBy(() -> ExitNode.of(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Node ID required");
    }

    @Test
    void shouldLookUpResponsesById() {
        DialogueNode node = DialogueNode.builder()
                .id("d")
                .responses(Response.of("r1", "Yes"), Response.of("r2", "No"))
                .build();

        assertThat(node.getResponse("r2")).map(Response::text).contains("No");
        assertThat(node.getResponse("r3")).isEmpty();
        assertThat(node.getInputCondition().isEmpty()).isTrue();
        assertThat(node.getOutputInstruction()).isEmpty();
    }

    @Test
    void shouldParseNodeTypeIds() {
        assertThat(NodeType.fromId(" Dialogue ")).isEqualTo(NodeType.DIALOGUE);
        assertThat(NodeType.SUBFLOW.id()).isEqualTo("subflow");
        assertThatThrownBy(() -> NodeType.fromId("portal"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown node type: portal");
    }
}
