package io.narrata.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.flow.node.Node;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFlowRepositoryTest {

    @TempDir Path tempDir;

    @Test
    void shouldLoadEveryJsonFileInTheDirectory() throws Exception {
        // Given
        Files.writeString(tempDir.resolve("cellar.json"), """
                {"id": "cellar", "name": "Cellar",
                 "nodes": [{"id": "stairs", "type": "entry"}, {"id": "out", "type": "exit"}],
                 "connections": [{"sourceNodeId": "stairs", "targetNodeId": "out"}]}
                """);
        Files.writeString(tempDir.resolve("notes.txt"), "not a flow");
        JsonFlowRepository repository = new JsonFlowRepository(tempDir);

        // When
        FlowGraph cellar = repository.getFlowGraph("cellar").orElseThrow();

        // Then
        assertThat(cellar.getName()).isEqualTo("Cellar");
        assertThat(repository.getNodeByTechnicalId("cellar", "out"))
                .get()
                .isInstanceOf(ExitNode.class);
        assertThat(repository.findAll()).extracting(FlowGraph::getId).containsExactly("cellar");
    }

    @Test
    void shouldWriteSavedFlowsAsIdNamedFiles() throws Exception {
        // Given
        Path flows = tempDir.resolve("flows");
        JsonFlowRepository repository = new JsonFlowRepository(flows);

        // When
        repository.save(SampleFlows.tavern());

        // Then
        assertThat(flows.resolve("tavern.json")).exists();
        FlowGraph reread = new JsonFlowRepository(flows).getFlowGraph("tavern").orElseThrow();
        assertThat(reread.getNodes().keySet())
                .containsExactlyElementsOf(SampleFlows.tavern().getNodes().keySet());
    }

    @Test
    void shouldReturnEmptyForUnknownFlowOrMissingDirectory() {
        // Given
        JsonFlowRepository repository = new JsonFlowRepository(tempDir.resolve("missing"));

        // Then
        assertThat(repository.getFlowGraph("tavern")).isEmpty();
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void shouldNameTheFileThatFailsToLoad() throws Exception {
        // Given
        Files.writeString(tempDir.resolve("broken.json"), "{\"id\": \"broken\", \"nodes\": [");
        JsonFlowRepository repository = new JsonFlowRepository(tempDir);

        // When / Then
        assertThatThrownBy(() -> repository.getFlowGraph("broken"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("broken.json: Failed to deserialize flow");
    }

    @Test
    void shouldReplaceFlowOnSave() {
        // Given
        JsonFlowRepository repository = new JsonFlowRepository(tempDir);
        repository.save(SampleFlows.tavern());

        // When
        repository.save(FlowGraph.builder().id("tavern").node(ExitNode.of("only")).build());

        // Then
        assertThat(repository.getFlowGraph("tavern").orElseThrow().getNodes().values())
                .extracting(Node::getId)
                .containsExactly("only");
    }
}
