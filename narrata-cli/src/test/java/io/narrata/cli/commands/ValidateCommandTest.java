package io.narrata.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import org.junit.jupiter.api.Test;

class ValidateCommandTest extends BaseCommandTest {

    @Test
    void shouldReportCleanFlows() throws Exception {
        // Given
        writeSampleProject();

        // When
        int exitCode = run("validate");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out())
                .contains("[OK] Main (main) - 7 node(s), 0 issue(s)")
                .contains("[OK] Side (side) - 3 node(s), 0 issue(s)");
    }

    @Test
    void shouldFailOnMissingCallTarget() throws Exception {
        // Given
        writeSampleProject();
        Files.writeString(projectDir.resolve("flows").resolve("broken.json"), """
                {"id": "broken", "name": "Broken",
                 "nodes": [{"id": "b_start", "type": "entry"},
                   {"id": "j", "type": "jump", "targetFlowId": "nowhere"},
                   {"id": "orphan", "type": "scene"}],
                 "connections": [{"sourceNodeId": "b_start", "targetNodeId": "j"}]}
                """);

        // When
        int exitCode = run("validate", "broken");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(out())
                .contains("[FAIL] Broken (broken) - 3 node(s), 2 issue(s)")
                .contains("error j: Target flow nowhere does not exist")
                .contains("warning orphan: Node 'Scene' has no outgoing connection")
                .doesNotContain("Main (main)");
    }

    @Test
    void shouldFailForUnknownFlow() throws Exception {
        // Given
        writeSampleProject();

        // When
        int exitCode = run("validate", "ghost");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Flow not found: ghost");
    }

    @Test
    void shouldWarnWhenProjectHasNoFlows() {
        // When
        int exitCode = run("validate");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out()).contains("[WARN] No flows found");
    }
}
