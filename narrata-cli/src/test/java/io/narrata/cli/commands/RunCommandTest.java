package io.narrata.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RunCommandTest extends BaseCommandTest {

    @BeforeEach
    void setUp() throws Exception {
        writeSampleProject();
    }

    @Test
    void shouldRunFlowToTheEndWithChosenResponses() {
        // When
        int exitCode = run("run", "main", "--choose", "r1");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out())
                .contains("Running flow: main")
                .contains("Instruction → mc.jaime.health: 50 → 40")
                .contains("Condition → true (1 of 1 rules passed)")
                .contains("r1  Fight")
                .contains("Selected: \"Fight\" → party.present: false → true")
                .contains("Entering sub-flow Side")
                .contains("mc.jaime.health: 50 → 45")
                .contains("party.present: false → true")
                .contains("Flow finished");
    }

    @Test
    void shouldStopAtDialogueWithoutResponse() {
        // When
        int exitCode = run("run", "main");

        // Then
        assertThat(exitCode).isEqualTo(RunCommand.STOPPED);
        assertThat(out())
                .contains("(unavailable)")
                .contains("Stopped: waiting for a response at talk");
    }

    @Test
    void shouldStopWhenResponseIsRefused() {
        // When
        int exitCode = run("run", "main", "--choose", "r2");

        // Then
        assertThat(exitCode).isEqualTo(RunCommand.STOPPED);
        assertThat(out())
                .contains("Cannot choose response: Response r2 is not available")
                .contains("Stopped: response r2 was refused");
    }

    @Test
    void shouldStopAfterBreakpointNode() {
        // When
        int exitCode = run("run", "main", "--break", "check", "--choose", "r1");

        // Then
        assertThat(exitCode).isEqualTo(RunCommand.STOPPED);
        assertThat(out()).contains("Stopped: breakpoint at check").doesNotContain("Flow finished");
    }

    @Test
    void shouldStopAtStepLimit() {
        // When
        int exitCode = run("run", "main", "--max-steps", "2");

        // Then
        assertThat(exitCode).isEqualTo(RunCommand.STOPPED);
        assertThat(out()).contains("Stopped: step limit of 2 reached");
    }

    @Test
    void shouldReportStallAndExitEarly() throws Exception {
        // Given
        Files.writeString(projectDir.resolve("flows").resolve("broken.json"), """
                {"id": "broken", "nodes": [{"id": "b_start", "type": "entry"},
                  {"id": "j", "type": "jump", "targetFlowId": "nowhere"}],
                 "connections": [{"sourceNodeId": "b_start", "targetNodeId": "j"}]}
                """);

        // When
        int exitCode = run("run", "broken");

        // Then
        assertThat(exitCode).isEqualTo(RunCommand.STOPPED);
        assertThat(out())
                .contains("[error]")
                .contains("Target flow nowhere not found")
                .contains("Stopped: stalled at j");
    }

    @Test
    void shouldFailForUnknownFlow() {
        // When
        int exitCode = run("run", "ghost");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Flow not found: ghost");
    }

    @Test
    void shouldExportFinalSession() throws Exception {
        // Given
        Path export = projectDir.resolve("out").resolve("session.json");

        // When
        int exitCode = run("run", "main", "-c", "r1", "--export", export.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(export))
                .contains("\"exportedAt\"")
                .contains("\"status\" : \"finished\"");
    }

    @Test
    void shouldPrintRuleDetailsWhenVerbose() {
        // When
        run("run", "main", "-c", "r1", "--verbose");

        // Then
        assertThat(out()).contains("✓ mc.jaime.health greater_than").contains("(actual 40)");
    }
}
