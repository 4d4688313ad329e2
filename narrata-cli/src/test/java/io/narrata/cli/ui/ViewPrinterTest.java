package io.narrata.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.narrata.core.debug.DebugView;
import io.narrata.core.state.CallFrame;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ExecutionLogEntry;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.state.PendingChoice;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import io.narrata.core.variable.VariableStore;
import io.narrata.core.variable.VariableType;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ViewPrinterTest {

    private ByteArrayOutputStream buffer;
    private ViewPrinter printer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        printer = new ViewPrinter(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), AnsiStyles.of(false));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static DebugView view(
            ExecutionStatus status,
            int stepCount,
            boolean stepLimitReached,
            VariableStore variables,
            List<ExecutionLogEntry> log,
            List<ChangeRecord> history,
            Set<String> breakpoints,
            List<CallFrame> callStack,
            List<PendingChoice> choices) {
        return new DebugView(
                "s-1", status, stepCount, 10, stepLimitReached, "side", "Side", "bonus",
                variables, List.of(), log, history, breakpoints, callStack, choices,
                false, false, 500L);
    }

    private static DebugView simpleView() {
        return view(ExecutionStatus.PAUSED, 3, false, VariableStore.empty(), List.of(),
                List.of(), Set.of(), List.of(), List.of());
    }

    @Nested
    class Status {

        @Test
        void shouldPrintStatusFlowAndSteps() {
            // When
            printer.printStatus(simpleView());

            // Then
            assertThat(output()).isEqualToIgnoringNewLines("  paused • Side / bonus • steps 3/10");
        }

        @Test
        void shouldShowDepthBreakpointAndLimit() {
            // Given
            DebugView view = view(ExecutionStatus.PAUSED, 10, true, VariableStore.empty(),
                    List.of(), List.of(), Set.of("bonus"),
                    List.of(new CallFrame("main", "Main", "call")), List.of());

            // When
            printer.printStatus(view);

            // Then
            assertThat(output())
                    .contains("steps 10/10 • depth 1 ●")
                    .contains("Step limit reached; use 'continue' to allow more steps");
        }
    }

    @Test
    void shouldMarkUnavailableChoices() {
        // Given
        DebugView view = view(ExecutionStatus.WAITING_INPUT, 4, false, VariableStore.empty(),
                List.of(), List.of(), Set.of(), List.of(),
                List.of(new PendingChoice("r1", "Fight", true, List.of()),
                        new PendingChoice("r2", null, false, List.of())));

        // When
        printer.printChoices(view);

        // Then
        assertThat(output().lines())
                .containsExactly("    ✓ r1  Fight", "    ✗ r2    (unavailable)");
    }

    @Test
    void shouldFlagChangedVariables() {
        // Given
        Variable health = Variable.builder()
                .sheetShortcut("mc.jaime")
                .variableName("health")
                .type(VariableType.NUMBER)
                .value(50L)
                .build()
                .withValue(40L, VariableSource.INSTRUCTION);
        Variable present = Variable.builder()
                .sheetShortcut("party")
                .variableName("present")
                .type(VariableType.BOOLEAN)
                .value(false)
                .build();
        DebugView view = view(ExecutionStatus.PAUSED, 2, false, VariableStore.of(health, present),
                List.of(), List.of(), Set.of(), List.of(), List.of());

        // When
        printer.printVariables(view);

        // Then
        assertThat(output().lines())
                .containsExactly(
                        "    mc.jaime.health = 40  (was 50, instruction)",
                        "    party.present = false  (boolean)");
    }

    @Nested
    class Trace {

        @Test
        void shouldIndentSubFlowNodes() {
            // Given
            DebugView view = view(ExecutionStatus.PAUSED, 3, false, VariableStore.empty(),
                    List.of(new ExecutionLogEntry("call", "main", "Subflow", 0),
                            new ExecutionLogEntry("side_start", "side", "Entry", 1),
                            new ExecutionLogEntry("bonus", "side", "Instruction", 1)),
                    List.of(), Set.of(), List.of(), List.of());

            // When
            printer.printTrace(view);

            // Then
            assertThat(output().lines())
                    .containsExactly(
                            "    1. Subflow",
                            "    Entering sub-flow side",
                            "      2. Entry",
                            "      3. Instruction");
        }

        @Test
        void shouldSayWhenNothingRan() {
            // When
            printer.printTrace(simpleView());

            // Then
            assertThat(output()).contains("(no nodes executed)");
        }
    }

    @Nested
    class Changes {

        @Test
        void shouldCollapseRepeatedWritesToNetChange() {
            // Given
            List<ChangeRecord> history = List.of(
                    new ChangeRecord(1L, "hit", null, "mc.jaime.health", 50L, 40L,
                            VariableSource.INSTRUCTION, "subtract"),
                    new ChangeRecord(2L, "talk", null, "party.present", false, true,
                            VariableSource.INSTRUCTION, "set_true"),
                    new ChangeRecord(3L, "bonus", null, "mc.jaime.health", 40L, 45L,
                            VariableSource.INSTRUCTION, "add"));
            DebugView view = view(ExecutionStatus.FINISHED, 8, false, VariableStore.empty(),
                    List.of(), history, Set.of(), List.of(), List.of());

            // When
            printer.printChanges(view);

            // Then
            assertThat(output().lines())
                    .containsExactly("    mc.jaime.health: 50 → 45", "    party.present: false → true");
        }

        @Test
        void shouldSayWhenNothingChanged() {
            // When
            printer.printChanges(simpleView());

            // Then
            assertThat(output()).contains("(no variable changed)");
        }
    }
}
