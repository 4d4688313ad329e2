package io.narrata.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.narrata.core.debug.DebugView;
import io.narrata.core.evaluator.RuleResult;
import io.narrata.core.expression.RuleOperator;
import io.narrata.core.state.CallFrame;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ConsoleEntry;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionLogEntry;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.state.PendingChoice;
import io.narrata.core.variable.VariableSource;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SessionSerializerTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    @Test
    void shouldExportSessionViewWithTimestamp() throws Exception {
        // Given
        DebugView view = new DebugView(
                "session-1",
                ExecutionStatus.WAITING_INPUT,
                4,
                1000,
                false,
                "tavern",
                "The Tavern",
                "talk",
                SampleFlows.variables(),
                List.of(new ConsoleEntry(12, ConsoleLevel.WARNING, "check", "check",
                        "Condition → false (0 of 1 rules passed)",
                        List.of(new RuleResult("low", "mc.jaime.health",
                                RuleOperator.LESS_THAN, "50", 40L, true, true)))),
                List.of(new ExecutionLogEntry("start", "tavern", "start", 0)),
                List.of(new ChangeRecord(10, "heal", "heal", "mc.jaime.health", 30L, 40L,
                        VariableSource.INSTRUCTION, "+=")),
                Set.of("talk"),
                List.of(new CallFrame("main", "Main", "call")),
                List.of(new PendingChoice("r1", "Ale", true, List.of())),
                true,
                false,
                800);

        // When
        String json = SessionSerializer.toJson(view, CLOCK);

        // Then
        JsonNode root = FlowSerializer.createMapper().readTree(json);
        assertThat(root.path("exportedAt").asText()).isEqualTo("2026-01-02T03:04:05Z");

        JsonNode session = root.path("session");
        assertThat(session.path("status").asText()).isEqualTo("waiting_input");
        assertThat(session.path("currentNodeId").asText()).isEqualTo("talk");
        assertThat(session.path("variables").isArray()).isTrue();
        assertThat(session.path("variables").size()).isEqualTo(6);
        assertThat(session.path("console").get(0).path("level").asText()).isEqualTo("warning");
        assertThat(session.path("console").get(0).path("ruleDetails").get(0)
                        .path("operator").asText())
                .isEqualTo("less_than");
        assertThat(session.path("history").get(0).path("source").asText())
                .isEqualTo("instruction");
        assertThat(session.path("callStack").get(0).path("returnNodeId").asText())
                .isEqualTo("call");
        assertThat(session.path("canStepBack").asBoolean()).isTrue();
        assertThat(session.has("finished")).isFalse();
        assertThat(session.has("waitingForInput")).isFalse();
    }
}
