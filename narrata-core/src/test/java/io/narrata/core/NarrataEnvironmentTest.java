package io.narrata.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.narrata.core.debug.DebugSession;
import io.narrata.core.debug.DebugView;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.FlowNotFoundException;
import io.narrata.core.flow.InMemoryFlowRepository;
import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.sheet.InMemorySheetRepository;
import io.narrata.core.state.ExecutionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NarrataEnvironmentTest {

    private NarrataEnvironment environment;

    @BeforeEach
    void setUp() {
        InMemoryFlowRepository flows = TestFlows.repository();
        flows.save(FlowGraph.builder().id("headless").node(ExitNode.of("end")).build());
        InMemorySheetRepository sheets = new InMemorySheetRepository();
        sheets.save("demo", TestFlows.variables());
        NarrataConfig config = NarrataConfig.builder().projectId("demo").maxSteps(20).build();
        environment = NarrataFactory.bootstrap(config, flows, sheets);
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    @Test
    void shouldOpenSessionAtEntryNode() throws Exception {
        // When
        DebugSession session = environment.openSession("main");

        // Then
        DebugView view = session.view();
        assertThat(view.currentFlowId()).isEqualTo("main");
        assertThat(view.currentFlowName()).isEqualTo("Main");
        assertThat(view.currentNodeId()).isEqualTo("start");
        assertThat(view.maxSteps()).isEqualTo(20);
        assertThat(view.variables().get("mc.jaime.health")).isPresent();
        assertThat(view.status()).isEqualTo(ExecutionStatus.PAUSED);
    }

    @Test
    void shouldOpenSessionAtGivenNode() throws Exception {
        DebugSession session = environment.openSession("main", "check");

        assertThat(session.view().currentNodeId()).isEqualTo("check");
    }

    @Test
    void shouldRunSessionToCompletion() throws Exception {
        // Given
        DebugSession session = environment.openSession("side");

        // When
        session.step();
        session.step();
        DebugView view = session.step();

        // Then
        assertThat(view.isFinished()).isTrue();
        assertThat(view.variables().get("mc.jaime.health").orElseThrow().getValue()).isEqualTo(55L);
    }

    @Test
    void shouldRejectUnknownFlow() {
        assertThatThrownBy(() -> environment.openSession("nope"))
                .isInstanceOf(FlowNotFoundException.class)
                .hasMessage("Flow not found: nope");
    }

    @Test
    void shouldRejectFlowWithoutEntry() {
        assertThatThrownBy(() -> environment.openSession("headless"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Flow headless has no entry node");
    }

    @Test
    void shouldStartWithEmptyVariablesForUnknownProject() throws Exception {
        // Given
        try (NarrataEnvironment other = NarrataFactory.bootstrap(
                new NarrataConfig(), TestFlows.repository(), new InMemorySheetRepository())) {

            // When
            DebugSession session = other.openSession("main");

            // Then
            assertThat(session.view().variables().isEmpty()).isTrue();
        }
    }

    @Test
    void shouldExposeValidatorOverRepository() {
        assertThat(environment.flowValidator().validate(TestFlows.main())).isEmpty();
    }
}
