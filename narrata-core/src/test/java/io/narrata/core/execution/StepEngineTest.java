package io.narrata.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import io.narrata.core.TestFlows;
import io.narrata.core.evaluator.AssignmentExecutor;
import io.narrata.core.evaluator.ConditionEvaluator;
import io.narrata.core.execution.executor.DefaultNodeExecutorRegistry;
import io.narrata.core.execution.executor.Transition;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.InMemoryFlowRepository;
import io.narrata.core.flow.node.EntryNode;
import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.flow.node.JumpNode;
import io.narrata.core.flow.node.Node;
import io.narrata.core.state.ConsoleEntry;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionState;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.state.PendingChoice;
import io.narrata.core.variable.ReferenceResolver;
import io.narrata.core.variable.VariableSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class StepEngineTest {

    private InMemoryFlowRepository flows;
    private StepEngine engine;

    @BeforeEach
    void setUp() {
        flows = TestFlows.repository();
        ReferenceResolver resolver = new ReferenceResolver();
        engine =
                new StepEngine(
                        flows,
                        new DefaultNodeExecutorRegistry(),
                        new ConditionEvaluator(resolver),
                        new AssignmentExecutor(resolver));
    }

    private ExecutionState state(String flowId, String flowName, String startNodeId, int maxSteps) {
        return ExecutionState.builder()
                .projectId("test")
                .initialVariables(TestFlows.variables())
                .startFlow(flowId, flowName)
                .startNodeId(startNodeId)
                .maxSteps(maxSteps)
                .build();
    }

    private ExecutionState mainState() {
        return state("main", "Main", "start", 1000);
    }

    private static ConsoleEntry lastEntry(ExecutionState state) {
        return state.getConsole().get(state.getConsole().size() - 1);
    }

    @Nested
    class Stepping {

        @Test
        void shouldFollowDefaultOutputFromEntry() {
            // Given
            ExecutionState state = mainState();

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.ADVANCED);
            assertThat(state.getCurrentNodeId()).isEqualTo("hit");
            assertThat(state.getStepCount()).isEqualTo(1);
            assertThat(state.getExecutionLog()).singleElement().satisfies(entry -> {
                assertThat(entry.nodeId()).isEqualTo("start");
                assertThat(entry.depth()).isZero();
            });
            assertThat(lastEntry(state).message()).isEqualTo("Execution started");
        }

        @Test
        void shouldApplyInstructionAndRecordHistory() {
            // Given
            ExecutionState state = mainState();
            engine.step(state);

            // When
            engine.step(state);

            // Then
            assertThat(state.getVariables().get("mc.jaime.health").orElseThrow().getValue())
                    .isEqualTo(40L);
            assertThat(state.getHistory()).singleElement().satisfies(change -> {
                assertThat(change.nodeId()).isEqualTo("hit");
                assertThat(change.oldValue()).isEqualTo(50L);
                assertThat(change.newValue()).isEqualTo(40L);
                assertThat(change.source()).isEqualTo(VariableSource.INSTRUCTION);
            });
            assertThat(lastEntry(state).message())
                    .isEqualTo("Instruction → mc.jaime.health: 50 → 40");
            assertThat(state.getCurrentNodeId()).isEqualTo("check");
        }

        @Test
        void shouldBranchOnConditionAndExplainRules() {
            // Given
            ExecutionState state = mainState();
            engine.step(state);
            engine.step(state);

            // When
            engine.step(state);

            // Then
            assertThat(state.getCurrentNodeId()).isEqualTo("talk");
            ConsoleEntry entry = lastEntry(state);
            assertThat(entry.message()).isEqualTo("Condition → true (1 of 1 rules passed)");
            assertThat(entry.ruleDetails()).hasSize(1);
        }

        @Test
        void shouldWaitOnDialogueWithAvailableResponse() {
            // Given
            ExecutionState state = mainState();
            for (int i = 0; i < 3; i++) {
                engine.step(state);
            }

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.WAITING_INPUT);
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.WAITING_INPUT);
            assertThat(state.getPendingChoices())
                    .extracting(PendingChoice::responseId, PendingChoice::valid)
                    .containsExactly(
                            tuple("r1", true),
                            tuple("r2", false));
            assertThat(engine.step(state)).isEqualTo(StepOutcome.REFUSED);
            assertThat(state.getStepCount()).isEqualTo(4);
        }

        @Test
        void shouldRunThroughSubflowAndReturnToCaller() {
            // Given
            ExecutionState state = mainState();
            for (int i = 0; i < 4; i++) {
                engine.step(state);
            }
            engine.chooseResponse(state, "r1");

            // When
            engine.step(state);

            // Then
            assertThat(state.getCurrentFlowId()).isEqualTo("side");
            assertThat(state.getCurrentNodeId()).isEqualTo("side_start");
            assertThat(state.getDepth()).isEqualTo(1);
            assertThat(state.getCallStack()).singleElement().satisfies(frame -> {
                assertThat(frame.flowId()).isEqualTo("main");
                assertThat(frame.returnNodeId()).isEqualTo("call");
            });

            // When
            engine.step(state);
            engine.step(state);
            engine.step(state);

            // Then
            assertThat(state.getCurrentFlowId()).isEqualTo("main");
            assertThat(state.getCurrentNodeId()).isEqualTo("end");
            assertThat(state.getDepth()).isZero();
            assertThat(state.getExecutionLog())
                    .extracting(entry -> entry.nodeId() + "@" + entry.depth())
                    .containsSubsequence("call@0", "side_start@1", "bonus@1", "side_exit@1");

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.FINISHED);
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.FINISHED);
            assertThat(state.getVariables().get("mc.jaime.health").orElseThrow().getValue())
                    .isEqualTo(45L);
            assertThat(engine.checkCanStep(state)).contains("Execution finished");
        }

        @Test
        void shouldReturnFromJumpTargetToCallerOutput() {
            // Given
            flows.save(FlowGraph.builder()
                    .id("hopper")
                    .name("Hopper")
                    .node(EntryNode.of("h_start"))
                    .node(JumpNode.builder()
                            .id("h_jump")
                            .targetFlowId("side")
                            .targetNodeId("bonus")
                            .build())
                    .node(ExitNode.of("h_end"))
                    .connect("h_start", "default", "h_jump")
                    .connect("h_jump", "default", "h_end")
                    .build());
            ExecutionState state = state("hopper", "Hopper", "h_start", 1000);
            engine.step(state);

            // When
            engine.step(state);

            // Then
            assertThat(state.getCurrentFlowId()).isEqualTo("side");
            assertThat(state.getCurrentNodeId()).isEqualTo("bonus");
            assertThat(state.getDepth()).isEqualTo(1);
            assertThat(state.getCallStack()).singleElement().satisfies(frame -> {
                assertThat(frame.flowId()).isEqualTo("hopper");
                assertThat(frame.returnNodeId()).isEqualTo("h_jump");
            });
            assertThat(state.getConsole()).extracting(ConsoleEntry::message).contains("Jump → Side");

            // When
            engine.step(state);
            engine.step(state);

            // Then
            assertThat(state.getCurrentFlowId()).isEqualTo("hopper");
            assertThat(state.getCurrentNodeId()).isEqualTo("h_end");
            assertThat(state.getDepth()).isZero();
            assertThat(state.getCallStack()).isEmpty();

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.FINISHED);
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.FINISHED);
            assertThat(state.getVariables().get("mc.jaime.health").orElseThrow().getValue())
                    .isEqualTo(55L);
        }

        @Test
        void shouldNotifyListenerAroundEachNode() {
            // Given
            ExecutionState state = mainState();
            ExecutionListener listener = mock(ExecutionListener.class);
            state.setListener(listener);

            // When
            engine.step(state);

            // Then
            InOrder order = inOrder(listener);
            order.verify(listener).onNodeStart(any(EntryNode.class));
            order.verify(listener).onConsoleEntry(any(ConsoleEntry.class));
            order.verify(listener).onNodeComplete(any(Node.class), any(Transition.Advance.class));
        }
    }

    @Nested
    class Choices {

        private ExecutionState waiting;

        @BeforeEach
        void reachDialogue() {
            waiting = mainState();
            for (int i = 0; i < 4; i++) {
                engine.step(waiting);
            }
        }

        @Test
        void shouldApplyResponseInstructionAndFollowResponsePin() {
            // When
            StepOutcome outcome = engine.chooseResponse(waiting, "r1");

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.ADVANCED);
            assertThat(waiting.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(waiting.getCurrentNodeId()).isEqualTo("call");
            assertThat(waiting.getPendingChoices()).isEmpty();
            assertThat(waiting.getVariables().get("party.present").orElseThrow().getValue())
                    .isEqualTo(true);
            assertThat(lastEntry(waiting).message())
                    .isEqualTo("Selected: \"Fight\" → party.present: false → true");
            assertThat(waiting.getStepCount()).isEqualTo(4);
        }

        @Test
        void shouldRefuseUnavailableResponse() {
            assertThat(engine.checkCanChoose(waiting, "r2")).contains("Response r2 is not available");
            assertThat(engine.chooseResponse(waiting, "r2")).isEqualTo(StepOutcome.REFUSED);
            assertThat(waiting.getStatus()).isEqualTo(ExecutionStatus.WAITING_INPUT);
        }

        @Test
        void shouldRefuseUnknownResponse() {
            assertThat(engine.checkCanChoose(waiting, "nope")).contains("Unknown response nope");
        }

        @Test
        void shouldRefuseChoiceWhenNotWaiting() {
            ExecutionState fresh = mainState();

            assertThat(engine.checkCanChoose(fresh, "r1")).contains("Not waiting for a response");
        }
    }

    @Nested
    class Faults {

        @Test
        void shouldStallOnUnknownNode() {
            // Given
            ExecutionState state = state("main", "Main", "ghost", 1000);

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.STALLED);
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(state.getCurrentNodeId()).isEqualTo("ghost");
            ConsoleEntry entry = lastEntry(state);
            assertThat(entry.level()).isEqualTo(ConsoleLevel.ERROR);
            assertThat(entry.message()).isEqualTo("Node ghost not found in flow Main");
        }

        @Test
        void shouldStallOnMissingOutput() {
            // Given
            flows.save(FlowGraph.builder()
                    .id("broken")
                    .name("Broken")
                    .node(EntryNode.of("b_start"))
                    .build());
            ExecutionState state = state("broken", "Broken", "b_start", 1000);

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.STALLED);
            assertThat(state.getCurrentNodeId()).isEqualTo("b_start");
            assertThat(lastEntry(state).level()).isEqualTo(ConsoleLevel.ERROR);
            assertThat(lastEntry(state).message()).startsWith("No outgoing connection from");
        }

        @Test
        void shouldStallOnMissingJumpTarget() {
            // Given
            flows.save(FlowGraph.builder()
                    .id("jumper")
                    .name("Jumper")
                    .node(JumpNode.builder().id("j").targetFlowId("nowhere").build())
                    .build());
            ExecutionState state = state("jumper", "Jumper", "j", 1000);

            // When
            StepOutcome outcome = engine.step(state);

            // Then
            assertThat(outcome).isEqualTo(StepOutcome.STALLED);
            assertThat(lastEntry(state).message()).isEqualTo("Target flow nowhere not found");
        }
    }

    @Nested
    class StepLimit {

        @Test
        void shouldPauseWhenLimitIsReached() {
            // Given
            ExecutionState state = state("loop", "Loop", "loop_start", 3);
            state.setStatus(ExecutionStatus.RUNNING);

            // When
            engine.step(state);
            engine.step(state);
            engine.step(state);

            // Then
            assertThat(state.isStepLimitReached()).isTrue();
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(lastEntry(state).level()).isEqualTo(ConsoleLevel.WARNING);
            assertThat(engine.step(state)).isEqualTo(StepOutcome.REFUSED);
            assertThat(state.getStepCount()).isEqualTo(3);
        }

        @Test
        void shouldStepAgainAfterLimitIsRaised() {
            // Given
            ExecutionState state = state("loop", "Loop", "loop_start", 1);
            engine.step(state);

            // When
            state.raiseMaxSteps(1000);

            // Then
            assertThat(engine.checkCanStep(state)).isEmpty();
            assertThat(engine.step(state)).isEqualTo(StepOutcome.ADVANCED);
        }
    }
}
