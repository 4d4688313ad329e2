package io.narrata.cli.commands;

import io.narrata.cli.ui.AnsiStyles;
import io.narrata.cli.ui.ViewPrinter;
import io.narrata.core.NarrataEnvironment;
import io.narrata.core.debug.DebugSession;
import io.narrata.core.debug.DebugView;
import io.narrata.core.flow.FlowNotFoundException;
import io.narrata.core.state.ConsoleEntry;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionLogEntry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command that steps a flow until it finishes or cannot go on.
///
/// Dialogues are answered from `--choose` in order. The run stops at the end
/// of the flow, after a node carrying a breakpoint, at the step limit, on a
/// stall, or at a dialogue with no response left to give.
///
/// ### Usage
/// ```bash
/// narrata run [-d <working-dir>] [-p <project>] [-v] [--choose r1,r2]
///             [--break node] [--max-steps n] [--export file] <flowId>
/// ```
///
/// Exits with `0` when the flow finished, `2` when it stopped early and `1` on errors.
@Command(name = "run", description = "Step a flow from its entry node to the end")
class RunCommand extends SessionCommand {

    private static final Logger logger = Logger.getLogger(RunCommand.class.getName());

    static final int STOPPED = 2;

    @Option(
            names = {"-c", "--choose"},
            split = ",",
            description = "Response ids to pick at dialogues, in order")
    private List<String> choices;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        ViewPrinter printer = createPrinter();
        try (NarrataEnvironment environment = openEnvironment()) {
            DebugSession session = environment.openSession(flowId, startNodeId);
            session.setListener(createListener());
            breakpointNodes().forEach(session::toggleBreakpoint);

            System.out.printf(
                    "%s %s%n%n", styles.checkmark(), styles.bold("Running flow: " + flowId));
            Deque<String> pending = new ArrayDeque<>();
            if (choices != null) {
                pending.addAll(choices);
            }
            String stopReason = drive(session, pending, printer);

            DebugView view = session.view();
            System.out.println();
            printer.printStatus(view);
            System.out.printf("%n%s%n", styles.bold("  Trace:"));
            printer.printTrace(view);
            System.out.printf("%n%s%n", styles.bold("  Changes:"));
            printer.printChanges(view);
            if (exportPath != null) {
                export(view, exportPath);
            }

            if (stopReason == null) {
                System.out.printf("%n%s %s%n", styles.checkmark(), styles.bold("Flow finished"));
                return 0;
            }
            System.out.printf("%n%s %s%n", styles.warn("!"), styles.bold("Stopped: " + stopReason));
            return STOPPED;
        } catch (FlowNotFoundException | IllegalStateException | IllegalArgumentException e) {
            System.err.printf("%s %s %s%n", styles.crossmark(), styles.bold("Run failed:"),
                    e.getMessage());
            return 1;
        }
    }

    /// Steps the session until it finishes or stops.
    ///
    /// @return why the run stopped early, or null when the flow finished
    private String drive(DebugSession session, Deque<String> pending, ViewPrinter printer) {
        DebugView view = session.view();
        while (!view.isFinished()) {
            if (view.stepLimitReached()) {
                return "step limit of " + view.maxSteps() + " reached";
            }
            if (view.isWaitingForInput()) {
                printer.printChoices(view);
                if (pending.isEmpty()) {
                    return "waiting for a response at " + view.currentNodeId();
                }
                String responseId = pending.poll();
                view = session.chooseResponse(responseId);
                if (view.isWaitingForInput()) {
                    return "response " + responseId + " was refused";
                }
                continue;
            }

            int stepsBefore = view.stepCount();
            int consoleBefore = view.console().size();
            view = session.step();
            if (hasErrorSince(view, consoleBefore)) {
                return "stalled at " + view.currentNodeId();
            }
            String executed = lastExecuted(view);
            if (executed != null && view.breakpoints().contains(executed)) {
                return "breakpoint at " + executed;
            }
            if (view.stepCount() == stepsBefore && !view.isWaitingForInput()
                    && !view.isFinished() && !view.stepLimitReached()) {
                logger.warning("Step made no progress at " + view.currentNodeId());
                return "no progress at " + view.currentNodeId();
            }
        }
        return null;
    }

    private static boolean hasErrorSince(DebugView view, int consoleBefore) {
        List<ConsoleEntry> console = view.console();
        for (int i = consoleBefore; i < console.size(); i++) {
            if (console.get(i).level() == ConsoleLevel.ERROR) {
                return true;
            }
        }
        return false;
    }

    private static String lastExecuted(DebugView view) {
        List<ExecutionLogEntry> log = view.executionLog();
        return log.isEmpty() ? null : log.get(log.size() - 1).nodeId();
    }
}
