package io.narrata.cli.ui;

import io.narrata.core.debug.DebugView;
import io.narrata.core.debug.ExecutionTraceRenderer;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.PendingChoice;
import io.narrata.core.variable.Values;
import io.narrata.core.variable.Variable;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Renders parts of a {@link DebugView} as terminal text.
public final class ViewPrinter {

    private final PrintStream out;
    private final AnsiStyles styles;
    private final ExecutionTraceRenderer traceRenderer = new ExecutionTraceRenderer();

    public ViewPrinter(PrintStream out, AnsiStyles styles) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
    }

    /// Prints `status • node • steps n/max`, plus the call stack depth when inside a sub-flow.
    public void printStatus(DebugView view) {
        StringBuilder line = new StringBuilder("  ")
                .append(styles.bold(view.status().id()))
                .append(' ').append(styles.bullet()).append(' ')
                .append(view.currentFlowName()).append(" / ").append(view.currentNodeId())
                .append(' ').append(styles.bullet()).append(' ')
                .append("steps ").append(view.stepCount()).append('/').append(view.maxSteps());
        if (!view.callStack().isEmpty()) {
            line.append(' ').append(styles.bullet()).append(" depth ").append(view.callStack().size());
        }
        if (view.breakpoints().contains(view.currentNodeId())) {
            line.append(' ').append(styles.breakpoint());
        }
        out.println(line);
        if (view.stepLimitReached()) {
            out.println("  " + styles.warn("Step limit reached; use 'continue' to allow more steps"));
        }
    }

    /// Prints the pending dialogue responses, marking unavailable ones.
    public void printChoices(DebugView view) {
        for (PendingChoice choice : view.pendingChoices()) {
            String text = choice.text() != null ? choice.text() : "";
            String mark = choice.valid() ? styles.checkmark() : styles.crossmark();
            String line = "    " + mark + " " + styles.bold(choice.responseId()) + "  " + text;
            out.println(choice.valid() ? line : line + styles.gray("  (unavailable)"));
        }
    }

    /// Prints every variable with its current value, flagging changed ones.
    public void printVariables(DebugView view) {
        for (Variable variable : view.variables().values()) {
            String value = Values.display(variable.getValue());
            boolean changed = !Objects.equals(variable.getValue(), variable.getInitialValue());
            String line = "    " + variable.getKey() + " = " + value;
            out.println(changed
                    ? styles.accent(line) + styles.gray(
                            "  (was " + Values.display(variable.getInitialValue()) + ", "
                                    + variable.getSource().id() + ")")
                    : line + styles.gray("  (" + variable.getType().id() + ")"));
        }
    }

    /// Prints the execution trace with sub-flow separators.
    public void printTrace(DebugView view) {
        if (view.executionLog().isEmpty()) {
            out.println("    (no nodes executed)");
            return;
        }
        for (String line : traceRenderer.render(view.executionLog()).split("\\R")) {
            out.println("    " + line);
        }
    }

    /// Prints the net change of every variable written during the session.
    public void printChanges(DebugView view) {
        Map<String, Object> before = new LinkedHashMap<>();
        Map<String, Object> after = new LinkedHashMap<>();
        for (ChangeRecord change : view.history()) {
            if (!before.containsKey(change.variableRef())) {
                before.put(change.variableRef(), change.oldValue());
            }
            after.put(change.variableRef(), change.newValue());
        }
        if (before.isEmpty()) {
            out.println("    (no variable changed)");
            return;
        }
        before.forEach((ref, oldValue) -> out.println("    " + ref + ": "
                + Values.display(oldValue) + " " + styles.arrow() + " "
                + Values.display(after.get(ref))));
    }
}
