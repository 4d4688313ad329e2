package io.narrata.cli.execution;

import io.narrata.cli.ui.AnsiStyles;
import io.narrata.core.evaluator.RuleResult;
import io.narrata.core.execution.ExecutionListener;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ConsoleEntry;
import io.narrata.core.variable.Values;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/// Execution listener that prints debug console entries to the terminal as they happen.
///
/// ### Output Format
/// ```
///   [info]    hit      Instruction → mc.jaime.health: 50 → 40
///   [warning] check    Condition → false (0 of 1 rules passed)
///               ✗ mc.jaime.health greater_than 100 (actual 40)
/// ```
///
/// Rule details and variable changes are printed only in verbose mode.
///
/// @implNote Output from the auto-play thread and the input thread may
/// interleave line by line; each entry is written with a single call.
public class ConsoleExecutionListener implements ExecutionListener {

    private final PrintStream out;
    private final AnsiStyles styles;
    private final boolean verbose;

    /// @param out output stream, typically System.out, not null
    /// @param styles styling to apply, not null
    /// @param verbose whether to print rule details and variable changes
    public ConsoleExecutionListener(PrintStream out, AnsiStyles styles, boolean verbose) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
        this.verbose = verbose;
    }

    @Override
    public void onConsoleEntry(ConsoleEntry entry) {
        StringBuilder line = new StringBuilder();
        String level = String.format(Locale.ROOT, "%-9s", "[" + entry.level().id() + "]");
        line.append("  ").append(styles.level(entry.level(), level)).append(' ');
        if (entry.nodeId() != null) {
            String label = entry.nodeLabel() != null ? entry.nodeLabel() : entry.nodeId();
            line.append(styles.gray(label)).append("  ");
        }
        line.append(entry.message());
        if (verbose) {
            for (RuleResult rule : entry.ruleDetails()) {
                line.append(System.lineSeparator()).append(formatRule(rule));
            }
        }
        out.println(line);
    }

    @Override
    public void onVariableChanged(ChangeRecord change) {
        if (!verbose) {
            return;
        }
        out.println("            " + styles.gray(change.variableRef() + " "
                + Values.display(change.oldValue()) + " → " + Values.display(change.newValue())
                + " (" + change.source().id() + ")"));
    }

    @Override
    public void onAutoPlayStopped(String reason) {
        out.println("  " + styles.accent("Auto-play stopped: " + reason));
    }

    private String formatRule(RuleResult rule) {
        String mark = rule.passed() ? styles.checkmark() : styles.crossmark();
        String text = rule.variableRef() + " " + rule.operator().id();
        if (rule.expectedValue() != null) {
            text += " " + Values.display(rule.expectedValue());
        }
        text += rule.resolved()
                ? " (actual " + Values.display(rule.actualValue()) + ")"
                : " (unresolved)";
        return "              " + mark + " " + styles.passOrFail(text, rule.passed());
    }
}
