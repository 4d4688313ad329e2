package io.narrata.cli.ui;

import io.narrata.core.flow.FlowIssue;
import io.narrata.core.state.ConsoleLevel;

/// ANSI text styling for CLI output with semantic color methods.
///
/// All methods return styled strings; output handling is the caller's responsibility.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);  // color enabled
/// System.out.println(styles.level(ConsoleLevel.WARNING, "warning") + " Condition → false");
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Applies gray color for secondary elements such as node ids and rule details.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors text by console severity: info plain, warning yellow, error red.
    public String level(ConsoleLevel level, String text) {
        return switch (level) {
            case INFO -> text;
            case WARNING -> warn(text);
            case ERROR -> error(text);
        };
    }

    /// Colors text by validation severity.
    public String severity(FlowIssue.Severity severity, String text) {
        return severity == FlowIssue.Severity.ERROR ? error(text) : warn(text);
    }

    /// Colors green when a rule passed, red otherwise.
    public String passOrFail(String text, boolean passed) {
        return style(text, passed ? GREEN : RED);
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    /// Marker for a node carrying a breakpoint.
    public String breakpoint() {
        return style("●", RED);
    }
}
