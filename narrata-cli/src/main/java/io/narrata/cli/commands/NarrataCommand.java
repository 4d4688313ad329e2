package io.narrata.cli.commands;

import io.narrata.cli.ui.AnsiStyles;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;

/// Minimal abstract base for all Narrata CLI commands.
///
/// Owns the shared `--verbose` and `--no-color` options, the banner and the
/// {@link #call()} / {@link #execute()} contract. The value returned by
/// {@link #execute()} is the process exit code.
///
/// @see ProjectCommand
public abstract class NarrataCommand implements Callable<Integer> {

    private static final String[] BANNER = {
        "",
        "  _ __   __ _ _ __ _ __ __ _| |_ __ _",
        " | '_ \\ / _` | '__| '__/ _` | __/ _` |",
        " | | | | (_| | |  | | | (_| | || (_| |",
        " |_| |_|\\__,_|_|  |_|  \\__,_|\\__\\__,_|",
        "",
        " Narrative flow debugger",
        ""
    };

    @Option(
            names = {"-v", "--verbose"},
            description = "Show rule details, variable changes and FINE engine logs")
    protected boolean verbose = false;

    @Option(names = {"--no-color"}, description = "Disable colored output", negatable = true)
    protected boolean color = true;

    @Override
    public final Integer call() {
        NarrataCli.applyVerbosity(verbose);
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    /// Runs the command.
    ///
    /// @return process exit code, `0` on success
    protected abstract int execute();

    /// Whether the banner is printed before the command output.
    ///
    /// Commands whose output is meant for scripts return false.
    protected boolean showBanner() {
        return true;
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(color);
    }
}
