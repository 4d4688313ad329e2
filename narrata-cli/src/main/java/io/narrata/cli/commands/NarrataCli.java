package io.narrata.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Narrata CLI application.
///
/// Registers all available subcommands:
/// - `parse` - Parse instruction or condition text and show the structured result
/// - `complete` - List autocomplete candidates for a partial variable reference
/// - `validate` - Check flows for dangling connections and missing targets
/// - `run` - Step a flow to its end, answering dialogues from `--choose`
/// - `debug` - Interactive debugger reading commands from standard input
///
/// Every command works on a project directory holding `flows/*.json`,
/// `sheets/<project>.json` and an optional `narrata.properties`.
///
/// @see ParseCommand
/// @see CompleteCommand
/// @see ValidateCommand
/// @see RunCommand
/// @see DebugReplCommand
@Command(
        name = "narrata",
        description = "Narrata flow debugger",
        mixinStandardHelpOptions = true,
        version = "narrata 0.1.0",
        subcommands = {
            ParseCommand.class,
            CompleteCommand.class,
            ValidateCommand.class,
            RunCommand.class,
            DebugReplCommand.class
        })
public class NarrataCli {

    static final String LOGGER_ROOT = "io.narrata";

    // Held strongly so the level set by --verbose is not lost to garbage collection.
    private static final Logger narrataLogger = Logger.getLogger(LOGGER_ROOT);

    public static void main(String[] args) {
        loadLoggingConfiguration();
        int exitCode = new CommandLine(new NarrataCli()).execute(args);
        System.exit(exitCode);
    }

    /// Reads `logging.properties` from the classpath into the JUL log manager.
    static void loadLoggingConfiguration() {
        try (InputStream in = NarrataCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read logging.properties", e);
        }
    }

    /// Raises Narrata loggers to `FINE` when verbose, otherwise leaves the configured level.
    static void applyVerbosity(boolean verbose) {
        if (verbose) {
            narrataLogger.setLevel(Level.FINE);
        }
    }
}
