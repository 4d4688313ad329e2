package io.narrata.cli.commands;

import io.narrata.cli.ui.AnsiStyles;
import io.narrata.cli.ui.ViewPrinter;
import io.narrata.core.NarrataEnvironment;
import io.narrata.core.debug.DebugCommand;
import io.narrata.core.debug.DebugSession;
import io.narrata.core.debug.DebugView;
import io.narrata.core.flow.FlowNotFoundException;
import io.narrata.core.state.PendingChoice;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import picocli.CommandLine.Command;

/// Interactive debugger reading commands from standard input.
///
/// Opens a paused session on the flow and applies one command per line until
/// `quit` or end of input. Type `help` at the prompt for the command list.
///
/// ### Usage
/// ```bash
/// narrata debug [-d <working-dir>] [-p <project>] [-v] [--break node] <flowId>
/// ```
///
/// @see DebugInputParser for the session commands
@Command(name = "debug", description = "Debug a flow interactively")
class DebugReplCommand extends SessionCommand {

    private static final String PROMPT = "narrata> ";

    private static final String[] HELP = {
        "  step | s            execute the current node",
        "  back | b            undo the last step or choice",
        "  play [ms] | pause   start or stop auto-play",
        "  break <node>        toggle a breakpoint",
        "  choose <id> | <n>   pick a dialogue response",
        "  set <var> <value>   override a variable",
        "  continue            raise the step limit",
        "  reset               restart the session",
        "  status | vars | trace | changes",
        "  export <file>       write the session as JSON",
        "  quit"
    };

    private final DebugInputParser inputParser = new DebugInputParser();

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        ViewPrinter printer = createPrinter();
        try (NarrataEnvironment environment = openEnvironment()) {
            DebugSession session = environment.openSession(flowId, startNodeId);
            session.setListener(createListener());
            breakpointNodes().forEach(session::toggleBreakpoint);

            System.out.printf("%s %s%n", styles.checkmark(), styles.bold("Debugging flow: " + flowId));
            System.out.println(styles.gray("  Type 'help' for commands"));
            printer.printStatus(session.view());

            BufferedReader reader =
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            loop(session, reader, printer, styles);

            if (exportPath != null) {
                export(session.view(), exportPath);
            }
            return 0;
        } catch (FlowNotFoundException | IllegalStateException e) {
            System.err.printf("%s %s %s%n", styles.crossmark(), styles.bold("Debug failed:"),
                    e.getMessage());
            return 1;
        }
    }

    private void loop(DebugSession session, BufferedReader reader, ViewPrinter printer,
            AnsiStyles styles) {
        while (true) {
            System.out.print(PROMPT);
            System.out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read input", e);
            }
            if (line == null) {
                System.out.println();
                return;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                if (!handle(line, session, printer)) {
                    return;
                }
            } catch (IllegalArgumentException e) {
                System.out.println("  " + styles.warn(e.getMessage()));
            }
        }
    }

    /// Handles one input line.
    ///
    /// @return false when the user asked to quit
    private boolean handle(String line, DebugSession session, ViewPrinter printer) {
        String[] parts = line.split("\\s+", 2);
        String verb = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        switch (verb) {
            case "quit", "exit", "q" -> {
                return false;
            }
            case "help", "?" -> {
                for (String help : HELP) {
                    System.out.println(help);
                }
            }
            case "status" -> {
                DebugView view = session.view();
                printer.printStatus(view);
                printer.printChoices(view);
            }
            case "vars" -> printer.printVariables(session.view());
            case "trace" -> printer.printTrace(session.view());
            case "changes" -> printer.printChanges(session.view());
            case "export" -> {
                if (argument.isEmpty()) {
                    throw new IllegalArgumentException("Usage: export <file>");
                }
                export(session.view(), Path.of(argument));
            }
            case "play" -> {
                if (!argument.isEmpty()) {
                    session.setAutoPlayDelay(parseDelay(argument));
                }
                DebugView view = session.play();
                System.out.println("  Auto-play " + (view.autoPlaying()
                        ? "every " + view.autoPlayDelayMillis() + " ms"
                        : "not started"));
            }
            default -> {
                List<String> responseIds = session.view().pendingChoices().stream()
                        .map(PendingChoice::responseId)
                        .toList();
                Optional<DebugCommand> command = inputParser.parse(line, responseIds);
                if (command.isEmpty()) {
                    throw new IllegalArgumentException("Unknown command: " + verb + " (try 'help')");
                }
                DebugView view = session.apply(command.get());
                printer.printStatus(view);
                if (view.isWaitingForInput()) {
                    printer.printChoices(view);
                }
            }
        }
        return true;
    }

    private static long parseDelay(String argument) {
        try {
            return Long.parseLong(argument);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Delay must be a number of milliseconds: " + argument, e);
        }
    }
}
