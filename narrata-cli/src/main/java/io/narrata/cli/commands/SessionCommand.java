package io.narrata.cli.commands;

import io.narrata.cli.execution.ConsoleExecutionListener;
import io.narrata.cli.ui.ViewPrinter;
import io.narrata.core.NarrataConfig;
import io.narrata.core.debug.DebugView;
import io.narrata.serialization.SessionSerializer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for commands that open a debug session on a flow.
///
/// @see RunCommand
/// @see DebugReplCommand
public abstract class SessionCommand extends ProjectCommand {

    @Parameters(index = "0", description = "Flow to debug")
    protected String flowId;

    @Option(names = {"-s", "--start"}, description = "Node to start at instead of the entry node")
    protected String startNodeId;

    @Option(names = {"-b", "--break"}, split = ",", description = "Nodes to set breakpoints on")
    protected List<String> breakpoints;

    @Option(names = {"--max-steps"}, description = "Step limit of the session")
    protected Integer maxSteps;

    @Option(names = {"-e", "--export"}, description = "Write the final session state as JSON")
    protected Path exportPath;

    @Override
    protected NarrataConfig loadConfig() {
        NarrataConfig config = super.loadConfig();
        if (maxSteps != null) {
            config.setMaxSteps(maxSteps);
        }
        return config;
    }

    /// Returns the breakpoints given with `--break`, never null.
    protected List<String> breakpointNodes() {
        return breakpoints != null ? breakpoints : List.of();
    }

    protected ConsoleExecutionListener createListener() {
        return new ConsoleExecutionListener(System.out, styles(), verbose);
    }

    protected ViewPrinter createPrinter() {
        return new ViewPrinter(System.out, styles());
    }

    /// Writes the view to `path` as a session export.
    ///
    /// @throws UncheckedIOException if the file cannot be written
    protected void export(DebugView view, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, SessionSerializer.toJson(view));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        System.out.println("  Session exported to " + path);
    }
}
