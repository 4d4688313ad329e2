package io.narrata.cli.commands;

import io.narrata.core.NarrataConfig;
import io.narrata.core.NarrataEnvironment;
import io.narrata.core.NarrataFactory;
import io.narrata.serialization.JsonFlowRepository;
import io.narrata.serialization.JsonSheetRepository;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import picocli.CommandLine.Option;

/// Base class for commands that work on a project directory.
///
/// ### Project Layout
/// ```
/// <working-dir>/
///   narrata.properties      optional, see NarrataConfig keys
///   flows/<flowId>.json     one flow per file
///   sheets/<projectId>.json variables of a project
/// ```
///
/// ### Working Directory Resolution
/// 1. CLI option `-d` / `--working-dir`
/// 2. Current directory (`.`)
///
/// The project id comes from `-p` / `--project`, then `narrata.project-id`
/// in `narrata.properties`, then `default`.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
public abstract class ProjectCommand extends NarrataCommand {

    static final String CONFIG_FILE = "narrata.properties";
    static final String FLOWS_DIR = "flows";
    static final String SHEETS_DIR = "sheets";

    @Option(
            names = {"-d", "--working-dir"},
            description = "Project directory containing flows/ and sheets/")
    protected Path workingDirPath;

    @Option(
            names = {"-p", "--project"},
            description = "Project whose variables seed the session")
    protected String projectId;

    /// Returns the effective project directory, never null.
    protected Path getWorkingDirectory() {
        Path effective = workingDirPath != null ? workingDirPath : Path.of(".");
        return effective.toAbsolutePath().normalize();
    }

    /// Reads `narrata.properties` from the project directory and applies CLI overrides.
    ///
    /// @return configuration, never null
    /// @throws UncheckedIOException if the properties file exists but cannot be read
    /// @throws IllegalArgumentException if a property has an invalid value
    protected NarrataConfig loadConfig() {
        Properties properties = new Properties();
        Path file = getWorkingDirectory().resolve(CONFIG_FILE);
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                properties.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
        }
        NarrataConfig config = NarrataConfig.fromProperties(properties);
        if (projectId != null && !projectId.isBlank()) {
            config.setProjectId(projectId.trim());
        }
        return config;
    }

    /// Wires an environment over the project's JSON flow and sheet files.
    ///
    /// @return a new environment the caller must close, never null
    protected NarrataEnvironment openEnvironment() {
        return openEnvironment(loadConfig());
    }

    protected NarrataEnvironment openEnvironment(NarrataConfig config) {
        Path root = getWorkingDirectory();
        return NarrataFactory.bootstrap(
                config,
                new JsonFlowRepository(root.resolve(FLOWS_DIR)),
                new JsonSheetRepository(root.resolve(SHEETS_DIR)));
    }
}
