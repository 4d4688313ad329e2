package io.narrata.serialization;

import io.narrata.core.sheet.SheetRepository;
import io.narrata.core.variable.VariableStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/// Sheet repository backed by one JSON variable file per project.
///
/// The variables of project `demo` live in `<directory>/demo.json` as an
/// array of variables. A project without a file has no variables.
public final class JsonSheetRepository implements SheetRepository {

    private static final Logger logger = Logger.getLogger(JsonSheetRepository.class.getName());

    private final Path directory;

    /// @param directory directory holding variable files, not null
    public JsonSheetRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public VariableStore buildInitialVariables(String projectId) {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Path file = fileOf(projectId);
        if (!Files.isRegularFile(file)) {
            logger.fine("No variable file for project " + projectId);
            return VariableStore.empty();
        }
        try {
            return FlowSerializer.variablesFromJson(Files.readString(file)).reset();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read variable file " + file, e);
        }
    }

    /// Writes the variables of a project, replacing the existing file.
    ///
    /// Variables are reset to their initial values before writing.
    ///
    /// @param projectId project identifier, not null
    /// @param variables variables to write, not null
    /// @throws UncheckedIOException if the file cannot be written
    public void save(String projectId, VariableStore variables) {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        Path file = fileOf(projectId);
        try {
            Files.createDirectories(directory);
            Files.writeString(file, FlowSerializer.variablesToJson(variables.reset()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write variable file " + file, e);
        }
        logger.info("Saved " + variables.size() + " variable(s) of project " + projectId);
    }

    private Path fileOf(String projectId) {
        return directory.resolve(projectId + ".json");
    }
}
