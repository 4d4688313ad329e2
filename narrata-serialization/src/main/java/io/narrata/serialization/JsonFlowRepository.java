package io.narrata.serialization;

import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.FlowRepository;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Flow repository backed by a directory of JSON flow files.
///
/// Every `*.json` file in the directory holds one flow. Files are read
/// lazily on first access and cached; {@link #save(FlowGraph)} writes
/// `<flowId>.json` and updates the cache.
///
/// @implNote Thread-safe. The cache is a ConcurrentHashMap and loading is
/// synchronized.
public final class JsonFlowRepository implements FlowRepository {

    private static final Logger logger = Logger.getLogger(JsonFlowRepository.class.getName());

    private final Path directory;
    private final Map<String, FlowGraph> cache = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    /// @param directory directory holding flow files, not null; created on first save
    public JsonFlowRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public Optional<FlowGraph> getFlowGraph(String flowId) {
        Objects.requireNonNull(flowId, "flowId must not be null");
        ensureLoaded();
        return Optional.ofNullable(cache.get(flowId));
    }

    @Override
    public void save(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        ensureLoaded();
        Path file = directory.resolve(graph.getId() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, FlowSerializer.toJson(graph));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write flow file " + file, e);
        }
        cache.put(graph.getId(), graph);
        logger.info("Saved flow " + graph.getId() + " to " + file);
    }

    @Override
    public List<FlowGraph> findAll() {
        ensureLoaded();
        List<FlowGraph> flows = new ArrayList<>(cache.values());
        flows.sort(Comparator.comparing(FlowGraph::getId));
        return flows;
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (this) {
            if (loaded) {
                return;
            }
            if (Files.isDirectory(directory)) {
                loadDirectory();
            } else {
                logger.warning("Flow directory does not exist: " + directory);
            }
            loaded = true;
        }
    }

    private void loadDirectory() {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                FlowGraph graph = readFlow(file);
                FlowGraph previous = cache.putIfAbsent(graph.getId(), graph);
                if (previous != null) {
                    logger.warning("Duplicate flow id " + graph.getId() + " in " + file
                            + ", keeping the first one");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list flow directory " + directory, e);
        }
        logger.info("Loaded " + cache.size() + " flow(s) from " + directory);
    }

    private static FlowGraph readFlow(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read flow file " + file, e);
        }
        try {
            return FlowSerializer.fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
