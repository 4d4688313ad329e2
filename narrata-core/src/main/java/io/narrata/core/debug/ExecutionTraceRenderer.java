package io.narrata.core.debug;

import io.narrata.core.state.ExecutionLogEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Turns an execution log into display lines.
///
/// A depth increase between two entries inserts an "Entering sub-flow"
/// separator, a decrease inserts one "Returning from sub-flow" separator per
/// level left.
public final class ExecutionTraceRenderer {

    private static final String INDENT = "  ";

    /// A rendered trace line.
    ///
    /// @param kind line kind, not null
    /// @param depth call-stack depth the line is shown at
    /// @param nodeId visited node for {@link Kind#NODE} lines, else null
    /// @param flowId flow of the line
    /// @param text display text, not null
    public record TraceLine(Kind kind, int depth, String nodeId, String flowId, String text) {

        public TraceLine {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        public enum Kind {
            NODE,
            ENTER,
            RETURN
        }
    }

    public List<TraceLine> lines(List<ExecutionLogEntry> executionLog) {
        List<TraceLine> lines = new ArrayList<>();
        int previousDepth = 0;
        int index = 0;
        for (ExecutionLogEntry entry : executionLog) {
            int depth = entry.depth();
            if (depth > previousDepth) {
                lines.add(new TraceLine(
                        TraceLine.Kind.ENTER, previousDepth, null, entry.flowId(),
                        "Entering sub-flow " + entry.flowId()));
            }
            for (int level = previousDepth; level > depth; level--) {
                lines.add(new TraceLine(
                        TraceLine.Kind.RETURN, level - 1, null, entry.flowId(),
                        "Returning from sub-flow"));
            }
            ++index;
            String label = entry.nodeLabel() != null ? entry.nodeLabel() : entry.nodeId();
            lines.add(new TraceLine(
                    TraceLine.Kind.NODE, depth, entry.nodeId(), entry.flowId(),
                    index + ". " + label));
            previousDepth = depth;
        }
        return lines;
    }

    /// Renders the log as indented text, one line per entry.
    public String render(List<ExecutionLogEntry> executionLog) {
        return lines(executionLog).stream()
                .map(line -> INDENT.repeat(line.depth()) + line.text())
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
