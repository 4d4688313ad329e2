package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.narrata.core.debug.DebugView;
import java.time.Clock;
import java.util.Objects;

/// Writes debug session views as JSON for bug reports and offline inspection.
///
/// The export carries the status, variables, console, execution log, change
/// history and call stack of the session. Export is one-way; a session is not
/// restored from it.
public final class SessionSerializer {

    private SessionSerializer() {}

    /// Exports a session view stamped with the current time.
    ///
    /// @param view the view to export, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(DebugView view) {
        return toJson(view, Clock.systemUTC());
    }

    /// Exports a session view stamped with the given clock's time.
    ///
    /// @param view the view to export, not null
    /// @param clock clock providing the export timestamp, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(DebugView view, Clock clock) {
        Objects.requireNonNull(view, "view must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        try {
            return FlowSerializer.createMapper()
                    .writeValueAsString(new SessionExport(clock.instant(), view));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize session: " + e.getMessage(), e);
        }
    }
}
