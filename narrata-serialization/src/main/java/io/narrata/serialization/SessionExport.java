package io.narrata.serialization;

import io.narrata.core.debug.DebugView;
import java.time.Instant;
import java.util.Objects;

/// A debug session snapshot as written by {@link SessionSerializer}.
///
/// @param exportedAt when the export was taken, not null
/// @param session the exported session view, not null
public record SessionExport(Instant exportedAt, DebugView session) {

    public SessionExport {
        Objects.requireNonNull(exportedAt, "exportedAt must not be null");
        Objects.requireNonNull(session, "session must not be null");
    }
}
