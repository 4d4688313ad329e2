package io.narrata.core.autocomplete;

import java.util.Objects;

/// One autocomplete candidate.
///
/// @param label text shown in the list, not null
/// @param apply full reference text inserted on accept, not null
/// @param kind namespace level of the candidate, not null
/// @param detail type annotation such as `(number)`, or null
public record Completion(String label, String apply, Kind kind, String detail) {

    public Completion {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(apply, "apply must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public enum Kind {
        SHEET,
        VARIABLE,
        TABLE,
        ROW,
        COLUMN
    }
}
