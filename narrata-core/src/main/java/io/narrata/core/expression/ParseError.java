package io.narrata.core.expression;

import java.util.Objects;

/// A syntax error with the character range it covers.
///
/// @param from start offset, inclusive
/// @param to end offset, exclusive; equals `from` at end of input
/// @param message human readable description, not null
public record ParseError(int from, int to, String message) {

    public ParseError {
        Objects.requireNonNull(message, "message must not be null");
    }
}
