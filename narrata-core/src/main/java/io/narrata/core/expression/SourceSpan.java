package io.narrata.core.expression;

/// Half-open character range `[from, to)` in expression text.
public record SourceSpan(int from, int to) {

    public SourceSpan {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid span [" + from + ", " + to + ")");
        }
    }

    public int length() {
        return to - from;
    }
}
