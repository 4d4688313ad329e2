package io.narrata.core.flow;

import java.util.Objects;

/// A directed edge from an output pin of one node to an input pin of another.
public record Connection(
        String sourceNodeId, String sourcePin, String targetNodeId, String targetPin) {

    public Connection {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId must not be null");
        Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
        sourcePin = sourcePin != null ? sourcePin : Pins.DEFAULT;
        targetPin = targetPin != null ? targetPin : Pins.INPUT;
    }

    public static Connection of(String sourceNodeId, String sourcePin, String targetNodeId) {
        return new Connection(sourceNodeId, sourcePin, targetNodeId, Pins.INPUT);
    }
}
