package io.narrata.core.execution;

/// Result of asking the engine to perform a step or resolve a choice.
public enum StepOutcome {
    /// Execution moved to another node.
    ADVANCED,
    /// A dialogue is waiting for the player to choose a response.
    WAITING_INPUT,
    /// The session reached its end.
    FINISHED,
    /// The node could not be left; an error entry explains why.
    STALLED,
    /// Nothing happened: the session is finished, waiting, or at its step limit.
    REFUSED
}
