package io.narrata.core.execution;

import io.narrata.core.execution.executor.Transition;
import io.narrata.core.flow.node.Node;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ConsoleEntry;

/// Listener for debug session events.
///
/// All methods have default no-op implementations, allowing listeners to
/// override only the events they care about.
///
/// ### Callback Lifecycle
/// Each step triggers callbacks in this order:
///
/// ```
/// onNodeStart(node)              - about to execute node
/// onConsoleEntry(entry)          - zero or more, as the node logs
/// onVariableChanged(change)      - zero or more, as assignments apply
/// onNodeComplete(node, result)   - node executed, transition not yet applied
/// ```
///
/// Session-level events ({@link #onConsoleEntry} for user overrides,
/// {@link #onAutoPlayStopped}) may arrive outside a step.
///
/// @implNote Callbacks run on the thread that drives the session, which is
/// the auto-play scheduler thread during auto-play. Callbacks run while the
/// session lock is held and must not call back into the session.
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    /// Called when a node is about to execute.
    ///
    /// @param node the node being executed, not null
    default void onNodeStart(Node node) {}

    /// Called when a node has executed.
    ///
    /// @param node the executed node, not null
    /// @param transition where execution goes next, not null
    default void onNodeComplete(Node node, Transition transition) {}

    /// Called for every console entry appended to the session.
    ///
    /// @param entry the new entry, not null
    default void onConsoleEntry(ConsoleEntry entry) {}

    /// Called for every variable change, whether from an assignment or an override.
    ///
    /// @param change the recorded change, not null
    default void onVariableChanged(ChangeRecord change) {}

    /// Called when auto-play stops on its own or is paused.
    ///
    /// @param reason short description such as `finished` or `breakpoint`, not null
    default void onAutoPlayStopped(String reason) {}
}
