package io.narrata.cli.commands;

import io.narrata.core.debug.DebugCommand;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Turns a line typed at the debugger prompt into a {@link DebugCommand}.
///
/// | Input | Command |
/// |-------|---------|
/// | `step`, `s`, `n` | `Step` |
/// | `back`, `b` | `StepBack` |
/// | `play` | `Play` |
/// | `pause` | `Pause` |
/// | `break <node>` | `ToggleBreakpoint` |
/// | `set <key> <value>` | `SetVariable` |
/// | `choose <id>`, `c <id>`, a bare response number | `ChooseResponse` |
/// | `continue` | `ContinuePastLimit` |
/// | `reset` | `Reset` |
///
/// Session-independent verbs such as `vars` or `quit` are not commands and
/// yield an empty result.
final class DebugInputParser {

    /// Parses one input line.
    ///
    /// @param line trimmed, non-empty input
    /// @param responseIds ids of the pending responses, used to resolve `1`, `2`, ...
    /// @return the command, or empty if the verb is not a session command
    /// @throws IllegalArgumentException if a session command lacks its argument
    Optional<DebugCommand> parse(String line, List<String> responseIds) {
        String[] parts = line.trim().split("\\s+", 2);
        String verb = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        if (verb.chars().allMatch(Character::isDigit)) {
            int index = Integer.parseInt(verb) - 1;
            if (index < 0 || index >= responseIds.size()) {
                throw new IllegalArgumentException("No response number " + verb);
            }
            return Optional.of(new DebugCommand.ChooseResponse(responseIds.get(index)));
        }

        return switch (verb) {
            case "step", "s", "n" -> Optional.of(new DebugCommand.Step());
            case "back", "b" -> Optional.of(new DebugCommand.StepBack());
            case "play" -> Optional.of(new DebugCommand.Play());
            case "pause" -> Optional.of(new DebugCommand.Pause());
            case "continue" -> Optional.of(new DebugCommand.ContinuePastLimit());
            case "reset" -> Optional.of(new DebugCommand.Reset());
            case "break" -> Optional.of(new DebugCommand.ToggleBreakpoint(
                    require(argument, "break <nodeId>")));
            case "choose", "c" -> Optional.of(new DebugCommand.ChooseResponse(
                    require(argument, "choose <responseId>")));
            case "set" -> {
                String[] assignment = require(argument, "set <variable> <value>").split("\\s+", 2);
                yield Optional.of(new DebugCommand.SetVariable(
                        assignment[0], assignment.length > 1 ? assignment[1] : ""));
            }
            default -> Optional.empty();
        };
    }

    private static String require(String argument, String usage) {
        if (argument.isEmpty()) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
        return argument;
    }
}
