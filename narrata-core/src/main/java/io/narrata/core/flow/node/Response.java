package io.narrata.core.flow.node;

import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.Condition;
import java.util.List;
import java.util.Objects;

/// A player response offered by a {@link DialogueNode}.
///
/// @param id response identifier, also names the output pin, not null
/// @param text response text shown to the player, may be null
/// @param condition availability condition, empty when always available
/// @param instruction assignments applied when the response is chosen
public record Response(
        String id, String text, Condition condition, List<Assignment> instruction) {

    public Response {
        Objects.requireNonNull(id, "id must not be null");
        condition = condition != null ? condition : Condition.empty();
        instruction = instruction != null ? List.copyOf(instruction) : List.of();
    }

    public static Response of(String id, String text) {
        return new Response(id, text, Condition.empty(), List.of());
    }
}
