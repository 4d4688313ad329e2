package io.narrata.core.flow.node;

import java.util.Objects;
import java.util.regex.Pattern;

/// Base class for all flow node types.
///
/// Each node type carries its own payload; the step engine dispatches on the
/// concrete class through {@link io.narrata.core.execution.executor.NodeExecutorRegistry}.
///
/// ### Node Types
/// - {@link EntryNode} / {@link ExitNode} - flow boundaries
/// - {@link DialogueNode} - line of dialogue with player responses
/// - {@link HubNode} / {@link SceneNode} - pass-through points
/// - {@link ConditionNode} - boolean or switch branching
/// - {@link InstructionNode} - variable assignments
/// - {@link JumpNode} / {@link SubflowNode} - calls into another flow
///
/// @implNote Subclasses must be immutable after construction.
public abstract class Node {

    private static final Pattern MARKUP = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_LABEL_LENGTH = 40;

    protected final String id;
    protected final String text;

    /// Creates a node.
    ///
    /// @param id node identifier, unique within its flow, not null
    /// @param text display text, may contain markup, may be null
    protected Node(String id, String text) {
        this.id = Objects.requireNonNull(id, "Node ID required");
        this.text = text;
    }

    public String getId() {
        return id;
    }

    /// Returns the raw display text, or null.
    public String getText() {
        return text;
    }

    public abstract NodeType getNodeType();

    /// Returns a short plain-text label for console and history entries.
    ///
    /// Markup is stripped, whitespace collapsed and the result truncated to 40
    /// characters. Falls back to the node type when the node has no text.
    ///
    /// @return label, never null or blank
    public String getLabel() {
        if (text != null) {
            String plain =
                    WHITESPACE
                            .matcher(unescape(MARKUP.matcher(text).replaceAll(" ")))
                            .replaceAll(" ")
                            .trim();
            if (!plain.isEmpty()) {
                return plain.length() > MAX_LABEL_LENGTH
                        ? plain.substring(0, MAX_LABEL_LENGTH)
                        : plain;
            }
        }
        String type = getNodeType().id();
        return Character.toUpperCase(type.charAt(0)) + type.substring(1);
    }

    private static String unescape(String html) {
        return html.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + '}';
    }
}
