package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;

import java.util.List;

/**
 * Outcome of entering a node.
 *
 * <p>A non-null {@code replacement} makes the walker splice those nodes in place of the
 * visited one; an empty list removes it. Unless {@code skipChildren} is set, the walker then
 * continues into the replacement nodes (or into the original node's children when there is
 * no replacement).
 *
 * @param replacement nodes taking the visited node's place, or null to keep it
 * @param skipChildren whether the walker must not descend
 */
public record Visit(List<Node> replacement, boolean skipChildren) {

    private static final Visit PROCEED = new Visit(null, false);
    private static final Visit SKIP = new Visit(null, true);
    private static final Visit REMOVE = new Visit(List.of(), true);

    public Visit {
        replacement = replacement == null ? null : List.copyOf(replacement);
    }

    public static Visit proceed() {
        return PROCEED;
    }

    public static Visit skip() {
        return SKIP;
    }

    public static Visit remove() {
        return REMOVE;
    }

    /** Replaces the node and walks into the replacement. */
    public static Visit replaceWith(Node... nodes) {
        return new Visit(List.of(nodes), false);
    }

    /** Replaces the node with content that is already translated. */
    public static Visit replaceFinal(Node... nodes) {
        return new Visit(List.of(nodes), true);
    }

    public boolean replaces() {
        return replacement != null;
    }
}
