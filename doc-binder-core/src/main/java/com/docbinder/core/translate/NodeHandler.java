package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;

/**
 * Per-kind hook of the {@link TranslationPass}.
 *
 * <p>Handlers carry no state of their own; everything that must survive between nodes
 * lives in the {@link TranslationContext}.
 */
@FunctionalInterface
public interface NodeHandler {

    /**
     * Called before the node's children are walked.
     *
     * @param node visited node, still attached to the tree
     * @param context state of the current walk
     * @return what the walker should do next
     */
    Visit enter(Node node, TranslationContext context);

    /**
     * Called after the node's children were walked. Not called for replaced nodes.
     *
     * @param node visited node
     * @param context state of the current walk
     */
    default void leave(Node node, TranslationContext context) {
    }
}
