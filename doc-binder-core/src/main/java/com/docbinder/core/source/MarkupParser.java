package com.docbinder.core.source;

import com.docbinder.core.tree.Node;

/**
 * Low-level parser turning small pieces of generated markup into a tree.
 *
 * <p>Used for synthetic content such as cover pages, whose text comes from a template.
 */
@FunctionalInterface
public interface MarkupParser {

    /**
     * Parses markup text.
     *
     * @param markup markup text
     * @return a {@code document} node holding the parsed content
     */
    Node parse(String markup);
}
