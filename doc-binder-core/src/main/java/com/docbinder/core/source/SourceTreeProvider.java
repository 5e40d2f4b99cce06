package com.docbinder.core.source;

import com.docbinder.core.tree.Node;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Supplies the parsed tree of every source document and the navigation graph between them.
 *
 * <p>Trees returned by {@link #getTree(String)} may be shared, cached instances. Callers that
 * intend to modify a tree must work on a {@link Node#deepCopy()}.
 *
 * @see JsonSourceTreeProvider
 */
public interface SourceTreeProvider {

    /**
     * Returns the parsed tree of a document.
     *
     * @param docname DocumentID
     * @return root {@code document} node of the tree
     * @throws UnknownDocumentException if the document is not known
     * @throws SourceTreeException if the document is known but cannot be read
     */
    Node getTree(String docname);

    /**
     * Returns all documents this provider can supply.
     *
     * @return known DocumentIDs
     */
    Set<String> allKnownDocuments();

    /**
     * Returns the toctree graph between known documents.
     *
     * @return navigation graph snapshot
     */
    NavigationGraph navigationGraph();

    /**
     * Returns the known documents whose tree could not be read while building the
     * navigation graph.
     *
     * @return unreadable DocumentIDs, empty by default
     */
    default Set<String> unreadableDocuments() {
        return Set.of();
    }

    default boolean isKnown(String docname) {
        return allKnownDocuments().contains(docname);
    }

    /**
     * Returns when a document's source was last modified, if the provider tracks it.
     *
     * @param docname DocumentID
     * @return modification time, empty if unknown
     */
    default Optional<Instant> lastModified(String docname) {
        return Optional.empty();
    }
}
