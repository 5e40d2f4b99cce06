package com.docbinder.core.assembly;

import com.docbinder.core.tree.Node;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of inlining a document and everything its toctrees include.
 *
 * @param tree composite tree, owned by the caller
 * @param consumedDocuments DocumentIDs inlined into the tree, root first
 */
public record AssembledTree(Node tree, Set<String> consumedDocuments) {

    public AssembledTree {
        Objects.requireNonNull(tree, "tree must not be null");
        consumedDocuments = Collections.unmodifiableSet(new LinkedHashSet<>(consumedDocuments));
    }

    public boolean isLocal(String docname) {
        return consumedDocuments.contains(docname);
    }
}
