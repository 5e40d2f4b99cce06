package com.docbinder.core.assembly;

import com.docbinder.core.report.BuildWarnings;
import com.docbinder.core.source.SourceTreeException;
import com.docbinder.core.source.SourceTreeProvider;
import com.docbinder.core.source.UnknownDocumentException;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inlines included documents into a host tree, producing one composite tree.
 *
 * <p>Starting from a deep copy of the root tree, every {@code toctree} placeholder is
 * replaced, in place and in order, by one {@code start_of_file} wrapper per entry of its
 * {@code includefiles} attribute. A wrapper carries the included DocumentID and the
 * children of that document's own (recursively assembled) tree.
 *
 * <p>Every inclusion is a fresh deep copy, so a document included twice yields two
 * independent subtrees and the provider's cached trees are never modified.
 *
 * <p><b>Error handling:</b>
 * <ul>
 *   <li>An entry naming an unknown document is reported once through {@link BuildWarnings}
 *       and omitted.</li>
 *   <li>An entry whose tree cannot be loaded is reported the same way and omitted.</li>
 *   <li>A cyclic toctree, or a chain deeper than {@code maxDepth}, raises
 *       {@link AssemblyException}.</li>
 * </ul>
 */
public class TreeAssembler {

    private static final Logger log = LoggerFactory.getLogger(TreeAssembler.class);

    public static final String INCLUDEFILES = "includefiles";
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final SourceTreeProvider provider;
    private final BuildWarnings warnings;
    private final int maxDepth;

    public TreeAssembler(SourceTreeProvider provider, BuildWarnings warnings, int maxDepth) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public TreeAssembler(SourceTreeProvider provider, BuildWarnings warnings) {
        this(provider, warnings, DEFAULT_MAX_DEPTH);
    }

    /**
     * Assembles the composite tree of a root document.
     *
     * @param rootDocname root DocumentID
     * @return composite tree and consumed documents
     * @throws UnknownDocumentException if the root itself is unknown
     * @throws SourceTreeException if the root tree cannot be loaded
     * @throws AssemblyException if the toctree structure is cyclic or too deep
     */
    public AssembledTree assemble(String rootDocname) {
        log.info("Assembling {}", rootDocname);
        Set<String> consumed = new LinkedHashSet<>();
        consumed.add(rootDocname);
        Deque<String> chain = new ArrayDeque<>();
        Node tree = processTree(rootDocname, provider.getTree(rootDocname), consumed, chain);
        tree.set(Node.DOCNAME, rootDocname);
        log.debug("Assembled {} from {} documents", rootDocname, consumed.size());
        return new AssembledTree(tree, consumed);
    }

    private Node processTree(String docname, Node source, Set<String> consumed, Deque<String> chain) {
        if (chain.contains(docname)) {
            throw new AssemblyException("Cyclic toctree: " + String.join(" -> ", chain) + " -> " + docname);
        }
        if (chain.size() >= maxDepth) {
            throw new AssemblyException("Toctree nesting deeper than " + maxDepth + " below " + chain.peekFirst());
        }
        chain.addLast(docname);
        try {
            Node tree = source.deepCopy();
            for (Node toctree : tree.traverse(NodeKind.TOCTREE)) {
                List<Node> wrappers = new ArrayList<>();
                for (String include : List.copyOf(toctree.getList(INCLUDEFILES))) {
                    Node subtree;
                    try {
                        subtree = processTree(include, provider.getTree(include), consumed, chain);
                    } catch (UnknownDocumentException e) {
                        warnings.warn(log, "{}: toctree contains ref to nonexisting file '{}'", docname, include);
                        continue;
                    } catch (SourceTreeException e) {
                        warnings.warn(log, "{}: toctree entry '{}' could not be loaded: {}", docname, include, e.getMessage());
                        continue;
                    }
                    log.debug("Inlining {} into {}", include, docname);
                    consumed.add(include);
                    Node startOfFile = Node.of(NodeKind.START_OF_FILE).set(Node.DOCNAME, include);
                    startOfFile.appendAll(subtree.takeChildren());
                    wrappers.add(startOfFile);
                }
                if (toctree.parent() != null) {
                    toctree.replaceSelf(wrappers);
                }
            }
            return tree;
        } finally {
            chain.removeLast();
        }
    }
}
