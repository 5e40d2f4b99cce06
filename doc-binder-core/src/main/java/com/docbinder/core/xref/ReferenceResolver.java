package com.docbinder.core.xref;

import com.docbinder.core.i18n.Labels;
import com.docbinder.core.index.IndexBuilder;
import com.docbinder.core.report.BuildWarnings;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces every {@code pending_xref} node of a composite tree by renderable content.
 *
 * <p>Attributes read from a pending reference, as provided by the host toolchain:
 * <ul>
 *   <li>{@code reftarget}: target name (label, document or {@code genindex})</li>
 *   <li>{@code reftype}: reference type ({@code ref}, {@code doc}, {@code token} ...)</li>
 *   <li>{@code refid}: anchor of the target inside its document, when known</li>
 *   <li>{@code refdocname}: DocumentID holding the target, when known</li>
 *   <li>{@code refsectname}: title of the target section, when known</li>
 *   <li>{@code refdoc}: DocumentID holding the reference itself</li>
 * </ul>
 *
 * <p>Resolution order: the general index (only when indexing is enabled and the index was
 * generated); an anchor present in the composite tree; a
 * target in another output document (linked via {@link TargetUriResolver} when possible,
 * and cited as "(in Title)" when {@link TitleIndex} knows the title); otherwise a dangling
 * reference, reported and rendered as emphasized text. No pending reference survives a
 * call; a survivor is an internal defect and raises {@link UnresolvedReferenceException}.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    public static final String REFTYPE = "reftype";
    public static final String REFDOCNAME = "refdocname";
    public static final String REFSECTNAME = "refsectname";
    public static final String REFDOC = "refdoc";

    private final TargetUriResolver uris;
    private final Labels labels;
    private final boolean useIndex;
    private final BuildWarnings warnings;

    public ReferenceResolver(TargetUriResolver uris, Labels labels, boolean useIndex, BuildWarnings warnings) {
        this.uris = Objects.requireNonNull(uris, "uris must not be null");
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
        this.useIndex = useIndex;
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
    }

    /**
     * Resolves all pending references of a composite tree in place.
     *
     * @param tree composite tree
     * @param rootDocname root DocumentID of the output document
     * @param consumed documents inlined into the tree
     * @param titles titles of the run's output documents
     * @throws UnresolvedReferenceException if a pending reference remains afterwards
     */
    public void resolveReferences(Node tree, String rootDocname, Set<String> consumed, TitleIndex titles) {
        log.info("Resolving references of {}", rootDocname);
        Set<String> anchors = collectAnchors(tree);
        int resolved = 0;
        for (Node pending : tree.traverse(NodeKind.PENDING_XREF)) {
            if (pending.parent() == null) {
                continue;
            }
            pending.replaceSelf(resolve(pending, anchors, consumed, titles, rootDocname));
            resolved++;
        }

        List<Node> survivors = tree.traverse(NodeKind.PENDING_XREF);
        if (!survivors.isEmpty()) {
            throw new UnresolvedReferenceException(survivors.size() + " pending reference(s) left unresolved in "
                + rootDocname + ", first: " + survivors.get(0).getString(Node.REFTARGET));
        }
        log.debug("Resolved {} references in {}", resolved, rootDocname);
    }

    private List<Node> resolve(Node pending, Set<String> anchors, Set<String> consumed,
                               TitleIndex titles, String rootDocname) {
        String target = pending.getString(Node.REFTARGET, "");
        String type = pending.getString(REFTYPE);

        if (IndexBuilder.GENINDEX.equals(target)) {
            if (useIndex && anchors.contains(IndexBuilder.GENINDEX)) {
                return List.of(linkWithContent(pending, Node.REFID, IndexBuilder.GENINDEX));
            }
            return List.of(Nodes.emphasis(visibleText(pending)));
        }

        Optional<String> anchor = localAnchor(pending, target, anchors);
        if (anchor.isPresent()) {
            return List.of(linkWithContent(pending, Node.REFID, anchor.get()));
        }

        if ("token".equals(type)) {
            return List.of(Nodes.strong(visibleText(pending)));
        }

        String targetDoc = pending.getString(REFDOCNAME);
        if (targetDoc != null && !consumed.contains(targetDoc)) {
            return resolveExternal(pending, targetDoc, type, consumed, titles);
        }

        warnings.warn(log, "{}: undefined reference target '{}'",
            pending.getString(REFDOC, rootDocname), target);
        return List.of(Nodes.emphasis(visibleText(pending)));
    }

    private List<Node> resolveExternal(Node pending, String targetDoc, String type,
                                       Set<String> consumed, TitleIndex titles) {
        String text = pending.getString(REFSECTNAME, visibleText(pending));
        List<Node> nodes = new ArrayList<>();
        try {
            String uri = uris.targetUri(targetDoc, type, consumed);
            String refid = pending.getString(Node.REFID);
            String fullUri = refid == null ? uri : uri + "#" + refid;
            nodes.add(Node.of(NodeKind.REFERENCE, Nodes.emphasis(text)).set(Node.REFURI, fullUri));
        } catch (NoUriException e) {
            log.debug("{}; citing it as text", e.getMessage());
            nodes.add(Nodes.emphasis(text));
        }
        titles.titleFor(targetDoc).ifPresent(title -> {
            nodes.add(Node.text(labels.inPrefix()));
            nodes.add(Nodes.emphasis(title));
            nodes.add(Node.text(labels.inSuffix()));
        });
        return nodes;
    }

    private static Optional<String> localAnchor(Node pending, String target, Set<String> anchors) {
        String refid = pending.getString(Node.REFID);
        if (refid != null && anchors.contains(refid)) {
            return Optional.of(refid);
        }
        if (anchors.contains(target)) {
            return Optional.of(target);
        }
        String madeId = Nodes.makeId(target);
        if (!madeId.isEmpty() && anchors.contains(madeId)) {
            return Optional.of(madeId);
        }
        return Optional.empty();
    }

    private static Node linkWithContent(Node pending, String attribute, String value) {
        Node reference = Node.of(NodeKind.REFERENCE).set(attribute, value);
        if (pending.children().isEmpty()) {
            reference.append(Node.text(pending.getString(Node.REFTARGET, value)));
        } else {
            reference.appendAll(pending.takeChildren());
        }
        return reference;
    }

    private static String visibleText(Node pending) {
        String text = pending.astext();
        return text.isEmpty() ? pending.getString(Node.REFTARGET, "") : text;
    }

    private static Set<String> collectAnchors(Node tree) {
        Set<String> anchors = new HashSet<>();
        collect(tree, anchors);
        return anchors;
    }

    private static void collect(Node node, Set<String> anchors) {
        if (node.has(Node.IDS)) {
            anchors.addAll(node.ids());
        }
        for (Node child : node.children()) {
            collect(child, anchors);
        }
    }
}
