package com.docbinder.core.toc;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the nested table of contents of a composite tree.
 *
 * <p>Sections are collected through the {@code start_of_file} wrappers left by the
 * assembler (and {@code compound} toctree wrappers), so inlined documents contribute their
 * sections at the level where they were included.
 *
 * <p>Every entry is a list item holding a reference to the section's first id, followed by
 * the nested list of its subsections while the nesting level is below {@code tocDepth}.
 * With a back-link policy other than {@link BacklinkPolicy#NONE}, a title that does not
 * already contain a reference gets a {@code refid} pointing at its entry or at the top of
 * the contents.
 *
 * <p>Not thread-safe: entry ids are numbered per instance.
 */
public class ContentsBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContentsBuilder.class);

    /** Anchor of the generated contents topic. */
    public static final String CONTENTS_ID = "contents";
    /** Class marking the top-level list of automatically generated contents. */
    public static final String AUTO_TOC_CLASS = "auto-toc";

    private static final Set<NodeKind> WRAPPERS = Set.of(NodeKind.START_OF_FILE, NodeKind.COMPOUND);
    private static final Set<NodeKind> FILTERED_FROM_ENTRIES =
        Set.of(NodeKind.FOOTNOTE_REFERENCE, NodeKind.TARGET, NodeKind.PENDING_XREF);

    private final int tocDepth;
    private final BacklinkPolicy backlinks;
    private int entryCounter;

    public ContentsBuilder(int tocDepth, BacklinkPolicy backlinks) {
        this.tocDepth = tocDepth < 1 ? Integer.MAX_VALUE : tocDepth;
        this.backlinks = Objects.requireNonNull(backlinks, "backlinks must not be null");
    }

    /**
     * Builds the contents list of a tree.
     *
     * @param tree composite tree
     * @return top-level bullet list tagged {@value #AUTO_TOC_CLASS}, empty if the tree has no
     *         sections
     */
    public Optional<Node> buildToc(Node tree) {
        entryCounter = 0;
        Optional<Node> contents = buildContents(tree, 0);
        contents.ifPresent(list -> Nodes.withClasses(list, AUTO_TOC_CLASS));
        log.debug("Built contents with {} entries", entryCounter);
        return contents;
    }

    /**
     * Builds the complete contents topic: a titled topic with id {@value #CONTENTS_ID}
     * holding the list of {@link #buildToc(Node)}, if any.
     *
     * @param tree composite tree
     * @param title localized "Contents" label
     * @return contents topic
     */
    public Node buildContentsTopic(Node tree, String title) {
        Node topic = Nodes.withClasses(Node.of(NodeKind.TOPIC), "contents").set(Node.IDS, List.of(CONTENTS_ID));
        topic.append(Nodes.title(title));
        buildToc(tree).ifPresent(topic::append);
        return topic;
    }

    private Optional<Node> buildContents(Node node, int level) {
        level++;
        List<Node> entries = new ArrayList<>();
        for (Node section : collectSections(node)) {
            Optional<String> sectionId = section.firstId();
            Optional<Node> title = section.firstChild().filter(child -> child.is(NodeKind.TITLE));
            if (sectionId.isEmpty() || title.isEmpty()) {
                log.debug("Skipping section without id or title: {}", section.attributes());
                continue;
            }

            String entryId = "toc-entry-" + (++entryCounter);
            Node reference = Node.of(NodeKind.REFERENCE)
                .set(Node.REFID, sectionId.get())
                .set(Node.IDS, List.of(entryId));
            reference.appendAll(entryText(title.get()));
            Node item = Node.of(NodeKind.LIST_ITEM, Nodes.paragraph(reference));

            applyBacklink(title.get(), entryId);

            if (level < tocDepth) {
                buildContents(section, level).ifPresent(item::append);
            }
            entries.add(item);
        }
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        Node list = Node.of(NodeKind.BULLET_LIST);
        entries.forEach(list::append);
        return Optional.of(list);
    }

    private static List<Node> collectSections(Node node) {
        List<Node> sections = new ArrayList<>();
        for (Node child : node.children()) {
            if (child.is(NodeKind.SECTION)) {
                sections.add(child);
            } else if (WRAPPERS.contains(child.kind())) {
                sections.addAll(collectSections(child));
            }
        }
        return sections;
    }

    private void applyBacklink(Node title, String entryId) {
        if (backlinks == BacklinkPolicy.NONE || title.nextNode(NodeKind.REFERENCE).isPresent()) {
            return;
        }
        title.set(Node.REFID, backlinks == BacklinkPolicy.ENTRY ? entryId : CONTENTS_ID);
    }

    private static List<Node> entryText(Node title) {
        List<Node> copies = new ArrayList<>();
        for (Node child : title.children()) {
            copies.addAll(filtered(child));
        }
        return copies;
    }

    // references are unwrapped to their content; footnote references and targets dropped
    private static List<Node> filtered(Node node) {
        if (FILTERED_FROM_ENTRIES.contains(node.kind())) {
            return List.of();
        }
        if (node.is(NodeKind.REFERENCE)) {
            List<Node> unwrapped = new ArrayList<>();
            for (Node child : node.children()) {
                unwrapped.addAll(filtered(child));
            }
            return unwrapped;
        }
        Node copy = node.deepCopy();
        for (Node child : List.copyOf(copy.children())) {
            List<Node> replacement = filtered(child);
            child.replaceSelf(replacement);
        }
        return List.of(copy);
    }
}
