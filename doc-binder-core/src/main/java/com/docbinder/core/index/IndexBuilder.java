package com.docbinder.core.index;

import com.docbinder.core.i18n.Labels;
import com.docbinder.core.index.GeneralIndexGroup.IndexTerm;
import com.docbinder.core.index.GeneralIndexGroup.SubEntry;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders grouped index content into tree nodes.
 *
 * <p>Input is already grouped and sorted ({@link IndexEntries}, {@link DomainIndex}); this
 * class only shapes it. Each group becomes a {@code heading4} paragraph followed by a bullet
 * list with one item per term. Additional occurrences of a term follow its main link as
 * {@code [1]}, {@code [2]} ... mini-links. Groups without entries produce nothing.
 */
public class IndexBuilder {

    /** Anchor of the generated general index. */
    public static final String GENINDEX = "genindex";
    /** Anchor carried by the first domain index of a document. */
    public static final String MODINDEX = "modindex";

    static final String HEADING_CLASS = "heading4";

    private final Labels labels;

    public IndexBuilder(Labels labels) {
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * Builds the general index section.
     *
     * @param groups letter groups
     * @return index section, empty when every group is empty
     */
    public Optional<Node> buildGeneralIndex(List<GeneralIndexGroup> groups) {
        if (groups.stream().allMatch(group -> group.terms().isEmpty())) {
            return Optional.empty();
        }
        Node section = Nodes.withClasses(Node.of(NodeKind.SECTION), GENINDEX).set(Node.IDS, List.of(GENINDEX));
        section.append(Nodes.title(labels.index()));

        for (GeneralIndexGroup group : groups) {
            if (group.terms().isEmpty()) {
                continue;
            }
            section.append(heading(group.key()));
            Node list = Nodes.withClasses(Node.of(NodeKind.BULLET_LIST), "index-entries");
            for (IndexTerm term : group.terms()) {
                list.append(termItem(term));
            }
            section.append(list);
        }
        return Optional.of(section);
    }

    private Node termItem(IndexTerm term) {
        Node item = Node.of(NodeKind.LIST_ITEM, linkedParagraph(term.term(), term.links()));
        if (!term.subEntries().isEmpty()) {
            Node subList = Node.of(NodeKind.BULLET_LIST);
            for (SubEntry sub : term.subEntries()) {
                subList.append(Node.of(NodeKind.LIST_ITEM, linkedParagraph(sub.term(), sub.links())));
            }
            item.append(subList);
        }
        return item;
    }

    private Node linkedParagraph(String text, List<String> links) {
        if (links.isEmpty()) {
            return Nodes.paragraph(text);
        }
        Node paragraph = Nodes.paragraph(Nodes.uriReference(text, links.get(0)));
        for (int i = 1; i < links.size(); i++) {
            paragraph.append(Node.text(" "));
            paragraph.append(Nodes.uriReference("[" + i + "]", links.get(i)));
        }
        return paragraph;
    }

    /**
     * Builds the section of a domain index.
     *
     * @param fullName index identifier, e.g. {@code py-modindex}; used as the section id
     * @param localName displayed title
     * @param groups rows grouped by letter
     * @return index section, empty when every group is empty
     */
    public Optional<Node> buildDomainIndex(String fullName, String localName, List<DomainIndexContent.Group> groups) {
        if (groups.stream().allMatch(group -> group.entries().isEmpty())) {
            return Optional.empty();
        }
        Node section = Nodes.withClasses(Node.of(NodeKind.SECTION), "domainindex").set(Node.IDS, List.of(fullName));
        section.append(Nodes.title(localName));

        for (DomainIndexContent.Group group : groups) {
            if (group.entries().isEmpty()) {
                continue;
            }
            section.append(heading(group.letter()));
            Node list = Nodes.withClasses(Node.of(NodeKind.BULLET_LIST), "index-entries");
            for (IndexEntry row : group.entries()) {
                list.append(domainRow(row));
            }
            section.append(list);
        }
        return Optional.of(section);
    }

    private Node domainRow(IndexEntry row) {
        Node paragraph = row.anchor().isEmpty()
            ? Nodes.paragraph(row.term())
            : Nodes.paragraph(Nodes.internalReference(row.term(), row.anchor()));
        if (!row.extra().isEmpty()) {
            paragraph.append(Node.text(" (" + row.extra() + ")"));
        }
        if (!row.qualifier().isEmpty()) {
            paragraph.append(Node.text(" [" + row.qualifier() + "]"));
        }
        Node item = Node.of(NodeKind.LIST_ITEM, paragraph);
        if (!row.description().isBlank()) {
            item.append(Node.of(NodeKind.BLOCK_QUOTE, Nodes.paragraph(row.description())));
        }
        return item;
    }

    private static Node heading(String text) {
        return Nodes.withClasses(Nodes.paragraph(text), HEADING_CLASS);
    }
}
