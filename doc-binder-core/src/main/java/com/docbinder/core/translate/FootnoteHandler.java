package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;

import java.util.List;

/**
 * Renumbers footnotes and namespaces their ids.
 *
 * <p>A footnote's ids and back-references are prefixed with the current file namespace and
 * its label is set to the next document-wide number. References already visited (listed in
 * the footnote's back-references) are patched to show the same number; references visited
 * later pick it up in {@link FootnoteReferenceHandler}.
 */
class FootnoteHandler implements NodeHandler {

    @Override
    public Visit enter(Node node, TranslationContext context) {
        node.set(Node.BACKREFS, prefixed(node.getList(Node.BACKREFS), context));
        node.set(Node.IDS, prefixed(node.getList(Node.IDS), context));

        String number = String.valueOf(context.nextFootnoteNumber());
        setLabel(node, number);

        for (String backref : node.getList(Node.BACKREFS)) {
            context.reference(backref).ifPresent(reference -> FootnoteReferenceHandler.show(reference, number));
        }
        node.firstId().ifPresent(id -> context.registerFootnote(id, node));
        return Visit.proceed();
    }

    static String label(Node footnote) {
        return footnote.firstChild()
            .filter(child -> child.is(NodeKind.LABEL))
            .map(Node::astext)
            .orElse("");
    }

    private static void setLabel(Node footnote, String number) {
        Node label = footnote.firstChild().filter(child -> child.is(NodeKind.LABEL)).orElse(null);
        if (label == null) {
            label = Node.of(NodeKind.LABEL);
            footnote.insert(0, label);
        }
        label.takeChildren();
        label.append(Node.text(number));
    }

    private static List<String> prefixed(List<String> ids, TranslationContext context) {
        return ids.stream().map(context::namespaced).toList();
    }
}
