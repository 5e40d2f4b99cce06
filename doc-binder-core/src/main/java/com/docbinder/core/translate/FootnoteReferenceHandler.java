package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;

import java.util.List;

/**
 * Namespaces a footnote reference and, when its footnote was already visited, shows that
 * footnote's number. A reference whose footnote never appears keeps its authored text.
 */
class FootnoteReferenceHandler implements NodeHandler {

    @Override
    public Visit enter(Node node, TranslationContext context) {
        node.set(Node.IDS, node.getList(Node.IDS).stream().map(context::namespaced).toList());
        if (node.has(Node.REFID)) {
            node.set(Node.REFID, context.namespaced(node.getString(Node.REFID)));
        }
        node.firstId().ifPresent(id -> context.registerReference(id, node));

        String refid = node.getString(Node.REFID);
        if (refid != null) {
            context.footnote(refid).ifPresent(footnote -> show(node, FootnoteHandler.label(footnote)));
        }
        return Visit.skip();
    }

    static void show(Node reference, String number) {
        reference.takeChildren();
        reference.appendAll(List.of(Node.text(number)));
    }
}
