package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;

import java.util.List;

/**
 * Lays out a grammar production list as an aligned code block.
 *
 * <p>Each named production becomes {@code name ::= body} with names left-justified to the
 * longest one; a production without a name continues the previous rule and is indented by
 * the same width plus the width of {@code " ::= "}.
 */
class ProductionListHandler implements NodeHandler {

    static final String TOKENNAME = "tokenname";
    private static final String DEFINES = " ::= ";

    @Override
    public Visit enter(Node node, TranslationContext context) {
        List<Node> productions = node.children().stream().filter(child -> child.is(NodeKind.PRODUCTION)).toList();
        int width = productions.stream()
            .mapToInt(production -> production.getString(TOKENNAME, "").length())
            .max()
            .orElse(0);

        Node block = Nodes.withClasses(Node.of(NodeKind.LITERAL_BLOCK), LiteralBlockHandler.CODE_CLASS);
        for (Node production : productions) {
            String name = production.getString(TOKENNAME, "");
            if (name.isEmpty()) {
                block.append(Node.text(" ".repeat(width + DEFINES.length())));
            } else {
                block.append(Nodes.strong(padRight(name, width)));
                block.append(Node.text(DEFINES));
            }
            context.translateChildren(production);
            block.appendAll(production.takeChildren());
            block.append(Node.text("\n"));
        }
        return Visit.replaceFinal(block);
    }

    private static String padRight(String name, int width) {
        return name + " ".repeat(Math.max(0, width - name.length()));
    }
}
