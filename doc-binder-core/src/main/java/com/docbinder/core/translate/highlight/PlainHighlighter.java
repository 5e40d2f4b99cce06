package com.docbinder.core.translate.highlight;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Highlighter without language rules: one {@code line} token per source line, preceded by
 * a right-aligned {@code lineno} token when line numbers are requested.
 */
public class PlainHighlighter implements Highlighter {

    public static final String LINE_CLASS = "line";
    public static final String LINENO_CLASS = "lineno";

    @Override
    public List<Node> highlight(List<String> lines, String language, boolean linenos) {
        int width = String.valueOf(lines.size()).length();
        List<Node> tokens = new ArrayList<>(linenos ? lines.size() * 2 : lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (linenos) {
                String number = String.format("%" + width + "d ", i + 1);
                tokens.add(Nodes.withClasses(Node.of(NodeKind.TOKEN, Node.text(number)), LINENO_CLASS));
            }
            tokens.add(Nodes.withClasses(Node.of(NodeKind.TOKEN, Node.text(lines.get(i) + "\n")), LINE_CLASS));
        }
        return tokens;
    }
}
