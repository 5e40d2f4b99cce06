package com.docbinder.core.translate;

import com.docbinder.core.translate.highlight.Highlighter;
import com.docbinder.core.translate.highlight.LanguageDetector;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;

import java.util.List;
import java.util.Objects;

/**
 * Classifies and highlights literal blocks.
 *
 * <p>Blocks already carrying the {@code code} class were highlighted upstream and are left
 * alone. Any other block is replaced by a {@code code} block whose language comes from its
 * {@code language} attribute (or the current default), whose tabs are expanded, and whose
 * line numbers are on when requested or when the block is longer than the current
 * threshold.
 */
class LiteralBlockHandler implements NodeHandler {

    static final String CODE_CLASS = "code";
    static final String LANGUAGE = "language";
    static final String LINENOS = "linenos";

    private final LanguageDetector detector;
    private final Highlighter highlighter;

    LiteralBlockHandler(LanguageDetector detector, Highlighter highlighter) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.highlighter = Objects.requireNonNull(highlighter, "highlighter must not be null");
    }

    @Override
    public Visit enter(Node node, TranslationContext context) {
        if (node.hasClass(CODE_CLASS)) {
            return Visit.skip();
        }
        String source = node.astext();
        String language = detector.langForBlock(source, node.getString(LANGUAGE, context.highlightLanguage()));

        String tab = " ".repeat(context.tabWidth());
        List<String> lines = source.lines().map(line -> line.replace("\t", tab)).toList();
        boolean linenos = lines.size() > context.linenoThreshold() || node.getBoolean(LINENOS);

        Node replacement = Node.of(NodeKind.LITERAL_BLOCK);
        replacement.getList(Node.CLASSES).addAll(node.classes());
        replacement.getList(Node.CLASSES).add(CODE_CLASS);
        if (!node.ids().isEmpty()) {
            replacement.set(Node.IDS, node.ids());
        }
        replacement.set(LANGUAGE, language).set(LINENOS, linenos);
        replacement.appendAll(highlighter.highlight(lines, language, linenos));
        return Visit.replaceFinal(replacement);
    }
}
