package com.docbinder.core.translate;

import com.docbinder.core.report.BuildWarnings;
import com.docbinder.core.translate.highlight.Highlighter;
import com.docbinder.core.translate.highlight.LanguageDetector;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single stateful walk over a composite tree, run once after references are resolved.
 *
 * <p>The walk is depth-first and left-to-right. Node-kind specific work lives in
 * {@link NodeHandler}s looked up in a dispatch table; the walker applies the
 * {@link Visit} they return, splicing replacements into the tree. All state is kept in a
 * {@link TranslationContext}, so a pass instance can translate many trees, and any subtree
 * can be translated on its own.
 *
 * <p>A handler that throws does not abort the walk: the offending node is swapped for a
 * plain-text fallback (a {@code code} literal block for literal blocks, a {@code fallback}
 * paragraph otherwise) and the failure is recorded in {@link BuildWarnings}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * TranslationPass pass = TranslationPass.standard(new LanguageDetector(), new PlainHighlighter(), warnings);
 * TranslationContext context = pass.translate(tree, "python");
 * int footnotes = context.footnoteCounter() - 1;
 * }</pre>
 */
public class TranslationPass {

    private static final Logger log = LoggerFactory.getLogger(TranslationPass.class);

    public static final String FALLBACK_CLASS = "fallback";

    private final Map<NodeKind, NodeHandler> handlers;
    private final BuildWarnings warnings;

    public TranslationPass(Map<NodeKind, NodeHandler> handlers, BuildWarnings warnings) {
        this.handlers = handlers.isEmpty() ? new EnumMap<>(NodeKind.class) : new EnumMap<>(handlers);
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
    }

    /**
     * Creates a pass with the standard handlers: file scopes, footnotes, literal blocks,
     * production lists, version-modified flattening, highlight directives and removal of
     * leftover toctree placeholders.
     *
     * @param detector language detector for literal blocks
     * @param highlighter highlighter receiving the block lines
     * @param warnings collector for node-level failures
     * @return configured pass
     */
    public static TranslationPass standard(LanguageDetector detector, Highlighter highlighter, BuildWarnings warnings) {
        Map<NodeKind, NodeHandler> handlers = new EnumMap<>(NodeKind.class);
        FileScopeHandler fileScope = new FileScopeHandler();
        handlers.put(NodeKind.DOCUMENT, fileScope);
        handlers.put(NodeKind.START_OF_FILE, fileScope);
        handlers.put(NodeKind.FOOTNOTE, new FootnoteHandler());
        handlers.put(NodeKind.FOOTNOTE_REFERENCE, new FootnoteReferenceHandler());
        handlers.put(NodeKind.LITERAL_BLOCK, new LiteralBlockHandler(detector, highlighter));
        handlers.put(NodeKind.PRODUCTION_LIST, new ProductionListHandler());
        handlers.put(NodeKind.VERSION_MODIFIED, (node, context) -> Visit.replaceWith(Nodes.paragraph(node.takeChildren().toArray(Node[]::new))));
        handlers.put(NodeKind.HIGHLIGHT_LANG, new HighlightLanguageHandler());
        handlers.put(NodeKind.TOCTREE, (node, context) -> Visit.remove());
        return new TranslationPass(handlers, warnings);
    }

    /**
     * Translates a tree with a fresh context.
     *
     * @param tree composite tree, modified in place
     * @param highlightLanguage default language of literal blocks
     * @return the context after the walk
     */
    public TranslationContext translate(Node tree, String highlightLanguage) {
        TranslationContext context = new TranslationContext(highlightLanguage);
        translate(tree, context);
        return context;
    }

    /**
     * Translates a tree, or a subtree, continuing from an existing context.
     *
     * @param tree tree to translate in place
     * @param context walk state
     */
    public void translate(Node tree, TranslationContext context) {
        context.bindWalker(node -> walkChildren(node, context));
        walk(tree, context);
        log.debug("Translated {}: {} footnotes numbered", tree.getString(Node.DOCNAME, tree.kind().tag()),
            context.footnoteCounter() - 1);
    }

    private void walk(Node node, TranslationContext context) {
        NodeHandler handler = handlers.get(node.kind());
        Visit visit;
        try {
            visit = handler == null ? Visit.proceed() : handler.enter(node, context);
        } catch (RuntimeException e) {
            substituteFallback(node, e);
            return;
        }

        if (visit.replaces()) {
            if (node.parent() == null) {
                log.debug("Ignoring replacement of root {} node", node.kind().tag());
            } else {
                node.replaceSelf(visit.replacement());
                if (!visit.skipChildren()) {
                    visit.replacement().forEach(replacement -> walk(replacement, context));
                }
                return;
            }
        }
        if (!visit.skipChildren()) {
            walkChildren(node, context);
        }
        if (handler != null) {
            handler.leave(node, context);
        }
    }

    private void walkChildren(Node node, TranslationContext context) {
        for (Node child : List.copyOf(node.children())) {
            walk(child, context);
        }
    }

    private void substituteFallback(Node node, RuntimeException cause) {
        String docname = owningDocument(node);
        warnings.warn(log, "{}: could not translate {} node, using plain text: {}",
            docname, node.kind().tag(), cause.toString());
        log.debug("Translation failure", cause);
        if (node.parent() == null) {
            return;
        }
        Node fallback;
        if (node.is(NodeKind.LITERAL_BLOCK)) {
            fallback = Nodes.withClasses(Node.of(NodeKind.LITERAL_BLOCK, Node.text(node.astext())), LiteralBlockHandler.CODE_CLASS);
        } else {
            fallback = Nodes.withClasses(Nodes.paragraph(node.astext()), FALLBACK_CLASS);
        }
        node.replaceSelf(List.of(fallback));
    }

    private static String owningDocument(Node node) {
        for (Node current = node; current != null; current = current.parent()) {
            if (current.has(Node.DOCNAME)) {
                return current.getString(Node.DOCNAME);
            }
        }
        return "<unknown>";
    }
}
