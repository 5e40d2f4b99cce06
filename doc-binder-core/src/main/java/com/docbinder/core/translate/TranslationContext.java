package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Mutable state threaded through one translation walk.
 *
 * <p>Holds the footnote counter (shared by the whole composite document), the stack of
 * footnote namespaces (one per open source file), the footnotes and references seen so far
 * keyed by namespaced id, and the current code-highlighting defaults.
 *
 * <p>A document included more than once gets a distinct namespace per inclusion
 * ({@code docname}, {@code docname-2}, ...). A suffixed name already issued to another
 * file, such as a real {@code docname-2}, is skipped, so footnote ids stay unique.
 */
public class TranslationContext {

    public static final int DEFAULT_TAB_WIDTH = 8;
    public static final int NO_LINENO_THRESHOLD = Integer.MAX_VALUE;

    private final Deque<String> namespaces = new ArrayDeque<>();
    private final Map<String, Integer> inclusions = new HashMap<>();
    private final Set<String> issued = new HashSet<>();
    private final Map<String, Node> footnotes = new HashMap<>();
    private final Map<String, Node> references = new HashMap<>();
    private final int tabWidth;
    private int footnoteCounter = 1;
    private String highlightLanguage;
    private int linenoThreshold = NO_LINENO_THRESHOLD;
    private Consumer<Node> childWalker = node -> { };

    public TranslationContext(String highlightLanguage, int tabWidth) {
        this.highlightLanguage = highlightLanguage;
        if (tabWidth < 0) {
            throw new IllegalArgumentException("tabWidth must not be negative: " + tabWidth);
        }
        this.tabWidth = tabWidth;
    }

    public TranslationContext(String highlightLanguage) {
        this(highlightLanguage, DEFAULT_TAB_WIDTH);
    }

    // ==================== File scope ====================

    /**
     * Opens the scope of a source file.
     *
     * @param docname DocumentID of the file
     * @return namespace used for the file's footnotes
     */
    public String enterFile(String docname) {
        String name = docname == null ? "" : docname;
        String namespace = name;
        while (!issued.add(namespace)) {
            namespace = name + "-" + inclusions.merge(name, 2, (count, start) -> count + 1);
        }
        namespaces.push(namespace);
        return namespace;
    }

    public void leaveFile() {
        if (namespaces.isEmpty()) {
            throw new IllegalStateException("No open file scope to leave");
        }
        namespaces.pop();
    }

    public String currentNamespace() {
        return namespaces.isEmpty() ? "" : namespaces.peek();
    }

    public int depth() {
        return namespaces.size();
    }

    /**
     * Prefixes a raw footnote id with the innermost namespace.
     *
     * @param id id as authored
     * @return namespaced id
     */
    public String namespaced(String id) {
        return currentNamespace() + "_" + id;
    }

    // ==================== Footnotes ====================

    public int nextFootnoteNumber() {
        return footnoteCounter++;
    }

    /** Number the next footnote will receive. */
    public int footnoteCounter() {
        return footnoteCounter;
    }

    public void registerFootnote(String id, Node footnote) {
        footnotes.put(id, footnote);
    }

    public Optional<Node> footnote(String id) {
        return Optional.ofNullable(footnotes.get(id));
    }

    public void registerReference(String id, Node reference) {
        references.put(id, reference);
    }

    public Optional<Node> reference(String id) {
        return Optional.ofNullable(references.get(id));
    }

    // ==================== Highlighting ====================

    public String highlightLanguage() {
        return highlightLanguage;
    }

    public int linenoThreshold() {
        return linenoThreshold;
    }

    public void setHighlighting(String language, int threshold) {
        this.highlightLanguage = language;
        this.linenoThreshold = threshold;
    }

    public int tabWidth() {
        return tabWidth;
    }

    // ==================== Walking ====================

    /**
     * Translates the children of a node that a handler is about to move elsewhere.
     *
     * @param node node whose children are walked
     */
    public void translateChildren(Node node) {
        childWalker.accept(node);
    }

    void bindWalker(Consumer<Node> walker) {
        this.childWalker = Objects.requireNonNull(walker, "walker must not be null");
    }
}
