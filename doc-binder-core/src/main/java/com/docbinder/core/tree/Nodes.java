package com.docbinder.core.tree;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

/**
 * Factory and helper methods for building tree fragments.
 */
public final class Nodes {

    /** Raw format understood by the page renderer. */
    public static final String RENDERER_FORMAT = "pdf";

    private Nodes() {
    }

    public static Node paragraph(Node... children) {
        return Node.of(NodeKind.PARAGRAPH, children);
    }

    public static Node paragraph(String text) {
        return Node.of(NodeKind.PARAGRAPH, Node.text(text));
    }

    public static Node title(String text) {
        return Node.of(NodeKind.TITLE, Node.text(text));
    }

    public static Node emphasis(String text) {
        return Node.of(NodeKind.EMPHASIS, Node.text(text));
    }

    public static Node strong(String text) {
        return Node.of(NodeKind.STRONG, Node.text(text));
    }

    /**
     * Creates a reference to an anchor inside the same output document.
     *
     * @param text visible text
     * @param refid target id
     * @return reference node
     */
    public static Node internalReference(String text, String refid) {
        return Node.of(NodeKind.REFERENCE, Node.text(text)).set(Node.REFID, refid);
    }

    /**
     * Creates a reference to a URI, local ({@code #anchor}) or external.
     *
     * <p>URIs of the form {@code #anchor} are turned into internal references.
     *
     * @param text visible text
     * @param uri target URI
     * @return reference node
     */
    public static Node uriReference(String text, String uri) {
        if (uri.startsWith("#")) {
            return internalReference(text, uri.substring(1));
        }
        return Node.of(NodeKind.REFERENCE, Node.text(text)).set(Node.REFURI, uri);
    }

    public static Node target(String id) {
        return Node.of(NodeKind.TARGET).set(Node.IDS, List.of(id));
    }

    /**
     * Creates a renderer directive such as {@code OddPageBreak twoColumn}.
     *
     * @param directive directive text
     * @return raw node in the renderer's format
     */
    public static Node rendererDirective(String directive) {
        return Node.of(NodeKind.RAW, Node.text(directive)).set("format", RENDERER_FORMAT);
    }

    public static Node withClasses(Node node, String... classes) {
        for (String cls : classes) {
            if (!node.hasClass(cls)) {
                node.classes().add(cls);
            }
        }
        return node;
    }

    /**
     * Converts arbitrary text into a valid identifier.
     *
     * <p>Lower-cases the text, folds accents, replaces every run of characters other than
     * {@code [a-z0-9]} by a single hyphen, and strips leading digits/hyphens and trailing
     * hyphens. {@code "1. Getting Started!"} becomes {@code "getting-started"}.
     *
     * @param text text to convert
     * @return identifier, possibly empty
     */
    public static String makeId(String text) {
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKD)
            .replaceAll("\\p{M}", "")
            .toLowerCase(Locale.ROOT);
        String id = folded.replaceAll("[^a-z0-9]+", "-");
        id = id.replaceAll("^[^a-z]+", "");
        id = id.replaceAll("-+$", "");
        return id;
    }
}
