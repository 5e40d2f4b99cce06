package com.docbinder.core.tree;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kinds of elements that can appear in a document tree.
 *
 * <p>Each kind has a stable lower-case tag used when trees are read from or written
 * to JSON (e.g. {@code "literal_block"}, {@code "start_of_file"}).
 */
public enum NodeKind {
    DOCUMENT("document"),
    SECTION("section"),
    TITLE("title"),
    PARAGRAPH("paragraph"),
    TEXT("text"),
    EMPHASIS("emphasis"),
    STRONG("strong"),
    REFERENCE("reference"),
    TARGET("target"),
    LITERAL_BLOCK("literal_block"),
    FOOTNOTE("footnote"),
    FOOTNOTE_REFERENCE("footnote_reference"),
    LABEL("label"),
    PENDING_XREF("pending_xref"),
    TOCTREE("toctree"),
    COMPOUND("compound"),
    START_OF_FILE("start_of_file"),
    RAW("raw"),
    BULLET_LIST("bullet_list"),
    LIST_ITEM("list_item"),
    BLOCK_QUOTE("block_quote"),
    TOPIC("topic"),
    PRODUCTION_LIST("productionlist"),
    PRODUCTION("production"),
    VERSION_MODIFIED("versionmodified"),
    HIGHLIGHT_LANG("highlightlang"),
    TOKEN("token");

    private static final Map<String, NodeKind> BY_TAG = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(NodeKind::tag, Function.identity()));

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the serialized tag of this kind.
     *
     * @return lower-case tag
     */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a kind by its serialized tag.
     *
     * @param tag serialized tag
     * @return matching kind
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static NodeKind fromTag(String tag) {
        NodeKind kind = BY_TAG.get(tag);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node kind: " + tag);
        }
        return kind;
    }
}
