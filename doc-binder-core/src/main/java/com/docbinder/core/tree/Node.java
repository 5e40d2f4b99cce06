package com.docbinder.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed, mutable element of a document tree.
 *
 * <p>Every node owns its children; the parent link is a back-reference maintained by
 * the structural operations ({@link #append(Node)}, {@link #insert(int, Node)},
 * {@link #replaceSelf(List)} ...). Appending a node that already has a parent moves it,
 * so a node never has more than one owner.
 *
 * <p>Attribute values are limited to {@link String}, {@link Boolean}, {@link Integer}
 * and {@code List<String>}; this keeps {@link #deepCopy()} a pure value copy.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Node section = Node.of(NodeKind.SECTION).set(Node.IDS, List.of("intro"));
 * section.append(Node.of(NodeKind.TITLE).append(Node.text("Intro")));
 * Node copy = section.deepCopy();   // independent of section
 * }</pre>
 */
public final class Node {

    public static final String IDS = "ids";
    public static final String CLASSES = "classes";
    public static final String DOCNAME = "docname";
    public static final String REFID = "refid";
    public static final String REFURI = "refuri";
    public static final String REFTARGET = "reftarget";
    public static final String BACKREFS = "backrefs";

    private final NodeKind kind;
    private final List<Node> children = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String text;
    private Node parent;

    private Node(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates an empty node of the given kind.
     *
     * @param kind node kind
     * @return new detached node
     */
    public static Node of(NodeKind kind) {
        return new Node(kind);
    }

    /**
     * Creates a node of the given kind holding the given children.
     *
     * @param kind node kind
     * @param children children to append, in order
     * @return new detached node
     */
    public static Node of(NodeKind kind, Node... children) {
        Node node = new Node(kind);
        for (Node child : children) {
            node.append(child);
        }
        return node;
    }

    /**
     * Creates a text leaf.
     *
     * @param text text content
     * @return new text node
     */
    public static Node text(String text) {
        Node node = new Node(NodeKind.TEXT);
        node.text = Objects.requireNonNull(text, "text must not be null");
        return node;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public Node parent() {
        return parent;
    }

    /**
     * Returns a read-only view of the children.
     *
     * @return children in document order
     */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Node> firstChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * Returns the text of a {@link NodeKind#TEXT} node, or {@code null} for other kinds.
     *
     * @return text content
     */
    public String text() {
        return text;
    }

    public void setText(String text) {
        if (kind != NodeKind.TEXT) {
            throw new IllegalStateException("Only text nodes carry text, not " + kind);
        }
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    // ==================== Structure ====================

    public Node append(Node child) {
        child.detach();
        child.parent = this;
        children.add(child);
        return this;
    }

    public Node appendAll(List<Node> nodes) {
        for (Node child : List.copyOf(nodes)) {
            append(child);
        }
        return this;
    }

    public Node insert(int index, Node child) {
        child.detach();
        child.parent = this;
        children.add(index, child);
        return this;
    }

    public int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Removes this node from its parent, if any.
     *
     * @return this node
     */
    public Node detach() {
        if (parent != null) {
            parent.children.remove(parent.indexOf(this));
            parent = null;
        }
        return this;
    }

    /**
     * Replaces this node, in its parent, by the given nodes (possibly none).
     *
     * @param replacements nodes taking this node's position, in order
     * @throws IllegalStateException if this node has no parent
     */
    public void replaceSelf(List<Node> replacements) {
        if (parent == null) {
            throw new IllegalStateException("Cannot replace a root " + kind + " node");
        }
        Node owner = parent;
        int index = owner.indexOf(this);
        detach();
        for (Node replacement : List.copyOf(replacements)) {
            owner.insert(index++, replacement);
        }
    }

    /**
     * Removes and returns all children, leaving this node empty.
     *
     * @return former children
     */
    public List<Node> takeChildren() {
        List<Node> taken = new ArrayList<>(children);
        for (Node child : taken) {
            child.parent = null;
        }
        children.clear();
        return taken;
    }

    // ==================== Attributes ====================

    public Node set(String name, Object value) {
        if (value == null) {
            attributes.remove(name);
        } else if (value instanceof List<?> list) {
            List<String> strings = new ArrayList<>(list.size());
            for (Object element : list) {
                strings.add(String.valueOf(element));
            }
            attributes.put(name, strings);
        } else if (value instanceof String || value instanceof Boolean || value instanceof Integer) {
            attributes.put(name, value);
        } else {
            throw new IllegalArgumentException("Unsupported attribute type for " + name + ": " + value.getClass());
        }
        return this;
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }

    public String getString(String name, String defaultValue) {
        String value = getString(name);
        return value != null ? value : defaultValue;
    }

    public boolean getBoolean(String name) {
        Object value = attributes.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public int getInt(String name, int defaultValue) {
        Object value = attributes.get(name);
        if (value instanceof Integer i) {
            return i;
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Returns a list attribute; the returned list is live and may be modified.
     *
     * @param name attribute name
     * @return list value, created empty if absent
     */
    @SuppressWarnings("unchecked")
    public List<String> getList(String name) {
        Object value = attributes.get(name);
        if (value instanceof List<?>) {
            return (List<String>) value;
        }
        List<String> list = new ArrayList<>();
        if (value != null) {
            list.add(value.toString());
        }
        attributes.put(name, list);
        return list;
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<String> ids() {
        return getList(IDS);
    }

    public Optional<String> firstId() {
        Object value = attributes.get(IDS);
        if (value instanceof List<?> list && !list.isEmpty()) {
            return Optional.of(list.get(0).toString());
        }
        return Optional.empty();
    }

    public List<String> classes() {
        return getList(CLASSES);
    }

    public boolean hasClass(String name) {
        Object value = attributes.get(CLASSES);
        return value instanceof List<?> list && list.contains(name);
    }

    // ==================== Queries ====================

    /**
     * Concatenates the text of all descendant text nodes.
     *
     * @return plain text content
     */
    public String astext() {
        if (kind == NodeKind.TEXT) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        if (kind == NodeKind.TEXT) {
            sb.append(text);
            return;
        }
        for (Node child : children) {
            child.appendText(sb);
        }
    }

    /**
     * Collects this node and all descendants of the given kind in document order.
     *
     * <p>The returned list is a snapshot, so the tree may be modified while iterating it.
     *
     * @param wanted kind to collect
     * @return matching nodes, pre-order
     */
    public List<Node> traverse(NodeKind wanted) {
        List<Node> found = new ArrayList<>();
        collect(wanted, found);
        return found;
    }

    private void collect(NodeKind wanted, List<Node> found) {
        if (kind == wanted) {
            found.add(this);
        }
        for (Node child : children) {
            child.collect(wanted, found);
        }
    }

    /**
     * Finds the first strict descendant of the given kind.
     *
     * @param wanted kind to look for
     * @return first matching descendant, pre-order
     */
    public Optional<Node> nextNode(NodeKind wanted) {
        for (Node child : children) {
            if (child.kind == wanted) {
                return Optional.of(child);
            }
            Optional<Node> nested = child.nextNode(wanted);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    /**
     * Creates an independent copy of this subtree. The copy has no parent.
     *
     * @return deep copy
     */
    public Node deepCopy() {
        Node copy = new Node(kind);
        copy.text = text;
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            copy.attributes.put(entry.getKey(), value instanceof List<?> list ? new ArrayList<>(list) : value);
        }
        for (Node child : children) {
            copy.append(child.deepCopy());
        }
        return copy;
    }

    @Override
    public String toString() {
        if (kind == NodeKind.TEXT) {
            return "Text[" + text + "]";
        }
        return kind.tag() + attributes + children;
    }
}
