package com.docbinder.core.source;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts document trees to and from Jackson's JSON tree model.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * {
 *   "kind": "section",
 *   "attributes": { "ids": ["intro"] },
 *   "children": [
 *     { "kind": "title", "children": [ { "kind": "text", "text": "Intro" } ] }
 *   ]
 * }
 * }</pre>
 * A bare JSON string is accepted as shorthand for a text node.
 */
public final class NodeJsonCodec {

    private static final String KIND = "kind";
    private static final String TEXT = "text";
    private static final String ATTRIBUTES = "attributes";
    private static final String CHILDREN = "children";

    private final ObjectMapper mapper;

    public NodeJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public NodeJsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * Reads a node from JSON.
     *
     * @param json JSON object (or string for text nodes)
     * @return parsed node
     * @throws IllegalArgumentException if the JSON does not describe a node
     */
    public Node read(JsonNode json) {
        if (json.isTextual()) {
            return Node.text(json.asText());
        }
        if (!json.isObject() || !json.hasNonNull(KIND)) {
            throw new IllegalArgumentException("Expected a node object with a 'kind' field but got: " + json);
        }
        NodeKind kind = NodeKind.fromTag(json.get(KIND).asText());
        if (kind == NodeKind.TEXT) {
            return Node.text(json.path(TEXT).asText(""));
        }

        Node node = Node.of(kind);
        JsonNode attributes = json.get(ATTRIBUTES);
        if (attributes != null && attributes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                node.set(field.getKey(), toAttributeValue(field.getValue()));
            }
        }
        JsonNode children = json.get(CHILDREN);
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                node.append(read(child));
            }
        }
        return node;
    }

    private Object toAttributeValue(JsonNode value) {
        if (value.isArray()) {
            List<String> list = new ArrayList<>();
            value.forEach(element -> list.add(element.asText()));
            return list;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isInt()) {
            return value.intValue();
        }
        if (value.isNull()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Writes a node as a JSON object.
     *
     * @param node node to write
     * @return JSON representation
     */
    public ObjectNode write(Node node) {
        ObjectNode json = mapper.createObjectNode();
        json.put(KIND, node.kind().tag());
        if (node.is(NodeKind.TEXT)) {
            json.put(TEXT, node.text());
            return json;
        }
        if (!node.attributes().isEmpty()) {
            json.set(ATTRIBUTES, mapper.valueToTree(node.attributes()));
        }
        if (!node.children().isEmpty()) {
            ArrayNode children = json.putArray(CHILDREN);
            for (Node child : node.children()) {
                children.add(write(child));
            }
        }
        return json;
    }
}
