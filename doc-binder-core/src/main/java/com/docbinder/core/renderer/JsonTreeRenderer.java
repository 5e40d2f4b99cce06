package com.docbinder.core.renderer;

import com.docbinder.core.source.NodeJsonCodec;
import com.docbinder.core.tree.Node;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes the composite tree and its options as JSON, for a page-layout
 * engine to consume.
 *
 * <p><b>Output:</b>
 * <pre>{@code
 * {
 *   "options": { "stylesheets": ["sphinx"], "pageTemplate": "decoratedPage", ... },
 *   "tree": { "kind": "document", "children": [ ... ] }
 * }
 * }</pre>
 *
 * <p>Parent directories are created as needed and existing files are overwritten.
 */
public class JsonTreeRenderer implements PageRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsonTreeRenderer.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final NodeJsonCodec codec = new NodeJsonCodec(mapper);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public void render(Node tree, Path target, RenderOptions options) {
        ObjectNode document = mapper.createObjectNode();
        document.set("options", mapper.valueToTree(options));
        document.set("tree", codec.write(tree));

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), document);
            log.info("Wrote {}", target);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write output document: " + target, e);
        }
    }
}
