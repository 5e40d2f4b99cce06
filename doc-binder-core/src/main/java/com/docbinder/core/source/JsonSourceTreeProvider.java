package com.docbinder.core.source;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Source-tree provider backed by a directory of JSON-serialized trees.
 *
 * <p>Each {@code <docname>.json} file below the root holds one tree in the format read by
 * {@link NodeJsonCodec}; nested DocumentIDs map to sub-directories ({@code api/index.json}
 * is {@code api/index}). Files and directories whose name starts with an underscore or a
 * dot are reserved for side data (index entries, domain indices, build output) and are not
 * documents.
 *
 * <p>The navigation graph is derived from the {@code includefiles} attribute of the
 * {@code toctree} nodes of every tree. Parsed trees are cached and shared, as allowed by
 * the {@link SourceTreeProvider} contract. A file that cannot be parsed is left out of the
 * navigation graph and reported by {@link #unreadableDocuments()}; asking for its tree
 * raises {@link SourceTreeException}.
 */
public class JsonSourceTreeProvider implements SourceTreeProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonSourceTreeProvider.class);

    private static final String EXTENSION = ".json";
    private static final String RESERVED_PREFIX = "_";
    private static final String INCLUDEFILES = "includefiles";

    private final Path root;
    private final NodeJsonCodec codec;
    private final ObjectMapper mapper;
    private final Map<String, Path> files;
    private final Map<String, Node> cache = new ConcurrentHashMap<>();
    private final Set<String> unreadable = ConcurrentHashMap.newKeySet();
    private volatile NavigationGraph navigationGraph;

    /**
     * Indexes the tree files below a directory.
     *
     * @param root directory holding the serialized trees
     * @throws IllegalStateException if the directory cannot be listed
     */
    public JsonSourceTreeProvider(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = new ObjectMapper();
        this.codec = new NodeJsonCodec(mapper);
        this.files = Collections.unmodifiableMap(discover(root));
        log.info("Found {} source documents in {}", files.size(), root);
    }

    private static Map<String, Path> discover(Path root) {
        Map<String, Path> found = new TreeMap<>();
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .filter(path -> !isReserved(root.relativize(path)))
                .forEach(path -> found.put(toDocname(root, path), path));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list source trees in: " + root, e);
        }
        return found;
    }

    // files and directories starting with "_" or "." hold data and output, not trees
    private static boolean isReserved(Path relative) {
        for (Path component : relative) {
            String name = component.toString();
            if (name.startsWith(RESERVED_PREFIX) || name.startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String toDocname(Path root, Path file) {
        String relative = root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
        return relative.substring(0, relative.length() - EXTENSION.length());
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Node getTree(String docname) {
        Path file = files.get(docname);
        if (file == null) {
            throw new UnknownDocumentException(docname);
        }
        return cache.computeIfAbsent(docname, name -> load(name, file));
    }

    private Node load(String docname, Path file) {
        log.debug("Loading tree {} from {}", docname, file);
        try {
            Node tree = codec.read(mapper.readTree(file.toFile()));
            if (!tree.is(NodeKind.DOCUMENT)) {
                throw new SourceTreeException(docname, "Tree root of " + file + " is " + tree.kind() + ", expected document");
            }
            if (!tree.has(Node.DOCNAME)) {
                tree.set(Node.DOCNAME, docname);
            }
            return tree;
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceTreeException(docname, "Failed to read source tree: " + file, e);
        }
    }

    @Override
    public Set<String> allKnownDocuments() {
        return files.keySet();
    }

    @Override
    public NavigationGraph navigationGraph() {
        NavigationGraph graph = navigationGraph;
        if (graph == null) {
            synchronized (this) {
                graph = navigationGraph;
                if (graph == null) {
                    graph = buildNavigationGraph();
                    navigationGraph = graph;
                }
            }
        }
        return graph;
    }

    private NavigationGraph buildNavigationGraph() {
        Map<String, List<String>> includes = new LinkedHashMap<>();
        for (String docname : files.keySet()) {
            Node tree;
            try {
                tree = getTree(docname);
            } catch (SourceTreeException e) {
                log.warn("Skipping unreadable source tree {}: {}", docname, e.getMessage());
                unreadable.add(docname);
                continue;
            }
            List<String> included = new ArrayList<>();
            for (Node toctree : tree.traverse(NodeKind.TOCTREE)) {
                included.addAll(toctree.getList(INCLUDEFILES));
            }
            if (!included.isEmpty()) {
                includes.put(docname, included);
            }
        }
        return new NavigationGraph(includes);
    }

    @Override
    public Set<String> unreadableDocuments() {
        navigationGraph();
        return Set.copyOf(unreadable);
    }

    @Override
    public Optional<Instant> lastModified(String docname) {
        Path file = files.get(docname);
        if (file == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            log.warn("Cannot read modification time of {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
