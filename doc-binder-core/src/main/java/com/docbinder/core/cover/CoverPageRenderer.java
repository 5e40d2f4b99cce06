package com.docbinder.core.cover;

import com.docbinder.core.report.BuildWarnings;
import com.docbinder.core.source.MarkupParser;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders the cover page of an output document from a Mustache template.
 *
 * <p>The template is looked up in each directory of the search path, in order, then on the
 * classpath under {@code templates/}. A template that cannot be found is reported as a
 * warning and the built-in {@value #DEFAULT_TEMPLATE} is used instead.
 *
 * <p>Templates produce markup, which is parsed with the configured {@link MarkupParser};
 * the parsed blocks are returned inside a {@code compound} node with class {@code cover}.
 *
 * <p><b>Template variables:</b> {@code title}, {@code subtitle}, {@code authors} (list),
 * {@code date}.
 */
public class CoverPageRenderer {

    private static final Logger log = LoggerFactory.getLogger(CoverPageRenderer.class);

    public static final String DEFAULT_TEMPLATE = "cover.mustache";
    public static final String COVER_CLASS = "cover";
    private static final String CLASSPATH_ROOT = "templates/";

    private final List<Path> searchPath;
    private final MarkupParser parser;
    private final BuildWarnings warnings;
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();

    public CoverPageRenderer(List<Path> searchPath, MarkupParser parser, BuildWarnings warnings) {
        this.searchPath = searchPath == null ? List.of() : List.copyOf(searchPath);
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
    }

    /**
     * Renders the cover page tree.
     *
     * @param templateName template file name
     * @param data template values
     * @return cover compound node
     */
    public Node render(String templateName, CoverData data) {
        String markup = renderText(templateName, data);
        Node parsed = parser.parse(markup);
        Node cover = Nodes.withClasses(Node.of(NodeKind.COMPOUND), COVER_CLASS);
        cover.appendAll(parsed.takeChildren());
        return cover;
    }

    /**
     * Renders the cover page markup.
     *
     * @param templateName template file name
     * @param data template values
     * @return markup text
     */
    public String renderText(String templateName, CoverData data) {
        String name = templateName == null || templateName.isBlank() ? DEFAULT_TEMPLATE : templateName;
        String template = findTemplate(name).orElseGet(() -> {
            warnings.warn(log, "Can't find cover template {}, using default", name);
            return findTemplate(DEFAULT_TEMPLATE)
                .orElseThrow(() -> new IllegalStateException("Built-in cover template missing from classpath"));
        });

        Mustache mustache = mustacheFactory.compile(new StringReader(template), name);
        Map<String, Object> scope = new HashMap<>();
        scope.put("title", data.title());
        scope.put("subtitle", data.subtitle());
        scope.put("authors", data.authors());
        scope.put("date", data.date());

        StringWriter writer = new StringWriter();
        mustache.execute(writer, scope);
        return writer.toString();
    }

    private Optional<String> findTemplate(String name) {
        for (Path directory : searchPath) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                log.debug("Using cover template {}", candidate);
                try {
                    return Optional.of(Files.readString(candidate, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new IllegalStateException("Failed to read cover template: " + candidate, e);
                }
            }
        }
        try (InputStream in = CoverPageRenderer.class.getClassLoader().getResourceAsStream(CLASSPATH_ROOT + name)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read cover template resource: " + name, e);
        }
    }
}
