package com.docbinder.core.config;

import com.docbinder.core.renderer.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Effective settings of one output document: the run configuration with the document's
 * {@code options} overrides applied.
 *
 * <p>Besides every renderer option, a document may override {@code useIndex},
 * {@code appendices} and {@code language}. Unknown keys are logged and ignored.
 *
 * @param document descriptor
 * @param render effective renderer options
 * @param useIndex whether the general index is appended
 * @param appendices DocumentIDs appended after the indices
 * @param language label locale
 */
public record DocumentSettings(
    OutputDocument document,
    RenderOptions render,
    boolean useIndex,
    List<String> appendices,
    String language
) {
    private static final Logger log = LoggerFactory.getLogger(DocumentSettings.class);

    static final Set<String> DOCUMENT_KEYS = Set.of("useIndex", "appendices", "language");

    public DocumentSettings {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(render, "render must not be null");
        appendices = appendices == null ? List.of() : List.copyOf(appendices);
        language = language == null ? "en_US" : language;
    }

    /**
     * Resolves the settings of a document.
     *
     * @param config run configuration
     * @param document descriptor
     * @return effective settings
     * @throws IllegalArgumentException if an override has the wrong type
     */
    public static DocumentSettings resolve(BinderConfig config, OutputDocument document) {
        Map<String, Object> options = document.options();
        for (String key : options.keySet()) {
            if (!DOCUMENT_KEYS.contains(key) && !RenderOptions.OPTION_NAMES.contains(key)) {
                log.warn("{}: ignoring unknown option '{}'", document.targetName(), key);
            }
        }

        boolean useIndex = booleanOption(options, "useIndex", config.useIndex());
        List<String> appendices = options.containsKey("appendices")
            ? stringList(options.get("appendices"))
            : config.appendices();
        String language = options.containsKey("language")
            ? String.valueOf(options.get("language"))
            : config.language();

        return new DocumentSettings(document, config.render().withOverrides(options), useIndex, appendices, language);
    }

    private static boolean booleanOption(Map<String, Object> options, String key, boolean fallback) {
        Object value = options.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().strip());
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }
}
