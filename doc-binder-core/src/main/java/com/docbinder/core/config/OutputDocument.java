package com.docbinder.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Descriptor of one output document.
 *
 * @param docname root DocumentID
 * @param targetName output name, without extension
 * @param title document title
 * @param author author string, lines separated by a backslash
 * @param options per-document overrides of configuration and renderer options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OutputDocument(
    @JsonProperty("docname") String docname,
    @JsonProperty("targetName") String targetName,
    @JsonProperty("title") String title,
    @JsonProperty("author") String author,
    @JsonProperty("options") Map<String, Object> options
) {
    public OutputDocument {
        Objects.requireNonNull(docname, "docname must not be null");
        targetName = targetName == null || targetName.isBlank() ? docname.replace('/', '-') : targetName;
        title = title == null ? "" : title;
        author = author == null ? "" : author;
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public OutputDocument(String docname, String targetName, String title, String author) {
        this(docname, targetName, title, author, Map.of());
    }
}
