package com.docbinder.core.config;

import com.docbinder.core.cover.CoverPageRenderer;
import com.docbinder.core.renderer.RenderOptions;
import com.docbinder.core.toc.BacklinkPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a DocBinder run, loaded from {@code docbinder.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Widgets"
 *   version: "2.1"
 *   copyright: "ACME Corp"
 *
 * documents:
 *   - docname: index
 *     targetName: widgets
 *     title: "Widgets Manual"
 *     author: "Jane Doe\\John Roe"
 *     options:
 *       tocDepth: 2
 *       appendices: [glossary]
 *
 * domainIndices: [py-modindex]
 * tocBacklinks: entry
 * render:
 *   pageTemplate: decoratedPage
 * }</pre>
 *
 * <p>Every component may be omitted; missing values take the defaults of
 * {@link #defaults()}.
 *
 * @param project project metadata
 * @param masterDoc root DocumentID of the synthesized descriptor when {@code documents} is empty
 * @param language label locale, e.g. {@code en_US}
 * @param highlightLanguage default language of literal blocks
 * @param documents output document descriptors
 * @param useIndex whether a general index is appended
 * @param domainIndices domain indices to append
 * @param useModindex whether the Python module index may be appended
 * @param coverTemplate cover page template name
 * @param templatesPath extra template directories, relative to the source directory
 * @param appendices DocumentIDs appended after the indices
 * @param today fixed date string for the cover page
 * @param todayFormat date pattern used when {@code today} is blank
 * @param subtitlePrefix word preceding the version in the cover subtitle
 * @param tocBacklinks where section titles link back to
 * @param tabWidth spaces per tab in literal blocks
 * @param parallelBuild whether output documents are built concurrently
 * @param verbosity 0 warnings only, 1 progress, 2 and above debug
 * @param outputDirectory directory receiving rendered documents
 * @param renderer id of the page renderer
 * @param render default renderer options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinderConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("masterDoc") String masterDoc,
    @JsonProperty("language") String language,
    @JsonProperty("highlightLanguage") String highlightLanguage,
    @JsonProperty("documents") List<OutputDocument> documents,
    @JsonProperty("useIndex") Boolean useIndex,
    @JsonProperty("domainIndices") DomainIndexSelection domainIndices,
    @JsonProperty("useModindex") Boolean useModindex,
    @JsonProperty("coverTemplate") String coverTemplate,
    @JsonProperty("templatesPath") List<String> templatesPath,
    @JsonProperty("appendices") List<String> appendices,
    @JsonProperty("today") String today,
    @JsonProperty("todayFormat") String todayFormat,
    @JsonProperty("subtitlePrefix") String subtitlePrefix,
    @JsonProperty("tocBacklinks") BacklinkPolicy tocBacklinks,
    @JsonProperty("tabWidth") Integer tabWidth,
    @JsonProperty("parallelBuild") Boolean parallelBuild,
    @JsonProperty("verbosity") Integer verbosity,
    @JsonProperty("outputDirectory") String outputDirectory,
    @JsonProperty("renderer") String renderer,
    @JsonProperty("render") RenderOptions render
) {
    public BinderConfig {
        project = project == null ? new ProjectInfo(null, null, null) : project;
        masterDoc = masterDoc == null || masterDoc.isBlank() ? "index" : masterDoc;
        language = language == null || language.isBlank() ? "en_US" : language;
        highlightLanguage = highlightLanguage == null ? "python" : highlightLanguage;
        documents = documents == null ? List.of() : List.copyOf(documents);
        useIndex = useIndex == null || useIndex;
        domainIndices = domainIndices == null ? DomainIndexSelection.allIndices() : domainIndices;
        useModindex = useModindex == null || useModindex;
        coverTemplate = coverTemplate == null || coverTemplate.isBlank() ? CoverPageRenderer.DEFAULT_TEMPLATE : coverTemplate;
        templatesPath = templatesPath == null ? List.of() : List.copyOf(templatesPath);
        appendices = appendices == null ? List.of() : List.copyOf(appendices);
        today = today == null ? "" : today;
        todayFormat = todayFormat == null ? "" : todayFormat;
        subtitlePrefix = subtitlePrefix == null ? "version" : subtitlePrefix;
        tocBacklinks = tocBacklinks == null ? BacklinkPolicy.ENTRY : tocBacklinks;
        tabWidth = tabWidth == null ? 8 : tabWidth;
        parallelBuild = parallelBuild != null && parallelBuild;
        verbosity = verbosity == null ? 0 : verbosity;
        outputDirectory = outputDirectory == null || outputDirectory.isBlank() ? "_build/pdf" : outputDirectory;
        renderer = renderer == null || renderer.isBlank() ? "json" : renderer;
        render = render == null ? RenderOptions.defaults() : render;
    }

    /**
     * Creates the default configuration.
     *
     * @return defaults
     */
    public static BinderConfig defaults() {
        return new BinderConfig(null, null, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns the configured documents, or a single descriptor for the master document
     * when none are configured.
     *
     * @return output documents in build order
     */
    public List<OutputDocument> effectiveDocuments() {
        if (!documents.isEmpty()) {
            return documents;
        }
        return List.of(new OutputDocument(
            masterDoc, project.name(), project.name() + " Documentation", project.copyright()));
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param copyright copyright holder, used as author of the synthesized descriptor
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("copyright") String copyright
    ) {
        public ProjectInfo {
            name = name == null || name.isBlank() ? "project" : name;
            version = version == null ? "" : version;
            copyright = copyright == null ? "" : copyright;
        }
    }
}
