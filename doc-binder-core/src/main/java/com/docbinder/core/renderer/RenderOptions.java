package com.docbinder.core.renderer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options handed to the {@link PageRenderer} for one output document.
 *
 * <p>Every component is optional in YAML; a missing value takes the default listed in
 * {@link #defaults()}.
 *
 * @param stylesheets stylesheet names, applied in order
 * @param fontPath extra font search directories
 * @param stylePath stylesheet search directories
 * @param breakLevel section level that starts a new page, 0 for none
 * @param breakSide page side new chapters start on ({@code odd}, {@code even}, {@code any})
 * @param fitMode how oversized literal blocks are fitted
 * @param compressed whether the output is compressed
 * @param inlineFootnotes whether footnotes are rendered where they appear
 * @param realFootnotes whether footnotes go to the bottom of the page
 * @param splitTables whether tables may split across pages
 * @param repeatTableRows whether header rows repeat after a table split
 * @param defaultDpi resolution of images without one
 * @param pageTemplate page template of body pages
 * @param invariant whether output is byte-for-byte reproducible
 * @param useToc whether a table of contents is generated
 * @param tocDepth maximum depth of the table of contents
 * @param useCoverpage whether a cover page is generated
 * @param useNumberedLinks whether links show section numbers
 * @param fitBackgroundMode how background images are fitted
 * @param baseUrl base URL of relative links
 * @param smartquotes smart-quote mode
 * @param sectionHeaderDepth depth of sections shown in page headers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderOptions(
    @JsonProperty("stylesheets") List<String> stylesheets,
    @JsonProperty("fontPath") List<String> fontPath,
    @JsonProperty("stylePath") List<String> stylePath,
    @JsonProperty("breakLevel") Integer breakLevel,
    @JsonProperty("breakSide") String breakSide,
    @JsonProperty("fitMode") String fitMode,
    @JsonProperty("compressed") Boolean compressed,
    @JsonProperty("inlineFootnotes") Boolean inlineFootnotes,
    @JsonProperty("realFootnotes") Boolean realFootnotes,
    @JsonProperty("splitTables") Boolean splitTables,
    @JsonProperty("repeatTableRows") Boolean repeatTableRows,
    @JsonProperty("defaultDpi") Integer defaultDpi,
    @JsonProperty("pageTemplate") String pageTemplate,
    @JsonProperty("invariant") Boolean invariant,
    @JsonProperty("useToc") Boolean useToc,
    @JsonProperty("tocDepth") Integer tocDepth,
    @JsonProperty("useCoverpage") Boolean useCoverpage,
    @JsonProperty("useNumberedLinks") Boolean useNumberedLinks,
    @JsonProperty("fitBackgroundMode") String fitBackgroundMode,
    @JsonProperty("baseUrl") String baseUrl,
    @JsonProperty("smartquotes") String smartquotes,
    @JsonProperty("sectionHeaderDepth") Integer sectionHeaderDepth
) {
    /** Names accepted by {@link #withOverrides(Map)}. */
    public static final Set<String> OPTION_NAMES = Arrays.stream(RenderOptions.class.getRecordComponents())
        .map(component -> component.getName())
        .collect(Collectors.toUnmodifiableSet());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public RenderOptions {
        stylesheets = stylesheets == null ? List.of("sphinx") : List.copyOf(stylesheets);
        fontPath = fontPath == null ? List.of() : List.copyOf(fontPath);
        stylePath = stylePath == null ? List.of() : List.copyOf(stylePath);
        breakLevel = breakLevel == null ? 0 : breakLevel;
        breakSide = breakSide == null ? "odd" : breakSide;
        fitMode = fitMode == null ? "" : fitMode;
        compressed = compressed != null && compressed;
        inlineFootnotes = inlineFootnotes == null || inlineFootnotes;
        realFootnotes = realFootnotes != null && realFootnotes;
        splitTables = splitTables == null || splitTables;
        repeatTableRows = repeatTableRows != null && repeatTableRows;
        defaultDpi = defaultDpi == null ? 300 : defaultDpi;
        pageTemplate = pageTemplate == null ? "decoratedPage" : pageTemplate;
        invariant = invariant != null && invariant;
        useToc = useToc == null || useToc;
        tocDepth = tocDepth == null ? 9999 : tocDepth;
        useCoverpage = useCoverpage == null || useCoverpage;
        useNumberedLinks = useNumberedLinks != null && useNumberedLinks;
        fitBackgroundMode = fitBackgroundMode == null ? "scale" : fitBackgroundMode;
        baseUrl = baseUrl == null ? Path.of("").toAbsolutePath().toUri().toString() : baseUrl;
        smartquotes = smartquotes == null ? "0" : smartquotes;
        sectionHeaderDepth = sectionHeaderDepth == null ? 2 : sectionHeaderDepth;
    }

    /**
     * Creates the default options.
     *
     * @return defaults
     */
    public static RenderOptions defaults() {
        return new RenderOptions(null, null, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with some options replaced. Keys not naming an option are ignored;
     * values are converted to the option's type.
     *
     * @param overrides option name to new value
     * @return merged options
     * @throws IllegalArgumentException if a value cannot be converted
     */
    public RenderOptions withOverrides(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() { }));
        overrides.forEach((name, value) -> {
            if (OPTION_NAMES.contains(name)) {
                merged.put(name, value);
            }
        });
        return MAPPER.convertValue(merged, RenderOptions.class);
    }

    /**
     * Returns the options as a map keyed by option name.
     *
     * @return option values
     */
    public Map<String, Object> asMap() {
        return MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() { });
    }
}
