package com.docbinder.core.pipeline;

import com.docbinder.core.index.DomainIndex;
import com.docbinder.core.index.IndexEntryTable;
import com.docbinder.core.index.JsonIndexDataLoader;
import com.docbinder.core.source.JsonSourceTreeProvider;
import com.docbinder.core.source.SourceTreeProvider;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Inputs shared by every output document of a run.
 *
 * @param sourceDirectory directory of the serialized source trees
 * @param outputDirectory directory receiving rendered documents
 * @param provider source-tree provider
 * @param indexEntries shared general-index entry table
 * @param domainIndices domain index providers
 */
public record BuildEnvironment(
    Path sourceDirectory,
    Path outputDirectory,
    SourceTreeProvider provider,
    IndexEntryTable indexEntries,
    List<DomainIndex> domainIndices
) {
    public BuildEnvironment {
        Objects.requireNonNull(sourceDirectory, "sourceDirectory must not be null");
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        indexEntries = indexEntries == null ? new IndexEntryTable() : indexEntries;
        domainIndices = domainIndices == null ? List.of() : List.copyOf(domainIndices);
    }

    /**
     * Loads the environment of a directory of JSON trees, with its optional
     * {@code _index.json} and {@code _domains.json} files.
     *
     * @param sourceDirectory directory of the serialized trees
     * @param outputDirectory directory receiving rendered documents
     * @return loaded environment
     */
    public static BuildEnvironment load(Path sourceDirectory, Path outputDirectory) {
        JsonIndexDataLoader loader = new JsonIndexDataLoader();
        return new BuildEnvironment(
            sourceDirectory,
            outputDirectory,
            new JsonSourceTreeProvider(sourceDirectory),
            loader.loadEntries(sourceDirectory),
            loader.loadDomainIndices(sourceDirectory));
    }
}
