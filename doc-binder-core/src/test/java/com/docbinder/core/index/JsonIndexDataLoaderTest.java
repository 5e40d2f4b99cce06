package com.docbinder.core.index;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonIndexDataLoaderTest {

    @TempDir
    Path tempDir;

    private final JsonIndexDataLoader loader = new JsonIndexDataLoader();

    @Test
    void loadEntries_missingFile_returnsEmptyTable() {
        assertThat(loader.loadEntries(tempDir).documents()).isEmpty();
        assertThat(loader.loadDomainIndices(tempDir)).isEmpty();
    }

    @Test
    void loadEntries_validFile_readsBuckets() throws IOException {
        // Given
        Files.writeString(tempDir.resolve(JsonIndexDataLoader.INDEX_FILE), """
            {
              "intro": [
                {"term": "widget", "page": "intro", "anchor": "w"},
                {"term": "parrot; dead", "groupKind": "pair", "page": "intro", "anchor": "p"}
              ]
            }
            """);

        // When
        IndexEntryTable table = loader.loadEntries(tempDir);

        // Then
        assertThat(table.get("intro")).extracting(IndexEntry::groupKind).containsExactly("single", "pair");
    }

    @Test
    void loadDomainIndices_validFile_readsIndices() throws IOException {
        // Given
        Files.writeString(tempDir.resolve(JsonIndexDataLoader.DOMAINS_FILE), """
            [
              {
                "domainName": "py",
                "indexName": "modindex",
                "localName": "Python Module Index",
                "groups": [
                  {"letter": "w", "entries": [{"term": "widgets", "anchor": "module-widgets"}]}
                ]
              }
            ]
            """);

        // When
        List<DomainIndex> indices = loader.loadDomainIndices(tempDir);

        // Then
        assertThat(indices).singleElement().satisfies(index -> {
            assertThat(index.fullName()).isEqualTo("py-modindex");
            assertThat(index.generate().isEmpty()).isFalse();
        });
    }

    @Test
    void loadEntries_malformedFile_throwsIllegalState() throws IOException {
        // Given
        Files.writeString(tempDir.resolve(JsonIndexDataLoader.INDEX_FILE), "{ not json");

        // When / Then
        assertThatThrownBy(() -> loader.loadEntries(tempDir)).isInstanceOf(IllegalStateException.class);
    }
}
