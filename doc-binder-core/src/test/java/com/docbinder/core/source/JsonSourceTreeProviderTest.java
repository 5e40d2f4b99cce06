package com.docbinder.core.source;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSourceTreeProviderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        write("index.json", """
            {"kind": "document", "children": [
              {"kind": "section", "attributes": {"ids": ["top"]}, "children": [
                {"kind": "title", "children": ["Top"]},
                {"kind": "toctree", "attributes": {"includefiles": ["api/widgets", "ghost"]}}
              ]}
            ]}
            """);
        write("api/widgets.json", """
            {"kind": "document", "attributes": {"docname": "api/widgets"}, "children": [
              {"kind": "paragraph", "children": ["Widgets"]}
            ]}
            """);
        write("_index.json", "{}");
        write("_build/pdf/manual.json", "{\"options\": {}}");
        write(".cache/stale.json", "{}");
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void allKnownDocuments_skipsReservedPaths() {
        // When
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(tempDir);

        // Then
        assertThat(provider.allKnownDocuments()).containsExactlyInAnyOrder("index", "api/widgets");
        assertThat(provider.isKnown("_index")).isFalse();
    }

    @Test
    void getTree_parsesAndDefaultsDocname() {
        // Given
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(tempDir);

        // When
        Node tree = provider.getTree("index");

        // Then
        assertThat(tree.getString(Node.DOCNAME)).isEqualTo("index");
        assertThat(tree.nextNode(NodeKind.TITLE).orElseThrow().astext()).isEqualTo("Top");
        assertThat(provider.getTree("index")).isSameAs(tree);
    }

    @Test
    void getTree_unknownDocument_throws() {
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(tempDir);

        assertThatThrownBy(() -> provider.getTree("ghost"))
            .isInstanceOf(UnknownDocumentException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void navigationGraph_derivedFromToctrees() {
        // When
        NavigationGraph graph = new JsonSourceTreeProvider(tempDir).navigationGraph();

        // Then
        assertThat(graph.includedBy("index")).containsExactly("api/widgets", "ghost");
        assertThat(graph.includersOf("api/widgets")).containsExactly("index");
        assertThat(graph.reachableFrom("index")).containsExactly("index", "api/widgets", "ghost");
    }

    @Test
    void lastModified_readsFileTime() throws IOException {
        // Given
        Instant when = Instant.parse("2024-01-02T03:04:05Z");
        Files.setLastModifiedTime(tempDir.resolve("index.json"), FileTime.from(when));
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(tempDir);

        // When / Then
        assertThat(provider.lastModified("index")).contains(when);
        assertThat(provider.lastModified("ghost")).isEmpty();
    }

    @Test
    void getTree_rootIsNotDocument_throws() throws IOException {
        // Given
        write("broken.json", "{\"kind\": \"paragraph\"}");
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(tempDir);

        // When / Then
        assertThatThrownBy(() -> provider.getTree("broken"))
            .isInstanceOf(SourceTreeException.class)
            .hasMessageContaining("expected document");
    }

    @Test
    void navigationGraph_unreadableFile_skippedAndReported() throws IOException {
        // Given
        write("notes.json", "{not json");
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(tempDir);

        // When
        NavigationGraph graph = provider.navigationGraph();

        // Then
        assertThat(graph.includedBy("index")).containsExactly("api/widgets", "ghost");
        assertThat(provider.unreadableDocuments()).containsExactly("notes");
        assertThatThrownBy(() -> provider.getTree("notes"))
            .isInstanceOf(SourceTreeException.class)
            .hasMessageContaining("notes.json");
    }
}
