package com.docbinder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocBinder command line")
class DocBinderCLITest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("docs"));
        outputDir = tempDir.resolve("out");
        Files.writeString(sourceDir.resolve("index.json"), """
            {"kind": "document", "children": [
              {"kind": "section", "attributes": {"ids": ["welcome"]}, "children": [
                {"kind": "title", "children": ["Welcome"]},
                {"kind": "toctree", "attributes": {"includefiles": ["usage", "ghost"]}}
              ]}
            ]}
            """);
        Files.writeString(sourceDir.resolve("usage.json"), """
            {"kind": "document", "children": [
              {"kind": "section", "attributes": {"ids": ["usage"]}, "children": [
                {"kind": "title", "children": ["Usage"]},
                {"kind": "literal_block", "children": ["$ docbinder build docs"]}
              ]}
            ]}
            """);
        Files.writeString(sourceDir.resolve("docbinder.yaml"), """
            project:
              name: Widgets
              version: "1.0"
            documents:
              - docname: index
                targetName: manual
                title: Widgets Manual
                author: Jane Doe
            today: "June 2024"
            """);
    }

    @Test
    @DisplayName("build writes one output per configured document")
    void build_validSources_writesOutput() throws IOException {
        // When
        int exitCode = DocBinderCLI.commandLine()
            .execute("build", sourceDir.toString(), "-o", outputDir.toString());

        // Then
        assertThat(exitCode).isZero();
        Path manual = outputDir.resolve("manual.json");
        assertThat(manual).exists();
        JsonNode json = new ObjectMapper().readTree(manual.toFile());
        assertThat(json.path("tree").path("attributes").path("title").asText()).isEqualTo("Widgets Manual");
        assertThat(json.toString()).contains("June 2024", "Usage");
    }

    @Test
    @DisplayName("build with an unknown renderer fails")
    void build_unknownRenderer_returnsOne() {
        int exitCode = DocBinderCLI.commandLine()
            .execute("build", sourceDir.toString(), "-o", outputDir.toString(), "-r", "nonexistent");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("status reports outdated documents until they are built")
    void status_beforeAndAfterBuild() {
        // Given
        String[] status = {"status", sourceDir.toString(), "-o", outputDir.toString()};

        // When / Then
        assertThat(DocBinderCLI.commandLine().execute(status)).isEqualTo(2);
        assertThat(DocBinderCLI.commandLine().execute("build", sourceDir.toString(), "-o", outputDir.toString()))
            .isZero();
        assertThat(DocBinderCLI.commandLine().execute(status)).isZero();
    }

    @Test
    @DisplayName("list shows renderers and documents")
    void list_knownTypes_succeed() {
        assertThat(DocBinderCLI.commandLine().execute("list", "renderers")).isZero();
        assertThat(DocBinderCLI.commandLine().execute("list", "documents", sourceDir.toString())).isZero();
        assertThat(DocBinderCLI.commandLine().execute("list", "widgets")).isEqualTo(1);
    }
}
