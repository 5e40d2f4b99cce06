package com.docbinder.cli;

import com.docbinder.core.config.BinderConfig;
import com.docbinder.core.config.OutputDocument;
import com.docbinder.core.renderer.PageRenderer;
import com.docbinder.core.source.JsonSourceTreeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list the configured output documents or the available renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docbinder list documents docs
 * docbinder list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List configured documents or available renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: documents or renderers"
    )
    private String type;

    @Parameters(
        index = "1",
        description = "Source directory (default: current directory)",
        defaultValue = "."
    )
    private Path sourceDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docbinder.yaml)"
    )
    private Path configPath = Paths.get("docbinder.yaml");

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "documents", "document" -> listDocuments();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: documents or renderers", type);
                yield 1;
            }
        };
    }

    private int listDocuments() {
        BinderConfig config = CommandSupport.loadConfiguration(sourceDir, configPath);
        JsonSourceTreeProvider provider = new JsonSourceTreeProvider(sourceDir);
        List<OutputDocument> documents = config.effectiveDocuments();

        System.out.println("Output Documents:");
        System.out.println();
        for (OutputDocument document : documents) {
            String marker = provider.isKnown(document.docname()) ? "•" : "✗";
            System.out.printf("  %s %s (root: %s)%n", marker, document.targetName(), document.docname());
            System.out.printf("    Title: %s%n", document.title());
            if (!document.author().isBlank()) {
                System.out.printf("    Author: %s%n", document.author());
            }
            if (!document.options().isEmpty()) {
                System.out.printf("    Options: %s%n", document.options());
            }
            System.out.println();
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<PageRenderer> renderers = CommandSupport.discoverRenderers();
        for (PageRenderer renderer : renderers) {
            System.out.printf("  • %s (writes .%s)%n", renderer.getId(), renderer.fileExtension());
        }
        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
