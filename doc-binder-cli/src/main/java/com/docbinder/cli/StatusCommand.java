package com.docbinder.cli;

import com.docbinder.core.config.BinderConfig;
import com.docbinder.core.config.DocumentSettings;
import com.docbinder.core.config.OutputDocument;
import com.docbinder.core.pipeline.OutdatedDocumentDetector;
import com.docbinder.core.pipeline.OutdatedDocumentDetector.DocumentSources;
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
import java.util.concurrent.Callable;

/**
 * Command to list the output documents that need rebuilding.
 *
 * <p>Exits with 0 when everything is up to date and 2 when some documents are outdated.
 */
@Command(
    name = "status",
    description = "List output documents whose sources changed since they were written",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    static final int OUTDATED_EXIT_CODE = 2;

    @Parameters(
        index = "0",
        description = "Source directory (default: current directory)",
        defaultValue = "."
    )
    private Path sourceDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docbinder.yaml)"
    )
    private Path configPath = Paths.get("docbinder.yaml");

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Override
    public Integer call() {
        try {
            BinderConfig config = CommandSupport.loadConfiguration(sourceDir, configPath);
            PageRenderer renderer = CommandSupport.findRenderer(config.renderer());
            Path output = CommandSupport.outputDirectory(sourceDir, config, outputDir);
            JsonSourceTreeProvider provider = new JsonSourceTreeProvider(sourceDir);

            List<DocumentSources> documents = config.effectiveDocuments().stream()
                .filter(document -> provider.isKnown(document.docname()))
                .map(document -> new DocumentSources(document, appendicesOf(config, document)))
                .toList();
            List<String> outdated = new OutdatedDocumentDetector(provider)
                .outdatedTargets(documents, output, renderer.fileExtension());

            if (outdated.isEmpty()) {
                System.out.println("✓ All " + documents.size() + " documents are up to date");
                return 0;
            }
            System.out.println("Outdated documents:");
            outdated.forEach(target -> System.out.println("  • " + target));
            return OUTDATED_EXIT_CODE;
        } catch (RuntimeException e) {
            log.error("Status check failed", e);
            System.err.println("✗ Status check failed: " + e.getMessage());
            return 1;
        }
    }

    private static List<String> appendicesOf(BinderConfig config, OutputDocument document) {
        return DocumentSettings.resolve(config, document).appendices();
    }
}
