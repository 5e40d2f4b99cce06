package com.docbinder.cli;

import com.docbinder.DocBinderCLI;
import com.docbinder.core.config.BinderConfig;
import com.docbinder.core.pipeline.BuildEnvironment;
import com.docbinder.core.pipeline.BuildReport;
import com.docbinder.core.pipeline.DocumentBuildResult;
import com.docbinder.core.pipeline.PipelineDriver;
import com.docbinder.core.renderer.PageRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to build every configured output document.
 *
 * <p>Exits with 1 when at least one document failed; the other documents are still built.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docbinder build docs
 * docbinder build docs -o out/pdf --parallel
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build the configured output documents",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @ParentCommand
    private DocBinderCLI parent;

    @Parameters(
        index = "0",
        description = "Source directory holding the document trees (default: current directory)",
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

    @Option(
        names = {"-r", "--renderer"},
        description = "Renderer id (overrides config)"
    )
    private String rendererId;

    @Option(
        names = {"--parallel"},
        description = "Build output documents concurrently"
    )
    private boolean parallel;

    @Override
    public Integer call() {
        try {
            BinderConfig config = CommandSupport.loadConfiguration(sourceDir, configPath);
            if (parent != null) {
                parent.applyVerbosity(config.verbosity());
            }
            if (parallel && !config.parallelBuild()) {
                config = withParallelBuild(config);
            }

            PageRenderer renderer = CommandSupport.findRenderer(rendererId != null ? rendererId : config.renderer());
            Path output = CommandSupport.outputDirectory(sourceDir, config, outputDir);
            log.info("Building {} into {}", sourceDir.toAbsolutePath(), output.toAbsolutePath());

            PipelineDriver driver = new PipelineDriver(config, BuildEnvironment.load(sourceDir, output), renderer);
            BuildReport report = driver.buildAll();
            printReport(report);
            return report.hasFailures() ? 1 : 0;
        } catch (RuntimeException e) {
            log.error("Build failed", e);
            System.err.println("✗ Build failed: " + e.getMessage());
            return 1;
        }
    }

    private static BinderConfig withParallelBuild(BinderConfig config) {
        return new BinderConfig(config.project(), config.masterDoc(), config.language(), config.highlightLanguage(),
            config.documents(), config.useIndex(), config.domainIndices(), config.useModindex(),
            config.coverTemplate(), config.templatesPath(), config.appendices(), config.today(),
            config.todayFormat(), config.subtitlePrefix(), config.tocBacklinks(), config.tabWidth(),
            true, config.verbosity(), config.outputDirectory(), config.renderer(), config.render());
    }

    private static void printReport(BuildReport report) {
        for (DocumentBuildResult result : report.results()) {
            if (result.isSuccess()) {
                System.out.println("✓ " + result.targetName() + " -> " + result.output());
            } else {
                System.out.println("✗ " + result.targetName() + ": " + result.error());
            }
        }
        if (!report.warnings().isEmpty()) {
            System.out.println();
            System.out.println(report.warnings().size() + " warning(s):");
            report.warnings().forEach(warning -> System.out.println("  • " + warning));
        }
    }
}
