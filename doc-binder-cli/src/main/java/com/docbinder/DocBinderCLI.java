package com.docbinder;

import ch.qos.logback.classic.Level;
import com.docbinder.cli.BuildCommand;
import com.docbinder.cli.ListCommand;
import com.docbinder.cli.StatusCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocBinder.
 *
 * <p>DocBinder binds a directory of parsed documentation trees into one page-ready
 * document per configured output, with contents, indices, cover page and resolved
 * cross-references.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build every configured output document</li>
 *   <li>{@code list} - List configured documents or available renderers</li>
 *   <li>{@code status} - List output documents whose sources changed since the last build</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Build the documents configured in ./docs/docbinder.yaml
 * docbinder build docs
 *
 * # Build with debug output into another directory
 * docbinder -v build docs -o out/pdf
 *
 * # Which documents need rebuilding?
 * docbinder status docs
 * }</pre>
 */
@Command(
    name = "docbinder",
    mixinStandardHelpOptions = true,
    version = "DocBinder 1.0.0-SNAPSHOT",
    description = "Binds documentation trees into page-ready documents",
    subcommands = {
        BuildCommand.class,
        ListCommand.class,
        StatusCommand.class
    }
)
public class DocBinderCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocBinderCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocBinder - Documentation tree binder");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docbinder --help' to see available commands");
        System.out.println("Use 'docbinder <command> --help' for command-specific help");
    }

    /**
     * Configures the root logger level from the global options.
     */
    public void configureLogging() {
        if (quiet) {
            setRootLevel(Level.ERROR);
        } else if (verbose) {
            setRootLevel(Level.DEBUG);
        } else {
            setRootLevel(Level.INFO);
        }
    }

    /**
     * Applies the {@code verbosity} configuration value, unless a global option already
     * chose the level.
     *
     * @param verbosity 0 warnings only, 1 progress, 2 and above debug
     */
    public void applyVerbosity(int verbosity) {
        if (quiet || verbose) {
            return;
        }
        Level level = verbosity > 1 ? Level.DEBUG : verbosity > 0 ? Level.INFO : Level.WARN;
        log.debug("Applying configured verbosity {}", verbosity);
        setRootLevel(level);
    }

    private static void setRootLevel(Level level) {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocBinderCLI cli = new DocBinderCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
