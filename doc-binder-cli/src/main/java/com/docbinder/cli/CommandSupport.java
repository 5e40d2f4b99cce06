package com.docbinder.cli;

import com.docbinder.core.config.BinderConfig;
import com.docbinder.core.config.ConfigLoader;
import com.docbinder.core.renderer.PageRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Configuration and renderer lookup shared by the commands.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    private CommandSupport() {
    }

    /**
     * Loads the configuration; a relative config path is resolved against the source
     * directory.
     */
    static BinderConfig loadConfiguration(Path sourceDir, Path configPath) {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : sourceDir.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    /**
     * Resolves the output directory: the command line wins, otherwise the configured
     * directory relative to the source directory.
     */
    static Path outputDirectory(Path sourceDir, BinderConfig config, Path override) {
        if (override != null) {
            return override;
        }
        Path configured = Path.of(config.outputDirectory());
        return configured.isAbsolute() ? configured : sourceDir.resolve(configured);
    }

    static List<PageRenderer> discoverRenderers() {
        List<PageRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(PageRenderer.class).forEach(renderers::add);
        log.debug("Discovered {} renderers", renderers.size());
        return renderers;
    }

    /**
     * Finds a renderer by id.
     *
     * @throws IllegalArgumentException if no renderer has that id
     */
    static PageRenderer findRenderer(String id) {
        return discoverRenderers().stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown renderer: " + id));
    }
}
