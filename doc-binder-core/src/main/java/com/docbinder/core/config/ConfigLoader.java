package com.docbinder.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the DocBinder configuration from YAML.
 *
 * <p>Uses Jackson to deserialize {@code docbinder.yaml} into {@link BinderConfig}. If the
 * file is missing or invalid, returns {@link BinderConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BinderConfig config = ConfigLoader.load(sourceDir.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * for (OutputDocument document : config.effectiveDocuments()) {
 *     ...
 * }
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "docbinder.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link BinderConfig#defaults()}.
     *
     * @param configPath path to {@code docbinder.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static BinderConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return BinderConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return BinderConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            BinderConfig config = YAML_MAPPER.readValue(configPath.toFile(), BinderConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return BinderConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return BinderConfig.defaults();
        }
    }
}
