package com.urdfix.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.urdfix.core.analyzer.LintRule;
import com.urdfix.core.analyzer.UrdfAnalyzer;

/**
 * Loads urdfix configuration from {@code urdfix.yaml}.
 *
 * <p>The location may be the file itself or the directory holding it, typically the
 * directory of the description being processed. A configuration that cannot be used
 * never aborts an operation: a missing, unreadable, empty or malformed file yields
 * {@link UrdfixConfig#defaults()}. Disabled lint rule ids that no discovered rule
 * carries are reported, since a misspelled id silently disables nothing.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * UrdfixConfig config = ConfigLoader.load(urdfFile.getParent());
 * List<String> changes = new UrdfModifier().fix(doc, config.fixOptions(), config.formatOptions());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "urdfix.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file or from {@value #DEFAULT_FILE_NAME} inside a directory.
     *
     * @param location path to the file, or to the directory containing it
     * @return loaded configuration, or defaults if none can be used
     */
    public static UrdfixConfig load(Path location) {
        Path configFile = resolve(location);
        UrdfixConfig config = read(configFile);
        warnAboutUnknownRules(config, configFile);
        return config;
    }

    /**
     * Resolves the configuration file for a location.
     *
     * @param location a file or a directory
     * @return {@code location} itself, or {@value #DEFAULT_FILE_NAME} inside it for a directory
     */
    public static Path resolve(Path location) {
        return Files.isDirectory(location) ? location.resolve(DEFAULT_FILE_NAME) : location;
    }

    private static UrdfixConfig read(Path configFile) {
        if (Files.notExists(configFile)) {
            log.warn("No urdfix configuration at {}, using defaults", configFile);
            return UrdfixConfig.defaults();
        }
        if (!Files.isReadable(configFile)) {
            log.warn("urdfix configuration {} is not readable, using defaults", configFile);
            return UrdfixConfig.defaults();
        }

        log.debug("Reading urdfix configuration from {}", configFile);
        try {
            UrdfixConfig config = YAML_MAPPER.readValue(configFile.toFile(), UrdfixConfig.class);
            if (config == null) {
                log.warn("urdfix configuration {} is empty, using defaults", configFile);
                return UrdfixConfig.defaults();
            }
            log.info("Loaded urdfix configuration from {}", configFile);
            return config;
        } catch (IOException e) {
            log.error("Invalid urdfix configuration {}, using defaults: {}", configFile, e.getMessage());
            return UrdfixConfig.defaults();
        }
    }

    private static void warnAboutUnknownRules(UrdfixConfig config, Path configFile) {
        if (config.lint() == null || config.lint().disabled() == null) {
            return;
        }
        Set<String> known = UrdfAnalyzer.discoverRules().stream()
            .map(LintRule::getId)
            .collect(Collectors.toSet());
        List<String> unknown = config.lint().disabled().stream()
            .filter(id -> !known.contains(id))
            .toList();
        if (!unknown.isEmpty()) {
            log.warn("{} disables unknown lint rule(s): {}", configFile, String.join(", ", unknown));
        }
    }
}
