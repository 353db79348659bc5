package com.yaml2sbml.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ConverterConfig} from {@code yaml2sbml.yaml}.
 *
 * <p>A missing, unreadable or invalid file is not an error: a warning is logged and
 * {@link ConverterConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConverterConfig config = ConfigLoader.load(Paths.get("yaml2sbml.yaml"));
 * String unit = config.units().defaultUnit();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "yaml2sbml.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration or defaults if unavailable
     */
    public static ConverterConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ConverterConfig config = YAML_MAPPER.readValue(configPath.toFile(), ConverterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ConverterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ConverterConfig.defaults();
        }
    }
}
