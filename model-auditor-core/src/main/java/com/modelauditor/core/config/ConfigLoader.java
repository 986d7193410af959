package com.modelauditor.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@code modelauditor.yaml} into {@link AuditConfig}.
 *
 * <p>A missing, unreadable or malformed file never stops an audit: a warning is
 * logged and {@link AuditConfig#defaults()} is returned.
 */
public final class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "modelauditor.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code modelauditor.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AuditConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AuditConfig config = YAML_MAPPER.readValue(configPath.toFile(), AuditConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AuditConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AuditConfig.defaults();
        }
    }

    /**
     * Parses configuration strictly, for validation.
     *
     * @param configPath path to the YAML file
     * @return parsed configuration
     * @throws IOException if the file cannot be read or is not valid YAML for this schema
     */
    public static AuditConfig parse(Path configPath) throws IOException {
        AuditConfig config = YAML_MAPPER.readValue(configPath.toFile(), AuditConfig.class);
        return config == null ? AuditConfig.defaults() : config;
    }
}
