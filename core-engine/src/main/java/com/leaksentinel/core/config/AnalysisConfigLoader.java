package com.leaksentinel.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates the default {@link AnalysisConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}, by default
 * {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * The YAML document is a flat mapping using the same snake_case keys as the
 * JSON request body. SnakeYAML parses it into a generic mapping which is then
 * bound by Jackson, so both front doors share one set of names and defaults.
 * Every {@code load*} method validates before returning.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYSIS_CONFIG_PATH";

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULT_RESOURCE = "analysis-defaults.yml";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private AnalysisConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws InvalidConfigurationException if validation fails
     */
    public static AnalysisConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analysis configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading analysis configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException      if the file does not exist
     * @throws IllegalStateException         if reading fails
     * @throws InvalidConfigurationException if parsing or validation fails
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException      if the resource does not exist
     * @throws IllegalStateException         if reading fails
     * @throws InvalidConfigurationException if parsing or validation fails
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Bind a flat key/value mapping (for example a decoded request body) onto
     * a fresh configuration and validate it.
     *
     * @param values snake_case keys; {@code null} means all defaults
     * @return validated configuration
     * @throws InvalidConfigurationException if binding or validation fails
     */
    public static AnalysisConfig fromMap(Map<?, ?> values) {
        AnalysisConfig config;
        try {
            config = values == null ? new AnalysisConfig() : MAPPER.convertValue(values, AnalysisConfig.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Malformed analysis configuration: "
                    + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
        }

        if (document == null) {
            LOG.warn("Analysis configuration is empty, using built-in defaults");
            return fromMap(null);
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new InvalidConfigurationException(
                    "Analysis configuration must be a mapping, got: " + document.getClass().getSimpleName(),
                    null);
        }

        AnalysisConfig config = fromMap(map);
        LOG.info("Loaded analysis configuration: {}", config);
        return config;
    }
}
