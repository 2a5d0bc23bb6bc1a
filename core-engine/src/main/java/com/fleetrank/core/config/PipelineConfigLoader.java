package com.fleetrank.core.config;

import com.fleetrank.core.error.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link PipelineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link PipelineConfig#validate()} after
 * parsing so a bad window size, strategy name or weight stops the job before
 * any series is read.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private PipelineConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code PIPELINE_CONFIG_PATH} is set and the file exists, load
     * from there.</li>
     * <li>Otherwise, fall back to {@code pipeline.yml} on the classpath.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws ConfigException if the configuration is invalid
     */
    public static PipelineConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Load from {@code path} when it names an existing file, else from the
     * default classpath resource.
     *
     * @param path candidate file path; may be {@code null}
     * @return parsed and validated configuration
     */
    public static PipelineConfig load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading pipeline config from path: {}", path);
            return fromFile(path);
        }
        if (path != null && !path.isBlank()) {
            LOG.warn("Pipeline config path {} does not exist, falling back to classpath", path);
        }
        LOG.info("Loading pipeline config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException if {@code path} is {@code null}
     * @throws ConfigException      if the file is missing, unreadable or invalid
     */
    public static PipelineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new ConfigException("Pipeline config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read pipeline config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException if {@code resource} is {@code null}
     * @throws ConfigException      if the resource is missing, unreadable or invalid
     */
    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static PipelineConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PipelineConfig.class, options));

        PipelineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed pipeline config " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Pipeline config {} is empty, using defaults", source);
            config = new PipelineConfig();
        }
        config.validate();

        LOG.info("Loaded pipeline config: {}", config);
        return config;
    }
}
