package com.outbreaksentinel.core.config;

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
 * Loads and validates {@link PipelineSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods call {@link PipelineSettings#validate()} after
 * parsing, so a misconfigured pipeline fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineSettingsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    /** Classpath resource used when no override is present. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private PipelineSettingsLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings using automatic resolution: {@code PIPELINE_CONFIG_PATH}
     * if set and the file exists, otherwise {@code pipeline.yml} on the
     * classpath.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static PipelineSettings load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading pipeline settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading pipeline settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load settings from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * Load settings from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PipelineSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static PipelineSettings parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PipelineSettings.class, options));

        PipelineSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed pipeline settings in " + source + ": " + e.getMessage(), e);
        }
        if (settings == null) {
            LOG.warn("Pipeline settings in {} are empty, using defaults", source);
            settings = new PipelineSettings();
        }
        settings.validate();

        if (settings.getActions().isEmpty()) {
            LOG.warn("No recommended-action rules defined in {}", source);
        }
        LOG.info("Loaded {}", settings);
        return settings;
    }
}
