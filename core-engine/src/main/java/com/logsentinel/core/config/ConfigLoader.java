package com.logsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link SentinelConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE} via
 * {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing so that a misconfigured
 * threshold fails the process at start-up instead of silently changing which
 * errors get alerted on.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Load configuration using automatic resolution: the file named by
     * {@value #ENV_CONFIG_PATH} if it exists, otherwise {@value #DEFAULT_RESOURCE}
     * on the classpath, otherwise built-in defaults.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static SentinelConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading sentinel config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (ConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.warn("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
            SentinelConfig defaults = new SentinelConfig();
            defaults.validate();
            return defaults;
        }
        LOG.info("Loading sentinel config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static SentinelConfig fromFile(String path) {
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
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static SentinelConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelConfig.class, options));
        SentinelConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Empty sentinel configuration, using built-in defaults");
            config = new SentinelConfig();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
