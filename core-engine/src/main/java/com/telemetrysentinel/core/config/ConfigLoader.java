package com.telemetrysentinel.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates {@link PipelineConfig} from a JSON or YAML document.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>{@value #DEFAULT_CONFIG_FILE} in the working directory</li>
 * </ol>
 *
 * <h3>Format</h3>
 * <p>
 * Files ending in {@code .yml} or {@code .yaml} are parsed with SnakeYAML,
 * everything else as JSON. Both are bound onto {@link PipelineSettings} by
 * Jackson, so the key set and aliases are identical. Unknown keys are
 * rejected. Relative paths in the document resolve against the directory of
 * the file that declared them.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    public static final String DEFAULT_CONFIG_FILE = "application.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if no configuration file exists
     * @throws IllegalStateException    if the document is malformed or invalid
     */
    public static PipelineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            LOG.info("Loading configuration from environment path: {}", envPath);
            return fromFile(Path.of(envPath));
        }
        LOG.info("Loading configuration from working directory: {}", DEFAULT_CONFIG_FILE);
        return fromFile(Path.of(DEFAULT_CONFIG_FILE));
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path the configuration document; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Configuration path must not be null");
        Path absolute = path.toAbsolutePath().normalize();
        try (InputStream is = Files.newInputStream(absolute)) {
            PipelineConfig config = parseAndValidate(is, isYaml(absolute.toString()), absolute.getParent());
            LOG.info("Configuration loaded from {}", absolute);
            return config;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Configuration file not found: " + absolute, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + absolute, e);
        }
    }

    /**
     * Load configuration from a classpath resource. Relative paths resolve
     * against the working directory.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, isYaml(resource), Path.of("").toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static PipelineSettings parse(InputStream is, boolean yaml) throws IOException {
        try {
            PipelineSettings settings;
            if (yaml) {
                LoaderOptions options = new LoaderOptions();
                options.setAllowDuplicateKeys(false);
                Object document = new Yaml(new SafeConstructor(options)).load(is);
                if (!(document instanceof Map<?, ?> map)) {
                    throw new IllegalStateException("Configuration document must be a mapping, got: "
                            + (document == null ? "empty document" : document.getClass().getSimpleName()));
                }
                settings = MAPPER.convertValue(map, PipelineSettings.class);
            } else {
                settings = MAPPER.readValue(is, PipelineSettings.class);
            }
            if (settings == null) {
                throw new IllegalStateException("Configuration document is empty");
            }
            return settings;
        } catch (JsonProcessingException | YAMLException e) {
            throw new IllegalStateException("Malformed configuration document: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // convertValue reports binding problems this way
            throw new IllegalStateException("Malformed configuration document: " + e.getMessage(), e);
        }
    }

    private static PipelineConfig parseAndValidate(InputStream is, boolean yaml, Path baseDir) throws IOException {
        PipelineSettings settings = parse(is, yaml);
        settings.validate();
        try {
            return settings.toConfig(baseDir);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static boolean isYaml(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }
}
