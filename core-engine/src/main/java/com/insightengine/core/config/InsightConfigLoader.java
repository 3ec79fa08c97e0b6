package com.insightengine.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.BeanAccess;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the engine options from YAML.
 *
 * <p>
 * A deployment normally ships one {@code insight-engine.yml} next to the
 * code and overrides it per environment by pointing
 * {@value #ENV_CONFIG_PATH} at another file. Only the options that differ
 * from the defaults need to be listed; a file without
 * {@code recommendationTemplates} gets the built-in catalog.
 * </p>
 *
 * <p>
 * Every loaded configuration has passed {@link EngineConfig#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class InsightConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(InsightConfigLoader.class);

    /** Points at a YAML file that replaces the bundled options. */
    public static final String ENV_CONFIG_PATH = "INSIGHT_CONFIG_PATH";

    /** Bundled options, read from the classpath. */
    public static final String DEFAULT_RESOURCE = "insight-engine.yml";

    private InsightConfigLoader() {
    }

    /**
     * The file named by {@value #ENV_CONFIG_PATH} when it exists, the bundled
     * {@value #DEFAULT_RESOURCE} otherwise.
     *
     * @return validated engine options
     */
    public static EngineConfig load() {
        String override = System.getenv(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank() && Files.exists(Path.of(override))) {
            return fromFile(override);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file with engine options
     * @return validated engine options
     * @throws IllegalArgumentException if there is no such file
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalStateException    if an option is out of range
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return parseAndValidate(in, "file " + path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Engine options file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read engine options from " + path, e);
        }
    }

    /**
     * @param resource classpath resource with engine options
     * @return validated engine options
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws UncheckedIOException     if the resource cannot be read
     * @throws IllegalStateException    if an option is out of range
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = InsightConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Engine options resource not found on classpath: " + resource);
        }
        try (in) {
            return parseAndValidate(in, "classpath " + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read engine options from classpath " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));
        // option names such as zScoreThreshold are not valid bean property names
        yaml.setBeanAccess(BeanAccess.FIELD);
        EngineConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("No engine options in {}, using defaults", source);
            config = new EngineConfig();
        }
        // field access bypasses the setters, so re-apply their null handling
        config.setMetricDirections(config.getMetricDirections());
        config.setRecommendationTemplates(config.getRecommendationTemplates());
        if (config.getRecommendationTemplates().isEmpty()) {
            config.setRecommendationTemplates(EngineConfig.builtInTemplates());
        }

        config.validate();

        LOG.info("Loaded engine options from {} ({} recommendation template(s))",
                source, config.getRecommendationTemplates().size());
        return config;
    }
}
