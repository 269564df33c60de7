package replacer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Loads replacer configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code replacer.properties} on the classpath</li>
 *   <li>{@code replacer.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file values, using the same keys
 * (e.g. {@code -Dreplacer.batch.size=50}). Invalid values are logged and left at their default.
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code replacer.batch.size} - reports per batch</li>
 *   <li>{@code replacer.rewrite.workers} - rewrite pool size</li>
 *   <li>{@code replacer.retry.max.attempts} - attempts per connector call</li>
 *   <li>{@code replacer.retry.backoff.base.ms} - first retry delay</li>
 *   <li>{@code replacer.retry.backoff.max.ms} - retry delay cap</li>
 *   <li>{@code replacer.retry.backoff.jitter} - jitter fraction, 0 to 1</li>
 *   <li>{@code replacer.timeout.connector} - connector call timeout in seconds, 0 disables</li>
 *   <li>{@code replacer.deploy.poll.interval} - seconds between deploy status checks</li>
 *   <li>{@code replacer.deploy.max.wait} - seconds before a pending deploy fails its batch</li>
 *   <li>{@code replacer.continue.on.error} - true to keep going after a failed batch</li>
 *   <li>{@code replacer.workspace.dir} - root of retrieve/deploy/backup/runs</li>
 *   <li>{@code replacer.api.version} - metadata API version</li>
 *   <li>{@code replacer.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see ReplacerConfig
 */
public final class ReplacerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ReplacerConfigLoader.class);

    private ReplacerConfigLoader() {}

    /**
     * Load from classpath (replacer.properties or replacer.yml).
     * @throws ReplacerConfigException if no config file found
     */
    public static ReplacerConfig load() {
        InputStream is = getResource("replacer.properties");
        if (is != null) {
            return loadProperties(is, "replacer.properties");
        }

        is = getResource("replacer.yml");
        if (is != null) {
            return loadYaml(is, "replacer.yml");
        }

        throw new ReplacerConfigException(
                "Config file required: replacer.properties or replacer.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws ReplacerConfigException if the file cannot be parsed
     */
    public static ReplacerConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return ReplacerConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static ReplacerConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new ReplacerConfigException("Failed to load " + source, e);
        }
    }

    private static ReplacerConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (YAMLException | IOException e) {
            throw new ReplacerConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static ReplacerConfig parse(Properties props) {
        ReplacerConfig.Builder b = ReplacerConfig.builder();

        getInt(props, "replacer.batch.size").ifPresent(v -> apply(b::batchSize, v, "batch.size"));
        getInt(props, "replacer.rewrite.workers").ifPresent(v -> apply(b::rewriteWorkers, v, "rewrite.workers"));
        getInt(props, "replacer.retry.max.attempts").ifPresent(v -> apply(b::maxAttempts, v, "retry.max.attempts"));
        getLong(props, "replacer.retry.backoff.base.ms").ifPresent(b::backoffBaseMillis);
        getLong(props, "replacer.retry.backoff.max.ms").ifPresent(b::backoffMaxMillis);
        getDouble(props, "replacer.retry.backoff.jitter").ifPresent(v -> apply(b::backoffJitter, v, "retry.backoff.jitter"));
        getLong(props, "replacer.timeout.connector").ifPresent(b::connectorTimeoutSeconds);
        getLong(props, "replacer.deploy.poll.interval").ifPresent(b::deployPollIntervalSeconds);
        getLong(props, "replacer.deploy.max.wait").ifPresent(b::deployMaxWaitSeconds);

        getString(props, "replacer.continue.on.error")
                .ifPresent(v -> b.continueOnError(Boolean.parseBoolean(v)));
        getString(props, "replacer.workspace.dir")
                .filter(v -> !v.isEmpty())
                .ifPresent(v -> b.workspaceDir(Path.of(v)));
        getString(props, "replacer.api.version")
                .filter(v -> !v.isEmpty())
                .ifPresent(b::apiVersion);

        getString(props, "replacer.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            log.warn("Inconsistent retry backoff settings ({}), using defaults", e.getMessage());
            return b.backoffBase(ReplacerConfig.DEFAULTS.backoffBase())
                    .backoffMax(ReplacerConfig.DEFAULTS.backoffMax())
                    .build();
        }
    }

    private static <T> void apply(Consumer<T> setter, T value, String key) {
        try {
            setter.accept(value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {}: {}", key, value);
        }
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Double> getDouble(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Double.parseDouble(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
