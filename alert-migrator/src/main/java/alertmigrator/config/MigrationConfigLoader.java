package alertmigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code alert-migration.properties} on the classpath</li>
 *   <li>{@code alert-migration.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration. The backup
 * acknowledgment can also be given through the {@code UALERT_MIG}
 * environment variable, which is only consulted when no property sets it.
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.backup.ack} - must equal {@code iDidBackup} to enable migrations</li>
 *   <li>{@code migration.ngalert.enabled} - true if unified alerting is enabled</li>
 *   <li>{@code migration.failure.policy} - ABORT or SKIP_AND_REPORT</li>
 *   <li>{@code migration.rule.default.interval} - default interval in seconds</li>
 *   <li>{@code migration.history.size} - number of history entries</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    static final String BACKUP_ENV = "UALERT_MIG";

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (alert-migration.properties or alert-migration.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource("alert-migration.properties");
        if (is != null) {
            return loadProperties(is, "alert-migration.properties");
        }

        is = getResource("alert-migration.yml");
        if (is != null) {
            return loadYaml(is, "alert-migration.yml");
        }

        throw new MigrationConfigException(
                "Config file required: alert-migration.properties or alert-migration.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props, System::getenv);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        } catch (RuntimeException e) {
            throw new MigrationConfigException("Invalid YAML in " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props, System::getenv);
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

    static MigrationConfig parse(Properties props, UnaryOperator<String> env) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        Optional<String> ack = getString(props, "migration.backup.ack").filter(v -> !v.isEmpty());
        b.backupAcknowledgment(ack.orElseGet(() -> env.apply(BACKUP_ENV)));

        getString(props, "migration.ngalert.enabled").ifPresent(v -> b.ngAlertEnabled(Boolean.parseBoolean(v)));

        getString(props, "migration.failure.policy").ifPresent(v -> {
            try {
                b.failurePolicy(FailurePolicy.valueOf(v.toUpperCase().replace('-', '_')));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid failure.policy: {}", v);
            }
        });

        getLong(props, "migration.rule.default.interval").ifPresent(v -> {
            if (v > 0) b.defaultIntervalSeconds(v);
            else log.warn("Ignoring non-positive rule.default.interval: {}", v);
        });

        getLong(props, "migration.history.size").ifPresent(v -> {
            if (v > 0 && v <= Integer.MAX_VALUE) b.historySize(v.intValue());
        });

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
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
}
