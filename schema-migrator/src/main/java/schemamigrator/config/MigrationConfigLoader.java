package schemamigrator.config;

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

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code schema-migrator.properties} on the classpath</li>
 *   <li>{@code schema-migrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties can override file-based configuration
 * (e.g., {@code -Dmigration.alert.level=DEBUG}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.path} - directory of compiled migration classes or jars</li>
 *   <li>{@code migration.scan.package} - classpath package to scan when no path is set</li>
 *   <li>{@code migration.generate.path} - source root for generated migrations</li>
 *   <li>{@code migration.generate.package} - package of generated migrations</li>
 *   <li>{@code migration.lock.enabled} - true to use the table based advisory lock</li>
 *   <li>{@code migration.lock.timeout} - lock wait in seconds</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    static final String PROPERTIES_RESOURCE = "schema-migrator.properties";
    static final String YAML_RESOURCE = "schema-migrator.yml";

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (schema-migrator.properties or schema-migrator.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource(PROPERTIES_RESOURCE);
        if (is != null) {
            return loadProperties(is, PROPERTIES_RESOURCE);
        }

        is = getResource(YAML_RESOURCE);
        if (is != null) {
            return loadYaml(is, YAML_RESOURCE);
        }

        throw new MigrationConfigException(
                "Config file required: " + PROPERTIES_RESOURCE + " or " + YAML_RESOURCE);
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration cannot be parsed
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

    /**
     * Loads configuration from an external file path.
     *
     * @param path path to the configuration file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static MigrationConfig loadFromFile(String path) throws IOException {
        return loadFromFile(Path.of(path));
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException | IOException e) {
            throw new MigrationConfigException("Failed to parse " + source, e);
        }
        if (root == null) {
            return MigrationConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getString(props, "migration.path").ifPresent(v -> b.migrationsPath(Path.of(v)));
        getString(props, "migration.scan.package").ifPresent(b::scanPackage);
        getString(props, "migration.generate.path").ifPresent(v -> b.generatePath(Path.of(v)));
        getString(props, "migration.generate.package").ifPresent(v -> {
            if (!v.isEmpty()) b.generatePackage(v);
        });

        getString(props, "migration.lock.enabled").ifPresent(v -> b.lockEnabled(Boolean.parseBoolean(v)));
        getLong(props, "migration.lock.timeout").ifPresent(v -> {
            if (v >= 0) {
                b.lockTimeoutSeconds(v);
            } else {
                log.warn("Invalid lock.timeout: {}", v);
            }
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
