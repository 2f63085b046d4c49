package schemamigrator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Central configuration for the migration runner.
 *
 * <p>This class encapsulates:
 * <ul>
 *   <li>Where migrations are discovered (a directory or a classpath package)</li>
 *   <li>Where and in which package new migrations are generated</li>
 *   <li>Advisory lock settings</li>
 *   <li>Alert level</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code schema-migrator.properties} or
 * {@code schema-migrator.yml} using {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 * @see schemamigrator.runner.MigrationRunner#applyConfig(MigrationConfig)
 */
public final class MigrationConfig {

    public static final MigrationConfig DEFAULTS = builder().build();

    private final Path migrationsPath;
    private final String scanPackage;
    private final Path generatePath;
    private final String generatePackage;
    private final boolean lockEnabled;
    private final Duration lockTimeout;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.migrationsPath = b.migrationsPath;
        this.scanPackage = b.scanPackage;
        this.generatePath = b.generatePath;
        this.generatePackage = b.generatePackage;
        this.lockEnabled = b.lockEnabled;
        this.lockTimeout = b.lockTimeout;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the directory of compiled migrations, or null if not set. */
    public Path migrationsPath() { return migrationsPath; }

    /** Returns the classpath package to scan for migrations, or null if not set. */
    public String scanPackage() { return scanPackage; }

    /** Returns the source root generated migrations are written to, or null if not set. */
    public Path generatePath() { return generatePath; }

    /** Returns the package of generated migrations. */
    public String generatePackage() { return generatePackage; }

    /** Returns true if the table based advisory lock is enabled. */
    public boolean lockEnabled() { return lockEnabled; }

    /** Returns how long to wait for the advisory lock. */
    public Duration lockTimeout() { return lockTimeout; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "migrationsPath=" + migrationsPath +
                ", scanPackage=" + scanPackage +
                ", generatePath=" + generatePath +
                ", generatePackage=" + generatePackage +
                ", lockEnabled=" + lockEnabled +
                ", lockTimeout=" + lockTimeout.toSeconds() + "s" +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private Path migrationsPath;
        private String scanPackage;
        private Path generatePath;
        private String generatePackage = "migrations";
        private boolean lockEnabled = false;
        private Duration lockTimeout = Duration.ofSeconds(30);
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder migrationsPath(Path path) {
            this.migrationsPath = path;
            return this;
        }

        public Builder scanPackage(String pkg) {
            this.scanPackage = pkg;
            return this;
        }

        public Builder generatePath(Path path) {
            this.generatePath = path;
            return this;
        }

        public Builder generatePackage(String pkg) {
            if (pkg == null || pkg.isBlank()) throw new IllegalArgumentException("generatePackage must not be blank");
            this.generatePackage = pkg;
            return this;
        }

        public Builder lockEnabled(boolean enabled) {
            this.lockEnabled = enabled;
            return this;
        }

        public Builder lockTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative()) throw new IllegalArgumentException("lockTimeout must not be negative");
            this.lockTimeout = timeout;
            return this;
        }

        public Builder lockTimeoutSeconds(long seconds) {
            return lockTimeout(Duration.ofSeconds(Math.max(0, seconds)));
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
