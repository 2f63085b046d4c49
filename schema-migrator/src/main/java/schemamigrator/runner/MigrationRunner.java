package schemamigrator.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import schemamigrator.Migration;
import schemamigrator.alert.MigrationAlertLogger;
import schemamigrator.config.MigrationConfig;
import schemamigrator.config.MigrationConfigLoader;
import schemamigrator.discovery.MigrationLoader;
import schemamigrator.exceptions.MigrationException;
import schemamigrator.generate.MigrationGenerator;
import schemamigrator.lock.MigrationLock;
import schemamigrator.lock.NoopMigrationLock;
import schemamigrator.lock.TableMigrationLock;
import schemamigrator.port.SchemaPort;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Applies and reverts registered migrations against a {@link SchemaPort},
 * recording what ran in the {@value MigrationRepository#TABLE} bookkeeping table.
 *
 * <p>Each migration runs inside its own transaction together with its bookkeeping
 * write, so a failure leaves neither schema changes nor a record behind. A batch
 * groups everything applied by one {@link #migrate()} call; {@link #rollback(int)}
 * reverts whole batches, newest first.
 *
 * <p>Pretend runs report what would happen without writing anything, not even
 * the bookkeeping table.
 *
 * <p>Every public operation that touches the database holds the configured
 * {@link MigrationLock} for its duration. Instances are not thread-safe.
 * Close the runner to release class loaders opened by {@link #loadMigrations(Path)}.
 *
 * <pre>{@code
 * MigrationRunner runner = new MigrationRunner(port, MigrationConfigLoader.load());
 * runner.loadMigrations();
 * List<String> ran = runner.migrate();
 * }</pre>
 */
public class MigrationRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    public static final String MIGRATIONS_TABLE = MigrationRepository.TABLE;

    private final SchemaPort port;
    private final MigrationRepository repository;
    private final MigrationRegistry registry = new MigrationRegistry();
    private final MigrationLoader loader = new MigrationLoader();

    private MigrationLock lock = NoopMigrationLock.INSTANCE;
    private Clock clock = Clock.systemDefaultZone();

    private Path migrationsPath;
    private String scanPackage;
    private Path generatePath;
    private String generatePackage = MigrationConfig.DEFAULTS.generatePackage();

    public MigrationRunner(SchemaPort port) {
        this(port, MigrationConfig.DEFAULTS);
    }

    public MigrationRunner(SchemaPort port, MigrationConfig config) {
        this.port = Objects.requireNonNull(port, "port");
        this.repository = new MigrationRepository(port);
        applyConfig(config);
    }

    /**
     * Apply migration configuration: discovery and generation paths, locking and alert level.
     */
    public MigrationRunner applyConfig(MigrationConfig config) {
        if (config == null) return this;

        this.migrationsPath = config.migrationsPath();
        this.scanPackage = config.scanPackage();
        this.generatePath = config.generatePath();
        this.generatePackage = config.generatePackage();
        this.lock = config.lockEnabled()
                ? new TableMigrationLock(port, config.lockTimeout())
                : NoopMigrationLock.INSTANCE;
        MigrationAlertLogger.setAlertLevel(config.alertLevel());

        log.debug("Applied config: {}", config);
        return this;
    }

    /**
     * Load configuration from the default classpath resource and apply it.
     *
     * @see MigrationConfigLoader#load()
     */
    public MigrationRunner loadAndApplyConfig() {
        return applyConfig(MigrationConfigLoader.load());
    }

    public MigrationRunner setLock(MigrationLock lock) {
        this.lock = lock == null ? NoopMigrationLock.INSTANCE : lock;
        return this;
    }

    public MigrationRunner setMigrationsPath(Path path) {
        this.migrationsPath = path;
        return this;
    }

    public MigrationRunner setScanPackage(String packageName) {
        this.scanPackage = packageName;
        return this;
    }

    public MigrationRunner setGeneratePath(Path path) {
        this.generatePath = path;
        return this;
    }

    public MigrationRunner setGeneratePackage(String packageName) {
        this.generatePackage = packageName;
        return this;
    }

    /** Clock used to timestamp generated migrations. */
    public MigrationRunner setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    // ---------------- registration ----------------

    /**
     * Register a migration. A migration registered under an existing name replaces it.
     *
     * @throws MigrationException invalid-migration if the name or version is blank
     */
    public MigrationRunner register(Migration migration) throws MigrationException {
        Objects.requireNonNull(migration, "migration");
        String name = migration.name();
        if (name == null || name.isBlank()) {
            throw MigrationException.invalidMigration(
                    migration.getClass().getName(), "name must not be blank");
        }
        String version = migration.version();
        if (version == null || version.isBlank()) {
            throw MigrationException.invalidMigration(name, "version must not be blank");
        }
        registry.register(migration);
        return this;
    }

    public MigrationRunner registerAll(Collection<? extends Migration> migrations) throws MigrationException {
        for (Migration m : migrations) {
            register(m);
        }
        return this;
    }

    /** Registered migrations, oldest version first. */
    public List<Migration> getMigrations() {
        return registry.ordered();
    }

    /**
     * Discover and register migrations from the configured directory, or the
     * configured package when no directory is set.
     *
     * @return number of migrations registered
     * @throws MigrationException load-failed if neither source is configured or discovery fails
     */
    public int loadMigrations() throws MigrationException {
        if (migrationsPath != null) {
            return loadMigrations(migrationsPath);
        }
        if (scanPackage != null) {
            return loadMigrationsFromPackage(scanPackage);
        }
        throw MigrationException.loadFailed("<unset>", "neither a migrations path nor a scan package is configured");
    }

    /**
     * Discover and register every migration class under a directory of compiled
     * classes or jars.
     */
    public int loadMigrations(Path directory) throws MigrationException {
        List<Migration> found = loader.fromDirectory(directory);
        registerAll(found);
        log.debug("Registered {} migration(s) from {}", found.size(), directory);
        return found.size();
    }

    /** Discover and register every migration class in a package on the classpath. */
    public int loadMigrationsFromPackage(String packageName) throws MigrationException {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        List<Migration> found = loader.fromPackage(packageName, cl != null ? cl : getClass().getClassLoader());
        registerAll(found);
        log.debug("Registered {} migration(s) from package {}", found.size(), packageName);
        return found.size();
    }

    /** Release class loaders opened for directory scans. Loaded migrations stay registered. */
    @Override
    public void close() {
        loader.close();
    }

    // ---------------- operations ----------------

    public List<String> migrate() throws MigrationException {
        return migrate(false);
    }

    /**
     * Apply every pending migration, oldest version first, in one new batch.
     * Stops at the first failure; migrations applied before it stay applied.
     *
     * @param pretend report what would run without touching schema or bookkeeping
     * @return names applied (or that would be applied), in order
     */
    public List<String> migrate(boolean pretend) throws MigrationException {
        try (MigrationLock.Handle ignored = lock.acquire()) {
            return doMigrate(pretend);
        }
    }

    public void run(Migration migration) throws MigrationException {
        run(migration, false);
    }

    /**
     * Apply one migration in a batch of its own, registering it if it is not
     * registered yet. A pretend run leaves the registry untouched.
     *
     * @throws MigrationException migration-already-ran if it has a bookkeeping row
     */
    public void run(Migration migration, boolean pretend) throws MigrationException {
        Objects.requireNonNull(migration, "migration");
        if (!pretend && !registry.contains(migration.name())) {
            register(migration);
        }
        try (MigrationLock.Handle ignored = lock.acquire()) {
            if (!pretend) {
                repository.createIfMissing();
            }
            if (repository.find(migration.name()).isPresent()) {
                throw MigrationException.migrationAlreadyRan(migration.name());
            }
            long start = System.nanoTime();
            MigrationAlertLogger.runStarted("run", 1, pretend);
            if (!pretend) {
                apply(migration, repository.nextBatchNumber());
            }
            MigrationAlertLogger.runCompleted("run", List.of(migration.name()), elapsedMs(start), pretend);
        }
    }

    /**
     * Revert one applied migration regardless of its batch.
     *
     * @throws MigrationException migration-not-ran if it has no bookkeeping row
     */
    public void revert(Migration migration, boolean pretend) throws MigrationException {
        Objects.requireNonNull(migration, "migration");
        try (MigrationLock.Handle ignored = lock.acquire()) {
            MigrationRecord record = repository.find(migration.name())
                    .orElseThrow(() -> MigrationException.migrationNotRan(migration.name()));
            long start = System.nanoTime();
            MigrationAlertLogger.runStarted("revert", 1, pretend);
            if (!pretend) {
                unapply(migration, record);
            }
            MigrationAlertLogger.runCompleted("revert", List.of(migration.name()), elapsedMs(start), pretend);
        }
    }

    public List<String> rollback() throws MigrationException {
        return rollback(1, false);
    }

    public List<String> rollback(int steps) throws MigrationException {
        return rollback(steps, false);
    }

    /**
     * Revert the last {@code steps} batches, most recently applied first.
     *
     * @throws IllegalArgumentException if steps is less than 1
     * @throws MigrationException migration-not-found if a recorded migration is not registered
     */
    public List<String> rollback(int steps, boolean pretend) throws MigrationException {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1, got " + steps);
        }
        try (MigrationLock.Handle ignored = lock.acquire()) {
            List<MigrationRecord> records = repository.lastBatches(steps);
            long start = System.nanoTime();
            MigrationAlertLogger.runStarted("rollback", records.size(), pretend);

            List<String> reverted = new ArrayList<>();
            for (MigrationRecord record : records) {
                Migration migration = registry.find(record.migration())
                        .orElseThrow(() -> MigrationException.migrationNotFound(record.migration()));
                if (!pretend) {
                    unapply(migration, record);
                }
                reverted.add(record.migration());
            }

            MigrationAlertLogger.runCompleted("rollback", reverted, elapsedMs(start), pretend);
            return reverted;
        }
    }

    public List<String> reset() throws MigrationException {
        return reset(false);
    }

    /**
     * Revert every applied migration, most recently applied first. Recorded
     * migrations that are not registered are skipped and left in the table.
     */
    public List<String> reset(boolean pretend) throws MigrationException {
        try (MigrationLock.Handle ignored = lock.acquire()) {
            return doReset(pretend);
        }
    }

    public List<String> refresh() throws MigrationException {
        return refresh(false);
    }

    /**
     * {@link #reset(boolean)} followed by {@link #migrate(boolean)} under one lock.
     *
     * @return names applied by the migrate half
     */
    public List<String> refresh(boolean pretend) throws MigrationException {
        try (MigrationLock.Handle ignored = lock.acquire()) {
            doReset(pretend);
            return doMigrate(pretend);
        }
    }

    // ---------------- queries ----------------

    /**
     * Status of every registered migration, oldest version first. Does not create
     * the bookkeeping table.
     */
    public List<MigrationStatus> status() {
        Map<String, MigrationRecord> completed = repository.completedByName();
        List<MigrationStatus> result = new ArrayList<>();
        for (Migration m : registry.ordered()) {
            MigrationRecord record = completed.get(m.name());
            result.add(record != null ? MigrationStatus.applied(record) : MigrationStatus.pending(m.name()));
        }
        return result;
    }

    /** Registered migrations with no bookkeeping row, oldest version first. */
    public List<Migration> getPending() {
        Set<String> completed = new HashSet<>(repository.completedNames());
        List<Migration> pending = new ArrayList<>();
        for (Migration m : registry.ordered()) {
            if (!completed.contains(m.name())) {
                pending.add(m);
            }
        }
        return pending;
    }

    /** Names recorded as applied, in insertion order. Empty if the table does not exist. */
    public List<String> getCompleted() {
        return repository.completedNames();
    }

    public boolean hasPending() {
        return !getPending().isEmpty();
    }

    /**
     * Version of the most recently applied migration, or {@code "0"} when nothing
     * has run or the latest record is not registered.
     */
    public String getCurrentVersion() {
        return repository.latest()
                .flatMap(r -> registry.find(r.migration()))
                .map(Migration::version)
                .orElse("0");
    }

    /** Highest registered version, or {@code "0"} with nothing registered. */
    public String getLatestVersion() {
        return registry.latest().map(Migration::version).orElse("0");
    }

    public int getNextBatchNumber() {
        return repository.nextBatchNumber();
    }

    public boolean hasMigrationsTable() {
        return repository.exists();
    }

    public void createMigrationsTable() {
        repository.createIfMissing();
    }

    /** Pending migrations mapped to their descriptions, oldest first. */
    public Map<String, String> preview() {
        Map<String, String> result = new LinkedHashMap<>();
        for (Migration m : getPending()) {
            result.put(m.name(), m.description());
        }
        return result;
    }

    /**
     * Write a new migration source file under the configured generate path.
     *
     * @param name snake or camel case name, e.g. {@code create_posts_table}
     * @param table table the stub should target, or null for empty stubs
     * @param create true to emit create/drop table stubs, false for alter stubs
     * @return the written file
     */
    public Path generate(String name, String table, boolean create) throws MigrationException {
        if (generatePath == null) {
            throw MigrationException.generateFailed(name, "generate path is not configured");
        }
        return new MigrationGenerator(clock).generate(generatePath, generatePackage, name, table, create);
    }

    // ---------------- internals ----------------

    private List<String> doMigrate(boolean pretend) throws MigrationException {
        if (!pretend) {
            repository.createIfMissing();
        }
        List<Migration> pending = getPending();
        long start = System.nanoTime();
        MigrationAlertLogger.runStarted("migrate", pending.size(), pretend);

        List<String> ran = new ArrayList<>();
        if (!pending.isEmpty()) {
            int batch = repository.nextBatchNumber();
            for (Migration m : pending) {
                if (!pretend) {
                    apply(m, batch);
                }
                ran.add(m.name());
            }
        }

        MigrationAlertLogger.runCompleted("migrate", ran, elapsedMs(start), pretend);
        return ran;
    }

    private List<String> doReset(boolean pretend) throws MigrationException {
        List<MigrationRecord> records = repository.newestFirst();
        long start = System.nanoTime();
        MigrationAlertLogger.runStarted("reset", records.size(), pretend);

        List<String> reverted = new ArrayList<>();
        for (MigrationRecord record : records) {
            Migration migration = registry.find(record.migration()).orElse(null);
            if (migration == null) {
                MigrationAlertLogger.migrationSkipped(record.migration(), "not registered");
                continue;
            }
            if (!pretend) {
                unapply(migration, record);
            }
            reverted.add(record.migration());
        }

        MigrationAlertLogger.runCompleted("reset", reverted, elapsedMs(start), pretend);
        return reverted;
    }

    private void apply(Migration migration, int batch) throws MigrationException {
        long start = System.nanoTime();
        try {
            port.transaction().run(() -> {
                migration.up(port);
                repository.log(migration.name(), batch);
            });
        } catch (RuntimeException e) {
            MigrationException failure = MigrationException.migrationFailed(migration.name(), e);
            MigrationAlertLogger.migrationFailed(migration.name(), failure);
            throw failure;
        }
        MigrationAlertLogger.migrationApplied(migration.name(), batch, elapsedMs(start));
    }

    private void unapply(Migration migration, MigrationRecord record) throws MigrationException {
        long start = System.nanoTime();
        try {
            port.transaction().run(() -> {
                migration.down(port);
                repository.delete(record.migration());
            });
        } catch (RuntimeException e) {
            MigrationException failure = MigrationException.rollbackFailed(migration.name(), e);
            MigrationAlertLogger.rollbackFailed(migration.name(), failure);
            throw failure;
        }
        MigrationAlertLogger.migrationRolledBack(migration.name(), record.batch(), elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
