package schemamigrator.lock;

import schemamigrator.alert.MigrationAlertLogger;
import schemamigrator.exceptions.MigrationException;
import schemamigrator.exceptions.QueryException;
import schemamigrator.exceptions.SchemaException;
import schemamigrator.port.SchemaPort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Advisory lock stored in the database itself.
 *
 * <p>Holding the lock means owning the single row with {@code id = 1} in the
 * {@value #LOCK_TABLE} table. The primary key makes a second insert fail with a
 * duplicate-key {@link QueryException}, which is how a competing process learns
 * the lock is taken; it then polls until {@code timeout} elapses.
 *
 * <p>Works with any {@link SchemaPort}, so separate processes sharing one
 * database exclude each other. A process that dies while holding the lock
 * leaves the row behind; delete it by hand.
 */
public final class TableMigrationLock implements MigrationLock {

    private static final Logger log = LoggerFactory.getLogger(TableMigrationLock.class);

    public static final String LOCK_TABLE = "migrations_lock";
    static final long LOCK_ID = 1L;

    private final SchemaPort port;
    private final Duration timeout;
    private final Duration pollInterval;
    private final String owner;

    public TableMigrationLock(SchemaPort port, Duration timeout) {
        this(port, timeout, Duration.ofMillis(500), UUID.randomUUID().toString());
    }

    /**
     * @param port port of the database that holds the lock row
     * @param timeout how long {@link #acquire()} waits before giving up
     * @param pollInterval pause between attempts
     * @param owner identifier written into the lock row
     */
    public TableMigrationLock(SchemaPort port, Duration timeout, Duration pollInterval, String owner) {
        this.port = Objects.requireNonNull(port, "port");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String owner() {
        return owner;
    }

    @Override
    public Handle acquire() throws MigrationException {
        ensureLockTable();

        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        while (true) {
            try {
                port.query().table(LOCK_TABLE).insert(Map.of("id", LOCK_ID, "owner", owner));
                MigrationAlertLogger.lockAcquired(owner, Duration.ofNanos(System.nanoTime() - start).toMillis());
                return this::release;
            } catch (QueryException e) {
                if (!e.isDuplicateKey()) {
                    throw MigrationException.lockFailed(e.getMessage(), e);
                }
                log.debug("Migration lock held by another owner, waiting");
            }

            if (System.nanoTime() - deadline >= 0) {
                throw MigrationException.lockTimeout(timeout);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw MigrationException.lockFailed("interrupted while waiting", e);
            }
        }
    }

    private void release() {
        int deleted = port.query().table(LOCK_TABLE)
                .where("id", "=", LOCK_ID)
                .where("owner", "=", owner)
                .delete();
        if (deleted == 0) {
            log.warn("Migration lock row for owner {} was already gone on release", owner);
        }
        MigrationAlertLogger.lockReleased(owner);
    }

    private void ensureLockTable() throws MigrationException {
        if (port.schema().tableExists(LOCK_TABLE)) return;
        try {
            port.schema().createTable(LOCK_TABLE,
                    "id INT UNSIGNED PRIMARY KEY, owner VARCHAR(255) NOT NULL, "
                            + "acquired_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
        } catch (SchemaException e) {
            // another process may have created it in between
            if (!port.schema().tableExists(LOCK_TABLE)) {
                throw MigrationException.lockFailed("cannot create " + LOCK_TABLE, e);
            }
        }
    }
}
