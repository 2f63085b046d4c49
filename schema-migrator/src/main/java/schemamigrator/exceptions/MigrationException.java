package schemamigrator.exceptions;

import java.time.Duration;

/**
 * Exception thrown when a migration operation fails.
 *
 * <p>Raised by {@link schemamigrator.runner.MigrationRunner}. When the failure
 * came from the database, the original {@link DatabaseException} is kept as the
 * cause, so callers can ask {@link #isRetryable()} before deciding whether to
 * re-run the same command.
 *
 * <p>The message already names the offending migration; {@link #getMigrationName()}
 * returns it separately for front ends that print it on its own line.
 *
 * @see schemamigrator.runner.MigrationRunner
 */
public class MigrationException extends Exception {

    private final String migrationName;
    private final String path;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrationException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with full context.
     *
     * @param message the error message
     * @param migrationName the migration involved, or null
     * @param path the migrations path involved, or null
     * @param cause the underlying cause, or null
     */
    public MigrationException(String message, String migrationName, String path, Throwable cause) {
        super(message, cause);
        this.migrationName = migrationName;
        this.path = path;
    }

    // ---------------- named constructors ----------------

    public static MigrationException migrationFailed(String name, Throwable cause) {
        return new MigrationException(
                String.format("Migration [%s] failed: %s", name, describe(cause)), name, null, cause);
    }

    public static MigrationException rollbackFailed(String name, Throwable cause) {
        return new MigrationException(
                String.format("Rollback of migration [%s] failed: %s", name, describe(cause)), name, null, cause);
    }

    public static MigrationException migrationNotFound(String name) {
        return new MigrationException(String.format("Migration [%s] not found", name), name, null, null);
    }

    public static MigrationException migrationAlreadyRan(String name) {
        return new MigrationException(
                String.format("Migration [%s] has already been executed", name), name, null, null);
    }

    public static MigrationException migrationNotRan(String name) {
        return new MigrationException(
                String.format("Migration [%s] has not been executed and cannot be rolled back", name),
                name, null, null);
    }

    public static MigrationException invalidMigration(String name, String reason) {
        return new MigrationException(String.format("Invalid migration [%s]: %s", name, reason), name, null, null);
    }

    public static MigrationException loadFailed(String path, String reason) {
        return loadFailed(path, reason, null);
    }

    public static MigrationException loadFailed(String path, String reason, Throwable cause) {
        return new MigrationException(
                String.format("Failed to load migrations from [%s]: %s", path, reason), null, path, cause);
    }

    public static MigrationException generateFailed(String name, String reason) {
        return generateFailed(name, reason, null);
    }

    public static MigrationException generateFailed(String name, String reason, Throwable cause) {
        return new MigrationException(
                String.format("Failed to generate migration [%s]: %s", name, reason), name, null, cause);
    }

    public static MigrationException lockFailed(String reason, Throwable cause) {
        return new MigrationException("Failed to acquire migration lock: " + reason, null, null, cause);
    }

    public static MigrationException lockTimeout(Duration timeout) {
        return new MigrationException(
                String.format("Timed out after %d ms waiting for the migration lock", timeout.toMillis()));
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }

    // ---------------- getters ----------------

    /**
     * Returns the name of the migration involved.
     *
     * @return the migration name, or null if the failure is not about one migration
     */
    public String getMigrationName() {
        return migrationName;
    }

    /**
     * Returns the migrations path for load failures.
     *
     * @return the path, or null
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns true if a retryable {@link DatabaseException} appears anywhere in the cause chain.
     */
    public boolean isRetryable() {
        Throwable t = getCause();
        while (t != null) {
            if (t instanceof DatabaseException && ((DatabaseException) t).isRetryable()) {
                return true;
            }
            if (t == t.getCause()) break;
            t = t.getCause();
        }
        return false;
    }
}
