package schemamigrator.exceptions;

/**
 * Exception thrown when a transaction operation fails.
 *
 * <p>Covers begin, commit, rollback and savepoint handling. Carries the
 * nesting level at the time of failure and, for savepoint operations, the
 * savepoint name.
 *
 * @see schemamigrator.port.TransactionManager
 */
public class TransactionException extends DatabaseException {

    /**
     * What went wrong.
     */
    public enum Kind {
        NESTED_UNSUPPORTED,
        BEGIN_FAILED,
        COMMIT_FAILED,
        ROLLBACK_FAILED,
        NO_ACTIVE_TRANSACTION,
        SAVEPOINT_FAILED,
        SAVEPOINT_NOT_FOUND,
        DEADLOCK,
        LOCK_TIMEOUT
    }

    private final Kind kind;
    private final int level;
    private final String savepointName;

    public TransactionException(String message, Kind kind, int level, String savepointName, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.level = level;
        this.savepointName = savepointName;
    }

    // ---------------- named constructors ----------------

    public static TransactionException nestedNotSupported() {
        return new TransactionException(
                "Nested transactions are not supported by this database driver",
                Kind.NESTED_UNSUPPORTED, 0, null, null);
    }

    public static TransactionException beginFailed(String reason, int level, Throwable cause) {
        return new TransactionException("Failed to begin transaction: " + reason, Kind.BEGIN_FAILED, level, null, cause);
    }

    public static TransactionException commitFailed(String reason, int level, Throwable cause) {
        return new TransactionException("Failed to commit transaction: " + reason, Kind.COMMIT_FAILED, level, null, cause);
    }

    public static TransactionException rollbackFailed(String reason, int level, Throwable cause) {
        return new TransactionException("Failed to rollback transaction: " + reason, Kind.ROLLBACK_FAILED, level, null, cause);
    }

    public static TransactionException noActiveTransaction(String operation) {
        return new TransactionException(
                String.format("Cannot %s: no active transaction", operation),
                Kind.NO_ACTIVE_TRANSACTION, 0, null, null);
    }

    public static TransactionException savepointFailed(String name, String operation, Throwable cause) {
        return new TransactionException(
                String.format("Savepoint \"%s\" %s failed", name, operation),
                Kind.SAVEPOINT_FAILED, 0, name, cause);
    }

    public static TransactionException savepointNotFound(String name) {
        return new TransactionException(
                String.format("Savepoint \"%s\" does not exist", name),
                Kind.SAVEPOINT_NOT_FOUND, 0, name, null);
    }

    public static TransactionException deadlockDetected(int level, Throwable cause) {
        return new TransactionException(
                "Deadlock detected, transaction rolled back", Kind.DEADLOCK, level, null, cause);
    }

    public static TransactionException lockTimeout(int level, Throwable cause) {
        return new TransactionException("Lock wait timeout exceeded", Kind.LOCK_TIMEOUT, level, null, cause);
    }

    // ---------------- classification ----------------

    public boolean isDeadlock() {
        return kind == Kind.DEADLOCK;
    }

    public boolean isLockTimeout() {
        return kind == Kind.LOCK_TIMEOUT;
    }

    @Override
    public boolean isRetryable() {
        return isDeadlock() || isLockTimeout();
    }

    // ---------------- getters ----------------

    public Kind getKind() {
        return kind;
    }

    /** Returns the transaction nesting level when the error occurred. */
    public int getLevel() {
        return level;
    }

    /** Returns the savepoint name, or null if the failure was not about a savepoint. */
    public String getSavepointName() {
        return savepointName;
    }
}
