package schemamigrator.exceptions;

/**
 * Base class for failures raised by a {@link schemamigrator.port.SchemaPort}.
 *
 * <p>Three kinds exist:
 * <ul>
 *   <li>{@link QueryException} - a read or write statement failed</li>
 *   <li>{@link SchemaException} - a DDL operation failed</li>
 *   <li>{@link TransactionException} - begin/commit/rollback/savepoint failed</li>
 * </ul>
 *
 * <p>These are unchecked so that they can travel through transaction callbacks
 * and migration bodies without changing signatures. None of them retry
 * internally; callers decide based on {@link #isRetryable()}.
 *
 * @see MigrationException
 */
public abstract class DatabaseException extends RuntimeException {

    protected DatabaseException(String message) {
        super(message);
    }

    protected DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true if simply re-attempting the failed operation is expected to succeed.
     *
     * @return false unless a subclass recognises a deadlock or lock timeout
     */
    public boolean isRetryable() {
        return false;
    }
}
