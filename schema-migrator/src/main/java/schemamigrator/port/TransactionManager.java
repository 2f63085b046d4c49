package schemamigrator.port;

/**
 * Transaction control for a {@link SchemaPort}.
 *
 * <p>Calls to {@link #begin()} nest; an inner level is backed by a savepoint
 * where the adapter supports it. Failures are reported as
 * {@link schemamigrator.exceptions.TransactionException}.
 */
public interface TransactionManager {

    void begin();

    void commit();

    void rollback();

    boolean isActive();

    /** Returns the current nesting level, 0 when no transaction is active. */
    int level();

    /**
     * Runs {@code callback} in a transaction: commits on normal return, rolls back
     * on any exception and rethrows the original exception.
     *
     * @return whatever the callback returned
     */
    default <T> T run(TransactionCallback<T> callback) {
        begin();
        T result;
        try {
            result = callback.doInTransaction(this);
        } catch (RuntimeException | Error e) {
            try {
                rollback();
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        commit();
        return result;
    }

    /**
     * Convenience overload for work without a result.
     */
    default void run(Runnable work) {
        run(tx -> {
            work.run();
            return null;
        });
    }
}
