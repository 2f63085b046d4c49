package schemamigrator.port;

/**
 * Work executed inside {@link TransactionManager#run(TransactionCallback)}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(TransactionManager tx);
}
