package schemamigrator.lock;

import schemamigrator.exceptions.MigrationException;

/**
 * Mutual exclusion around state-changing runner operations.
 *
 * <p>The runner acquires the lock once per public operation and releases it on
 * every exit path through try-with-resources:
 * <pre>
 * try (MigrationLock.Handle ignored = lock.acquire()) {
 *     ...
 * }
 * </pre>
 *
 * @see NoopMigrationLock
 * @see TableMigrationLock
 */
public interface MigrationLock {

    /**
     * Blocks until the lock is held.
     *
     * @return a handle whose {@link Handle#close()} releases the lock
     * @throws MigrationException if the lock cannot be obtained
     */
    Handle acquire() throws MigrationException;

    /**
     * A held lock. Closing releases it.
     */
    interface Handle extends AutoCloseable {
        @Override
        void close();
    }
}
