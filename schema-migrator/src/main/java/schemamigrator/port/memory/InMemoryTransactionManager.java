package schemamigrator.port.memory;

import schemamigrator.exceptions.TransactionException;
import schemamigrator.port.TransactionManager;

/**
 * Snapshot based transactions: {@link #begin()} copies the store,
 * {@link #rollback()} puts the copy back, {@link #commit()} throws it away.
 * Nesting works the same way at every level.
 */
final class InMemoryTransactionManager implements TransactionManager {

    private final InMemorySchemaPort port;

    InMemoryTransactionManager(InMemorySchemaPort port) {
        this.port = port;
    }

    @Override
    public void begin() {
        port.pushSnapshot();
    }

    @Override
    public void commit() {
        if (port.snapshotDepth() == 0) {
            throw TransactionException.noActiveTransaction("commit");
        }
        port.discardSnapshot();
    }

    @Override
    public void rollback() {
        if (port.snapshotDepth() == 0) {
            throw TransactionException.noActiveTransaction("rollback");
        }
        port.restoreSnapshot();
    }

    @Override
    public boolean isActive() {
        return port.snapshotDepth() > 0;
    }

    @Override
    public int level() {
        return port.snapshotDepth();
    }
}
