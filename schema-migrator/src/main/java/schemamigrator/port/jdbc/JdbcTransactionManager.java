package schemamigrator.port.jdbc;

import schemamigrator.exceptions.QueryException;
import schemamigrator.exceptions.TransactionException;
import schemamigrator.port.TransactionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Transactions on one connection. The outermost level switches auto-commit
 * off; nested levels use savepoints named {@code sp_<level>}.
 */
final class JdbcTransactionManager implements TransactionManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionManager.class);

    private final Connection connection;
    private final Deque<Savepoint> savepoints = new ArrayDeque<>();
    private int level;
    private boolean restoreAutoCommit;

    JdbcTransactionManager(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void begin() {
        if (level == 0) {
            try {
                restoreAutoCommit = connection.getAutoCommit();
                connection.setAutoCommit(false);
            } catch (SQLException e) {
                throw translate(e, TransactionException.beginFailed(e.getMessage(), level, e));
            }
        } else {
            String name = "sp_" + level;
            try {
                savepoints.push(connection.setSavepoint(name));
            } catch (SQLFeatureNotSupportedException e) {
                throw TransactionException.nestedNotSupported();
            } catch (SQLException e) {
                throw TransactionException.savepointFailed(name, "create", e);
            }
        }
        level++;
        log.trace("Transaction begun, level={}", level);
    }

    @Override
    public void commit() {
        if (level == 0) {
            throw TransactionException.noActiveTransaction("commit");
        }
        if (level == 1) {
            try {
                connection.commit();
            } catch (SQLException e) {
                TransactionException failure = translate(e, TransactionException.commitFailed(e.getMessage(), level, e));
                abandon(failure);
                throw failure;
            }
            finish();
        } else {
            Savepoint savepoint = savepoints.pop();
            try {
                connection.releaseSavepoint(savepoint);
            } catch (SQLFeatureNotSupportedException e) {
                log.trace("Driver cannot release savepoints; leaving sp_{} to the outer commit", level - 1);
            } catch (SQLException e) {
                level--;
                throw TransactionException.savepointFailed("sp_" + level, "release", e);
            }
            level--;
        }
    }

    @Override
    public void rollback() {
        if (level == 0) {
            throw TransactionException.noActiveTransaction("rollback");
        }
        if (level == 1) {
            try {
                connection.rollback();
            } catch (SQLException e) {
                TransactionException failure = TransactionException.rollbackFailed(e.getMessage(), level, e);
                finishQuietly(failure);
                throw failure;
            }
            finish();
        } else {
            Savepoint savepoint = savepoints.pop();
            level--;
            try {
                connection.rollback(savepoint);
            } catch (SQLException e) {
                throw TransactionException.savepointFailed("sp_" + level, "rollback", e);
            }
        }
    }

    @Override
    public boolean isActive() {
        return level > 0;
    }

    @Override
    public int level() {
        return level;
    }

    /** Roll back after a failed outer commit so the connection is usable again. */
    private void abandon(TransactionException failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
        finishQuietly(failure);
    }

    private void finish() {
        level = 0;
        savepoints.clear();
        try {
            connection.setAutoCommit(restoreAutoCommit);
        } catch (SQLException e) {
            throw TransactionException.commitFailed("cannot restore auto-commit: " + e.getMessage(), 0, e);
        }
    }

    private void finishQuietly(TransactionException failure) {
        try {
            finish();
        } catch (TransactionException e) {
            failure.addSuppressed(e);
        }
    }

    private TransactionException translate(SQLException e, TransactionException fallback) {
        if ("40001".equals(e.getSQLState()) || e.getErrorCode() == QueryException.ER_LOCK_DEADLOCK) {
            return TransactionException.deadlockDetected(level, e);
        }
        if (e.getErrorCode() == QueryException.ER_LOCK_WAIT_TIMEOUT) {
            return TransactionException.lockTimeout(level, e);
        }
        return fallback;
    }
}
