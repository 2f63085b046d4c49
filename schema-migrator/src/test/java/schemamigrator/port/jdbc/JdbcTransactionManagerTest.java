package schemamigrator.port.jdbc;

import schemamigrator.exceptions.TransactionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JdbcTransactionManager")
class JdbcTransactionManagerTest {

    @Mock
    private Connection connection;

    @Mock
    private Savepoint savepoint;

    private JdbcTransactionManager tx;

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.setSavepoint("sp_1")).thenReturn(savepoint);
        tx = new JdbcTransactionManager(connection);
    }

    @Nested
    @DisplayName("outer level")
    class OuterLevel {

        @Test
        @DisplayName("should switch auto-commit off and restore it on commit")
        void shouldToggleAutoCommit() throws SQLException {
            tx.begin();
            assertThat(tx.isActive()).isTrue();
            tx.commit();

            InOrder order = inOrder(connection);
            order.verify(connection).setAutoCommit(false);
            order.verify(connection).commit();
            order.verify(connection).setAutoCommit(true);
            assertThat(tx.level()).isZero();
        }

        @Test
        @DisplayName("should roll back and restore auto-commit")
        void shouldRollBack() throws SQLException {
            tx.begin();
            tx.rollback();

            verify(connection).rollback();
            verify(connection).setAutoCommit(true);
            assertThat(tx.isActive()).isFalse();
        }

        @Test
        @DisplayName("should abandon the transaction when commit fails")
        void shouldAbandonFailedCommit() throws SQLException {
            doThrow(new SQLException("connection reset", "08S01")).when(connection).commit();

            tx.begin();
            assertThatThrownBy(() -> tx.commit())
                    .isInstanceOfSatisfying(TransactionException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransactionException.Kind.COMMIT_FAILED));

            verify(connection).rollback();
            assertThat(tx.level()).isZero();
        }

        @Test
        @DisplayName("should translate deadlocks on commit")
        void shouldTranslateDeadlock() throws SQLException {
            doThrow(new SQLException("Deadlock found", "40001", 1213)).when(connection).commit();

            tx.begin();
            assertThatThrownBy(() -> tx.commit())
                    .isInstanceOfSatisfying(TransactionException.class, e -> {
                        assertThat(e.isDeadlock()).isTrue();
                        assertThat(e.isRetryable()).isTrue();
                    });
        }

        @Test
        @DisplayName("should translate lock wait timeouts on begin")
        void shouldTranslateLockTimeout() throws SQLException {
            doThrow(new SQLException("Lock wait timeout exceeded", "HY000", 1205))
                    .when(connection).setAutoCommit(false);

            assertThatThrownBy(() -> tx.begin())
                    .isInstanceOfSatisfying(TransactionException.class, e -> assertThat(e.isLockTimeout()).isTrue());
            assertThat(tx.isActive()).isFalse();
        }

        @Test
        @DisplayName("should refuse commit and rollback without a transaction")
        void shouldRefuseWithoutTransaction() throws SQLException {
            assertThatThrownBy(() -> tx.commit())
                    .hasMessage("Cannot commit: no active transaction");
            assertThatThrownBy(() -> tx.rollback())
                    .hasMessage("Cannot rollback: no active transaction");
            verify(connection, never()).commit();
        }
    }

    @Nested
    @DisplayName("nested levels")
    class NestedLevels {

        @Test
        @DisplayName("should use a savepoint and release it on commit")
        void shouldReleaseSavepoint() throws SQLException {
            tx.begin();
            tx.begin();
            assertThat(tx.level()).isEqualTo(2);
            tx.commit();
            tx.commit();

            verify(connection).releaseSavepoint(savepoint);
            verify(connection).commit();
        }

        @Test
        @DisplayName("should roll back to the savepoint only")
        void shouldRollBackToSavepoint() throws SQLException {
            tx.begin();
            tx.begin();
            tx.rollback();

            verify(connection).rollback(savepoint);
            verify(connection, never()).rollback();
            assertThat(tx.level()).isEqualTo(1);
        }

        @Test
        @DisplayName("should tolerate drivers that cannot release savepoints")
        void shouldTolerateMissingRelease() throws SQLException {
            doThrow(new SQLFeatureNotSupportedException()).when(connection).releaseSavepoint(savepoint);

            tx.begin();
            tx.begin();
            tx.commit();

            assertThat(tx.level()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report drivers without savepoints")
        void shouldReportMissingSavepoints() throws SQLException {
            when(connection.setSavepoint("sp_1")).thenThrow(new SQLFeatureNotSupportedException());

            tx.begin();
            assertThatThrownBy(() -> tx.begin())
                    .isInstanceOfSatisfying(TransactionException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransactionException.Kind.NESTED_UNSUPPORTED));
            assertThat(tx.level()).isEqualTo(1);
        }
    }
}
