package schemamigrator.lock;

import schemamigrator.exceptions.MigrationException;
import schemamigrator.exceptions.QueryException;
import schemamigrator.port.QueryBuilder;
import schemamigrator.port.SchemaManager;
import schemamigrator.port.SchemaPort;
import schemamigrator.port.memory.InMemorySchemaPort;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TableMigrationLock")
class TableMigrationLockTest {

    private static final Duration POLL = Duration.ofMillis(5);

    private InMemorySchemaPort port;

    @Mock
    private SchemaPort brokenPort;

    @Mock
    private SchemaManager brokenSchema;

    @Mock
    private QueryBuilder brokenQuery;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        port = new InMemorySchemaPort();
    }

    @Test
    @DisplayName("should create the lock table and hold the row until closed")
    void shouldHoldRowUntilClosed() throws MigrationException {
        TableMigrationLock lock = new TableMigrationLock(port, Duration.ZERO, POLL, "runner-a");

        try (MigrationLock.Handle ignored = lock.acquire()) {
            assertThat(port.rows(TableMigrationLock.LOCK_TABLE))
                    .singleElement()
                    .satisfies(row -> assertThat(row).containsEntry("owner", "runner-a"));
        }

        assertThat(port.rows(TableMigrationLock.LOCK_TABLE)).isEmpty();
    }

    @Test
    @DisplayName("should time out while another owner holds the lock")
    void shouldTimeOutWhenHeld() throws MigrationException {
        TableMigrationLock first = new TableMigrationLock(port, Duration.ZERO, POLL, "runner-a");
        TableMigrationLock second = new TableMigrationLock(port, Duration.ofMillis(20), POLL, "runner-b");

        try (MigrationLock.Handle ignored = first.acquire()) {
            assertThatThrownBy(second::acquire)
                    .isInstanceOf(MigrationException.class)
                    .hasMessage("Timed out after 20 ms waiting for the migration lock");
        }

        try (MigrationLock.Handle ignored = second.acquire()) {
            assertThat(port.rows(TableMigrationLock.LOCK_TABLE).get(0)).containsEntry("owner", "runner-b");
        }
    }

    @Test
    @DisplayName("should only release its own row")
    void shouldOnlyReleaseOwnRow() throws MigrationException {
        TableMigrationLock lock = new TableMigrationLock(port, Duration.ZERO, POLL, "runner-a");
        MigrationLock.Handle handle = lock.acquire();
        port.query().table(TableMigrationLock.LOCK_TABLE).delete();
        port.query().table(TableMigrationLock.LOCK_TABLE).insert(Map.of("id", 1L, "owner", "runner-b"));

        handle.close();

        assertThat(port.rows(TableMigrationLock.LOCK_TABLE)).hasSize(1);
    }

    @Test
    @DisplayName("should fail fast on errors other than a taken lock")
    void shouldFailOnOtherQueryErrors() {
        QueryException cause = QueryException.tableNotFound(TableMigrationLock.LOCK_TABLE);
        when(brokenPort.schema()).thenReturn(brokenSchema);
        when(brokenSchema.tableExists(anyString())).thenReturn(true);
        when(brokenPort.query()).thenReturn(brokenQuery);
        when(brokenQuery.table(anyString())).thenReturn(brokenQuery);
        when(brokenQuery.insert(anyMap())).thenThrow(cause);

        TableMigrationLock lock = new TableMigrationLock(brokenPort, Duration.ofSeconds(10), POLL, "runner-a");

        assertThatThrownBy(lock::acquire)
                .isInstanceOf(MigrationException.class)
                .hasMessageStartingWith("Failed to acquire migration lock")
                .hasCause(cause);
    }

    @Test
    @DisplayName("should keep waiting on integrity violations with foreign vendor codes")
    void shouldWaitOnVendorSpecificDuplicate() throws MigrationException {
        when(brokenPort.schema()).thenReturn(brokenSchema);
        when(brokenSchema.tableExists(anyString())).thenReturn(true);
        when(brokenPort.query()).thenReturn(brokenQuery);
        when(brokenQuery.table(anyString())).thenReturn(brokenQuery);
        when(brokenQuery.where(anyString(), anyString(), any())).thenReturn(brokenQuery);
        when(brokenQuery.insert(anyMap()))
                .thenThrow(new QueryException("Violation of PRIMARY KEY constraint", "INSERT", null, "23000", 2627))
                .thenReturn(0L);

        TableMigrationLock lock = new TableMigrationLock(brokenPort, Duration.ofSeconds(10), POLL, "runner-a");

        try (MigrationLock.Handle ignored = lock.acquire()) {
            verify(brokenQuery, times(2)).insert(anyMap());
        }
    }

    @Test
    @DisplayName("should generate an owner when none is given")
    void shouldGenerateOwner() {
        assertThat(new TableMigrationLock(port, Duration.ZERO).owner()).isNotBlank();
    }

    @Test
    @DisplayName("noop lock should hand out a reusable handle")
    void noopLockShouldBeReusable() {
        MigrationLock.Handle a = NoopMigrationLock.INSTANCE.acquire();
        a.close();

        assertThat(NoopMigrationLock.INSTANCE.acquire()).isSameAs(a);
    }
}
