package schemamigrator.port.jdbc;

import schemamigrator.exceptions.QueryException;
import schemamigrator.port.QueryBuilder.Direction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JdbcQueryBuilder")
class JdbcQueryBuilderTest {

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private ResultSetMetaData metaData;

    private JdbcSchemaPort port;

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(connection.prepareStatement(anyString(), eq(Statement.RETURN_GENERATED_KEYS))).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        port = new JdbcSchemaPort(connection, "app_");
    }

    @Test
    @DisplayName("should build an ordered, parameterised select")
    void shouldBuildSelect() throws SQLException {
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("MIGRATION");
        when(metaData.getColumnLabel(2)).thenReturn("BATCH");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn("2024_01_01_000000_a");
        when(resultSet.getObject(2)).thenReturn(3);

        var rows = port.query().from("migrations")
                .where("batch", ">=", 3)
                .where("migration", "!=", null)
                .orderBy("batch", Direction.DESC)
                .orderBy("id", Direction.DESC)
                .get();

        verify(connection).prepareStatement(
                "SELECT * FROM app_migrations WHERE batch >= ? AND migration IS NOT NULL ORDER BY batch DESC, id DESC");
        verify(statement).setObject(1, 3);
        assertThat(rows).singleElement()
                .isEqualTo(Map.of("migration", "2024_01_01_000000_a", "batch", 3));
    }

    @Test
    @DisplayName("should limit first() to one row")
    void shouldLimitFirst() throws SQLException {
        when(metaData.getColumnCount()).thenReturn(1);
        when(resultSet.next()).thenReturn(false);

        assertThat(port.query().from("migrations").where("migration", "=", null).first()).isEmpty();

        verify(connection).prepareStatement("SELECT * FROM app_migrations WHERE migration IS NULL");
        verify(statement).setMaxRows(1);
    }

    @Test
    @DisplayName("should aggregate with MAX and COUNT")
    void shouldAggregate() throws SQLException {
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("C");
        when(resultSet.next()).thenReturn(true, false, true, false);
        when(resultSet.getObject(1)).thenReturn(7, 12L);

        assertThat(port.query().from("migrations").max("batch")).isEqualTo(7);
        assertThat(port.query().from("migrations").count()).isEqualTo(12L);

        verify(connection).prepareStatement("SELECT MAX(batch) FROM app_migrations");
        verify(connection).prepareStatement("SELECT COUNT(*) FROM app_migrations");
    }

    @Test
    @DisplayName("should insert with bound values and return the generated key")
    void shouldInsert() throws SQLException {
        ResultSet keys = mock(ResultSet.class);
        when(statement.getGeneratedKeys()).thenReturn(keys);
        when(keys.next()).thenReturn(true);
        when(keys.getLong(1)).thenReturn(41L);
        Instant at = Instant.parse("2024-03-01T12:00:00Z");

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("migration", "2024_01_01_000000_a");
        row.put("created_at", at);
        long id = port.query().table("migrations").insert(row);

        assertThat(id).isEqualTo(41L);
        verify(connection).prepareStatement(
                "INSERT INTO app_migrations (migration, created_at) VALUES (?, ?)", Statement.RETURN_GENERATED_KEYS);
        verify(statement).setObject(1, "2024_01_01_000000_a");
        verify(statement).setObject(2, Timestamp.from(at));
    }

    @Test
    @DisplayName("should delete matching rows")
    void shouldDelete() throws SQLException {
        when(statement.executeUpdate()).thenReturn(2);

        assertThat(port.query().table("migrations").where("batch", "=", 4).delete()).isEqualTo(2);

        verify(connection).prepareStatement("DELETE FROM app_migrations WHERE batch = ?");
        verify(statement).setObject(1, 4);
    }

    @Test
    @DisplayName("should translate driver failures")
    void shouldTranslateFailures() throws SQLException {
        when(statement.executeUpdate()).thenThrow(
                new SQLException("Duplicate entry 'x' for key 'uk_migration'", "23000", 1062));

        assertThatThrownBy(() -> port.query().table("migrations").insert(Map.of("migration", "x")))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.isDuplicateKey()).isTrue();
                    assertThat(e.getSql()).startsWith("INSERT INTO app_migrations");
                });
    }

    @Test
    @DisplayName("should reject unsafe identifiers and operators")
    void shouldRejectUnsafeInput() {
        assertThatThrownBy(() -> port.query().from("migrations; DROP TABLE users"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> port.query().from("migrations").where("batch", "LIKE", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> port.query().get())
                .isInstanceOf(IllegalStateException.class);
    }
}
