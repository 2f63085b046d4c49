package schemamigrator.port.jdbc;

import schemamigrator.exceptions.SchemaException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JdbcSchemaManager")
class JdbcSchemaManagerTest {

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private DatabaseMetaData metaData;

    private JdbcSchemaPort port;

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.getMetaData()).thenReturn(metaData);
        when(connection.getCatalog()).thenReturn("app");
        port = new JdbcSchemaPort(connection, "blog_");
    }

    private static ResultSet rows(boolean... next) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        if (next.length == 0) {
            when(rs.next()).thenReturn(false);
        } else {
            Boolean[] rest = new Boolean[next.length];
            for (int i = 1; i < next.length; i++) rest[i - 1] = next[i];
            rest[next.length - 1] = false;
            when(rs.next()).thenReturn(next[0], rest);
        }
        return rs;
    }

    @Test
    @DisplayName("should issue DDL against the prefixed table")
    void shouldIssueDdl() throws SQLException {
        port.schema().createTable("posts", "id INT PRIMARY KEY");
        port.schema().addColumn("posts", "slug", "VARCHAR(200) NOT NULL");
        port.schema().dropColumn("posts", "slug");
        port.schema().dropTableIfExists("posts");
        port.schema().dropTable("posts");

        verify(statement).execute("CREATE TABLE blog_posts (id INT PRIMARY KEY)");
        verify(statement).execute("ALTER TABLE blog_posts ADD COLUMN slug VARCHAR(200) NOT NULL");
        verify(statement).execute("ALTER TABLE blog_posts DROP COLUMN slug");
        verify(statement).execute("DROP TABLE IF EXISTS blog_posts");
        verify(statement).execute("DROP TABLE blog_posts");
    }

    @Test
    @DisplayName("should wrap DDL failures")
    void shouldWrapFailures() throws SQLException {
        when(statement.execute(anyString())).thenThrow(new SQLException("Table 'blog_posts' already exists", "42S01", 1050));

        assertThatThrownBy(() -> port.schema().createTable("posts", "id INT"))
                .isInstanceOfSatisfying(SchemaException.class, e -> {
                    assertThat(e.getTable()).isEqualTo("blog_posts");
                    assertThat(e).hasCauseInstanceOf(SQLException.class);
                });
        assertThatThrownBy(() -> port.schema().addColumn("posts", "slug", "TEXT"))
                .isInstanceOfSatisfying(SchemaException.class, e -> assertThat(e.getColumn()).isEqualTo("slug"));
        assertThatThrownBy(() -> port.schema().dropTable("posts"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("blog_posts");
    }

    @Test
    @DisplayName("should find tables under any identifier case")
    void shouldFindTablesCaseInsensitively() throws SQLException {
        ResultSet none = rows();
        ResultSet found = rows(true);
        when(metaData.getTables(eq("app"), isNull(), eq("blog_posts"), any())).thenReturn(none);
        when(metaData.getTables(eq("app"), isNull(), eq("BLOG_POSTS"), any())).thenReturn(found);

        assertThat(port.schema().tableExists("posts")).isTrue();
    }

    @Test
    @DisplayName("should report missing tables")
    void shouldReportMissingTable() throws SQLException {
        ResultSet none = rows();
        when(metaData.getTables(any(), any(), anyString(), any())).thenReturn(none);

        assertThat(port.schema().tableExists("posts")).isFalse();
    }

    @Test
    @DisplayName("should look up columns through metadata")
    void shouldFindColumns() throws SQLException {
        ResultSet columns = rows(true, true);
        when(columns.getString("COLUMN_NAME")).thenReturn("ID", "SLUG");
        when(metaData.getColumns(eq("app"), isNull(), eq("blog_posts"), isNull())).thenReturn(columns);

        assertThat(port.schema().hasColumn("posts", "slug")).isTrue();
    }

    @Test
    @DisplayName("should reject identifiers that are not plain names")
    void shouldRejectBadIdentifiers() {
        assertThatThrownBy(() -> port.schema().addColumn("posts", "slug; --", "TEXT"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid identifier: slug; --");
    }
}
