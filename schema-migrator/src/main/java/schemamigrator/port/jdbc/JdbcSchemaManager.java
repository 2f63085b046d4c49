package schemamigrator.port.jdbc;

import schemamigrator.exceptions.SchemaException;
import schemamigrator.port.SchemaManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * DDL through plain statements; existence checks through {@link DatabaseMetaData}.
 */
final class JdbcSchemaManager implements SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaManager.class);

    private final JdbcSchemaPort port;

    JdbcSchemaManager(JdbcSchemaPort port) {
        this.port = port;
    }

    @Override
    public void createTable(String table, String columnDefinitions) {
        String name = port.tableName(table);
        try {
            execute("CREATE TABLE " + name + " (" + columnDefinitions + ")");
        } catch (SQLException e) {
            throw SchemaException.tableCreationFailed(name, e.getMessage(), e);
        }
        log.debug("Created table {}", name);
    }

    @Override
    public void dropTable(String table) {
        String name = port.tableName(table);
        try {
            execute("DROP TABLE " + name);
        } catch (SQLException e) {
            throw SchemaException.fromSqlException(name, e);
        }
    }

    @Override
    public void dropTableIfExists(String table) {
        String name = port.tableName(table);
        try {
            execute("DROP TABLE IF EXISTS " + name);
        } catch (SQLException e) {
            throw SchemaException.fromSqlException(name, e);
        }
    }

    @Override
    public boolean tableExists(String table) {
        String name = port.tableName(table);
        try {
            DatabaseMetaData meta = port.connection().getMetaData();
            for (String candidate : caseVariants(name)) {
                try (ResultSet rs = meta.getTables(port.connection().getCatalog(), null, candidate,
                        new String[] {"TABLE"})) {
                    if (rs.next()) return true;
                }
            }
            return false;
        } catch (SQLException e) {
            throw SchemaException.fromSqlException(name, e);
        }
    }

    @Override
    public void addColumn(String table, String column, String definition) {
        String name = port.tableName(table);
        String col = JdbcSchemaPort.identifier(column);
        try {
            execute("ALTER TABLE " + name + " ADD COLUMN " + col + " " + definition);
        } catch (SQLException e) {
            throw SchemaException.columnAddFailed(name, col, e.getMessage(), e);
        }
    }

    @Override
    public void dropColumn(String table, String column) {
        String name = port.tableName(table);
        try {
            execute("ALTER TABLE " + name + " DROP COLUMN " + JdbcSchemaPort.identifier(column));
        } catch (SQLException e) {
            throw SchemaException.fromSqlException(name, e);
        }
    }

    @Override
    public boolean hasColumn(String table, String column) {
        String name = port.tableName(table);
        String col = JdbcSchemaPort.identifier(column);
        try {
            DatabaseMetaData meta = port.connection().getMetaData();
            for (String candidate : caseVariants(name)) {
                try (ResultSet rs = meta.getColumns(port.connection().getCatalog(), null, candidate, null)) {
                    while (rs.next()) {
                        if (col.equalsIgnoreCase(rs.getString("COLUMN_NAME"))) return true;
                    }
                }
            }
            return false;
        } catch (SQLException e) {
            throw SchemaException.fromSqlException(name, e);
        }
    }

    private void execute(String sql) throws SQLException {
        log.debug("{}", sql);
        try (Statement st = port.connection().createStatement()) {
            st.execute(sql);
        }
    }

    /** Drivers fold unquoted identifiers differently; try as given, upper, lower. */
    private static String[] caseVariants(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        String lower = name.toLowerCase(Locale.ROOT);
        if (upper.equals(name) && lower.equals(name)) return new String[] {name};
        return new String[] {name, upper, lower};
    }
}
