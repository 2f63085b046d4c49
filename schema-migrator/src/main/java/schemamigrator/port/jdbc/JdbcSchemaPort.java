package schemamigrator.port.jdbc;

import schemamigrator.port.QueryBuilder;
import schemamigrator.port.SchemaManager;
import schemamigrator.port.SchemaPort;
import schemamigrator.port.TransactionManager;

import java.sql.Connection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link SchemaPort} over a single JDBC {@link Connection}.
 *
 * <p>The caller owns the connection and closes it. Identifiers are not quoted;
 * table and column names must be plain identifiers and are rejected otherwise.
 * Column definitions are passed to the database verbatim.
 */
public final class JdbcSchemaPort implements SchemaPort {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Connection connection;
    private final String tablePrefix;
    private final JdbcTransactionManager transactionManager;
    private final JdbcSchemaManager schemaManager;

    public JdbcSchemaPort(Connection connection) {
        this(connection, "");
    }

    public JdbcSchemaPort(Connection connection, String tablePrefix) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
        this.transactionManager = new JdbcTransactionManager(connection);
        this.schemaManager = new JdbcSchemaManager(this);
    }

    @Override
    public QueryBuilder query() {
        return new JdbcQueryBuilder(this);
    }

    @Override
    public TransactionManager transaction() {
        return transactionManager;
    }

    @Override
    public SchemaManager schema() {
        return schemaManager;
    }

    @Override
    public String tableName(String table) {
        return identifier(tablePrefix + table);
    }

    Connection connection() {
        return connection;
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        return name;
    }
}
