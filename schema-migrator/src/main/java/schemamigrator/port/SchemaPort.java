package schemamigrator.port;

/**
 * The narrow database surface the migration engine works through.
 *
 * <p>A port is constructed explicitly and handed to the
 * {@link schemamigrator.runner.MigrationRunner}; the engine never looks up a
 * connection on its own. Migrations receive the same port in
 * {@link schemamigrator.Migration#up(SchemaPort)} and
 * {@link schemamigrator.Migration#down(SchemaPort)}.
 *
 * <p>Implementations report failures with the exception kinds in
 * {@link schemamigrator.exceptions}.
 *
 * @see schemamigrator.port.memory.InMemorySchemaPort
 * @see schemamigrator.port.jdbc.JdbcSchemaPort
 */
public interface SchemaPort {

    /**
     * Starts a new query. Every call returns a fresh builder.
     */
    QueryBuilder query();

    /**
     * Returns the transaction manager bound to this port.
     */
    TransactionManager transaction();

    /**
     * Returns the schema manager bound to this port.
     */
    SchemaManager schema();

    /**
     * Maps a logical table name to the physical one (for example by adding a prefix).
     *
     * <p>Query and schema operations apply this mapping themselves; callers pass
     * logical names.
     *
     * @param table logical table name
     * @return physical table name
     */
    String tableName(String table);
}
