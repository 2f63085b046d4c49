package schemamigrator.port;

/**
 * DDL surface of a {@link SchemaPort}.
 *
 * <p>Column definitions are passed through as SQL fragments, for example
 * {@code "id INT UNSIGNED AUTO_INCREMENT PRIMARY KEY, title VARCHAR(255) NOT NULL"}.
 * Failures are reported as {@link schemamigrator.exceptions.SchemaException}.
 */
public interface SchemaManager {

    /**
     * Creates a table.
     *
     * @param table logical table name
     * @param columnDefinitions comma separated column and key definitions
     */
    void createTable(String table, String columnDefinitions);

    void dropTable(String table);

    void dropTableIfExists(String table);

    boolean tableExists(String table);

    /**
     * Adds one column.
     *
     * @param definition type and modifiers without the column name, e.g. {@code "VARCHAR(64) NULL"}
     */
    void addColumn(String table, String column, String definition);

    void dropColumn(String table, String column);

    boolean hasColumn(String table, String column);
}
