package schemamigrator.exceptions;

import java.sql.SQLException;

/**
 * Exception thrown when a DDL operation fails.
 *
 * <p>Carries the affected table and, where relevant, the column or the
 * constraint/index name. Fields that do not apply are null.
 *
 * @see schemamigrator.port.SchemaManager
 */
public class SchemaException extends DatabaseException {

    private final String table;
    private final String column;
    private final String constraint;

    public SchemaException(String message, String table, String column, String constraint, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.column = column;
        this.constraint = constraint;
    }

    public SchemaException(String message, String table, String column, String constraint) {
        this(message, table, column, constraint, null);
    }

    // ---------------- named constructors ----------------

    public static SchemaException tableCreationFailed(String table, String reason) {
        return tableCreationFailed(table, reason, null);
    }

    public static SchemaException tableCreationFailed(String table, String reason, Throwable cause) {
        return new SchemaException(
                String.format("Failed to create table \"%s\": %s", table, reason), table, null, null, cause);
    }

    public static SchemaException tableAlreadyExists(String table) {
        return new SchemaException(String.format("Table \"%s\" already exists", table), table, null, null);
    }

    public static SchemaException tableNotFound(String table) {
        return new SchemaException(String.format("Table \"%s\" does not exist", table), table, null, null);
    }

    public static SchemaException columnAddFailed(String table, String column, String reason) {
        return columnAddFailed(table, column, reason, null);
    }

    public static SchemaException columnAddFailed(String table, String column, String reason, Throwable cause) {
        return new SchemaException(
                String.format("Failed to add column \"%s\" to table \"%s\": %s", column, table, reason),
                table, column, null, cause);
    }

    public static SchemaException columnAlreadyExists(String table, String column) {
        return new SchemaException(
                String.format("Column \"%s\" already exists in table \"%s\"", column, table), table, column, null);
    }

    public static SchemaException columnNotFound(String table, String column) {
        return new SchemaException(
                String.format("Column \"%s\" does not exist in table \"%s\"", column, table), table, column, null);
    }

    public static SchemaException indexCreationFailed(String table, String index, String reason) {
        return new SchemaException(
                String.format("Failed to create index \"%s\" on table \"%s\": %s", index, table, reason),
                table, null, index);
    }

    public static SchemaException foreignKeyFailed(String table, String constraint, String reason) {
        return new SchemaException(
                String.format("Failed to create foreign key \"%s\" on table \"%s\": %s", constraint, table, reason),
                table, null, constraint);
    }

    /**
     * Wraps a driver failure raised while changing the shape of {@code table}.
     */
    public static SchemaException fromSqlException(String table, SQLException e) {
        return new SchemaException(
                String.format("Schema change on table \"%s\" failed: %s", table, e.getMessage()),
                table, null, null, e);
    }

    // ---------------- getters ----------------

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public String getConstraint() {
        return constraint;
    }
}
