package schemamigrator.port;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal fluent query surface used for bookkeeping reads and writes.
 *
 * <p>Rows are returned as column-name to value maps in column order. No joins.
 *
 * <pre>
 * List&lt;Map&lt;String, Object&gt;&gt; rows = port.query()
 *     .from("migrations")
 *     .where("batch", "&gt;=", 3)
 *     .orderBy("batch", Direction.DESC)
 *     .orderBy("id", Direction.DESC)
 *     .get();
 * </pre>
 */
public interface QueryBuilder {

    /** Sort direction for {@link #orderBy(String, Direction)}. */
    enum Direction { ASC, DESC }

    QueryBuilder from(String table);

    /** Alias of {@link #from(String)}, reads better for writes. */
    default QueryBuilder table(String table) {
        return from(table);
    }

    /**
     * Adds a condition; conditions are combined with AND.
     *
     * @param operator one of {@code = != <> < <= > >=}
     */
    QueryBuilder where(String column, String operator, Object value);

    QueryBuilder orderBy(String column, Direction direction);

    List<Map<String, Object>> get();

    Optional<Map<String, Object>> first();

    List<Object> pluck(String column);

    /**
     * Returns the largest value of {@code column}, or null when no row matches.
     */
    Object max(String column);

    long count();

    /**
     * Inserts one row.
     *
     * @return the generated key, or 0 if the table has none
     */
    long insert(Map<String, ?> row);

    /**
     * Deletes every matching row.
     *
     * @return the number of rows deleted
     */
    int delete();
}
