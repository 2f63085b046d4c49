package schemamigrator;

import schemamigrator.port.SchemaPort;

/**
 * A single named, versioned, reversible schema change.
 *
 * <p>The {@link #name()} is the join key between code and the bookkeeping table:
 * once a migration has run, renaming it makes the runner treat it as new.
 *
 * <p>{@link #up(SchemaPort)} and {@link #down(SchemaPort)} must be inverses with
 * respect to schema shape: after {@code down}, running {@code up} again has to
 * succeed. Both run inside a transaction opened by the runner, together with the
 * bookkeeping write.
 *
 * <h2>Example:</h2>
 * <pre>
 * public class V2024_01_15_093000__CreatePostsTable extends AbstractMigration {
 *
 *     public V2024_01_15_093000__CreatePostsTable() {
 *         super("2024_01_15_093000_create_posts_table");
 *     }
 *
 *     {@literal @}Override
 *     public void up(SchemaPort port) {
 *         port.schema().createTable("posts", "id INT UNSIGNED AUTO_INCREMENT PRIMARY KEY");
 *     }
 *
 *     {@literal @}Override
 *     public void down(SchemaPort port) {
 *         port.schema().dropTable("posts");
 *     }
 * }
 * </pre>
 *
 * @see AbstractMigration
 * @see schemamigrator.runner.MigrationRunner
 */
public interface Migration {

    /**
     * Stable, globally unique name, conventionally {@code <timestamp>_<description>}.
     */
    String name();

    /**
     * Sortable version token. The runner applies migrations in ascending version order.
     */
    String version();

    /**
     * Human readable summary shown by previews and front ends.
     */
    default String description() {
        return name();
    }

    /**
     * Applies the change.
     *
     * @param port the port to change the schema through
     */
    void up(SchemaPort port);

    /**
     * Reverts the change made by {@link #up(SchemaPort)}.
     *
     * @param port the port to change the schema through
     */
    void down(SchemaPort port);
}
