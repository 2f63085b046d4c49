package blog.migrations;

import schemamigrator.AbstractMigration;
import schemamigrator.port.SchemaPort;

/**
 * Adds a URL slug. Existing posts get an empty slug.
 */
public class V2024_01_20_110000__AddSlugToPosts extends AbstractMigration {

    public V2024_01_20_110000__AddSlugToPosts() {
        super("2024_01_20_110000_add_slug_to_posts");
    }

    @Override
    public void up(SchemaPort port) {
        port.schema().addColumn("posts", "slug", "VARCHAR(200) NOT NULL DEFAULT ''");
    }

    @Override
    public void down(SchemaPort port) {
        port.schema().dropColumn("posts", "slug");
    }
}
