package blog.migrations;

import schemamigrator.AbstractMigration;
import schemamigrator.port.SchemaPort;

public class V2024_01_12_140000__CreatePostsTable extends AbstractMigration {

    public V2024_01_12_140000__CreatePostsTable() {
        super("2024_01_12_140000_create_posts_table");
    }

    @Override
    public void up(SchemaPort port) {
        port.schema().createTable("posts",
                "id INT UNSIGNED AUTO_INCREMENT PRIMARY KEY, "
                        + "user_id INT UNSIGNED NOT NULL, "
                        + "title VARCHAR(200) NOT NULL, "
                        + "body TEXT, "
                        + "published_at TIMESTAMP NULL, "
                        + "FOREIGN KEY (user_id) REFERENCES users (id)");
    }

    @Override
    public void down(SchemaPort port) {
        port.schema().dropTableIfExists("posts");
    }
}
