package blog.migrations;

import schemamigrator.AbstractMigration;
import schemamigrator.port.SchemaPort;

public class V2024_01_10_090000__CreateUsersTable extends AbstractMigration {

    public V2024_01_10_090000__CreateUsersTable() {
        super("2024_01_10_090000_create_users_table");
    }

    @Override
    public void up(SchemaPort port) {
        port.schema().createTable("users",
                "id INT UNSIGNED AUTO_INCREMENT PRIMARY KEY, "
                        + "email VARCHAR(255) NOT NULL, "
                        + "display_name VARCHAR(100) NOT NULL, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                        + "UNIQUE KEY uk_users_email (email)");
    }

    @Override
    public void down(SchemaPort port) {
        port.schema().dropTableIfExists("users");
    }
}
