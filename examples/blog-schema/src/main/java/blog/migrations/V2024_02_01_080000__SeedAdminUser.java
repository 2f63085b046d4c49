package blog.migrations;

import schemamigrator.AbstractMigration;
import schemamigrator.port.SchemaPort;

import java.util.Map;

public class V2024_02_01_080000__SeedAdminUser extends AbstractMigration {

    static final String ADMIN_EMAIL = "admin@example.org";

    public V2024_02_01_080000__SeedAdminUser() {
        super("2024_02_01_080000_seed_admin_user");
    }

    @Override
    public String description() {
        return "Seed the administrator account";
    }

    @Override
    public void up(SchemaPort port) {
        port.query().table("users").insert(Map.of(
                "email", ADMIN_EMAIL,
                "display_name", "Administrator"));
    }

    @Override
    public void down(SchemaPort port) {
        port.query().table("users").where("email", "=", ADMIN_EMAIL).delete();
    }
}
