package schemamigrator.discovery.fixtures;

import schemamigrator.AbstractMigration;
import schemamigrator.port.SchemaPort;

/**
 * Classes the loader must pass over: abstract, non-public, and without a no-arg constructor.
 */
public final class SkippedMigrations {

    private SkippedMigrations() {}

    public abstract static class BaseWidgetMigration extends AbstractMigration {
        protected BaseWidgetMigration() {
            super("2024_05_03_100000_abstract_base");
        }
    }

    static class PackagePrivateMigration extends AbstractMigration {
        public PackagePrivateMigration() {
            super("2024_05_04_100000_package_private");
        }

        @Override public void up(SchemaPort port) {}
        @Override public void down(SchemaPort port) {}
    }

    public static class NeedsArgumentMigration extends AbstractMigration {
        public NeedsArgumentMigration(String suffix) {
            super("2024_05_05_100000_" + suffix);
        }

        @Override public void up(SchemaPort port) {}
        @Override public void down(SchemaPort port) {}
    }
}
