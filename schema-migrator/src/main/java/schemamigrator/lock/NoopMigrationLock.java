package schemamigrator.lock;

/**
 * Default lock used when the caller does not configure one. Single process only.
 */
public enum NoopMigrationLock implements MigrationLock {
    INSTANCE;

    private static final Handle HANDLE = () -> { /* no-op */ };

    @Override
    public Handle acquire() {
        return HANDLE;
    }
}
