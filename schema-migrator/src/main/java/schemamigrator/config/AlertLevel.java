package schemamigrator.config;

/**
 * Alert level for migration logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link schemamigrator.alert.MigrationAlertLogger}. This can be configured
 * via the {@code migration.alert.level} property.
 *
 * <p>Log output at each level:
 * <ul>
 *   <li>{@link #DEBUG} - All events: run started, each migration applied or rolled back, run completed, warnings, errors</li>
 *   <li>{@link #WARNING} - Warnings (skipped migrations, lock waits) and errors only</li>
 *   <li>{@link #ERROR} - Errors only (migration failed, rollback failed)</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 * @see schemamigrator.alert.MigrationAlertLogger
 */
public enum AlertLevel {
    /**
     * Log all events including per-migration progress.
     */
    DEBUG,

    /**
     * Log warnings and errors only. This is the default level.
     */
    WARNING,

    /**
     * Log errors only.
     */
    ERROR
}
