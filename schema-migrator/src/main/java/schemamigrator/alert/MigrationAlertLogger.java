package schemamigrator.alert;

import schemamigrator.config.AlertLevel;
import schemamigrator.exceptions.MigrationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Structured logging for migration events.
 *
 * <p>Provides consistent log format suitable for log aggregators (ELK, Splunk, etc.).
 * Log entries use markers like RUN_STARTED, MIGRATION_APPLIED, MIGRATION_FAILED
 * with key=value pairs for easy parsing and alerting.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: run started/completed, each migration applied or rolled back</li>
 *   <li>WARN: registered-name mismatches skipped during reset, lock contention</li>
 *   <li>ERROR: migration or rollback failed</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED op=migrate pending=2 pretend=false
 * 12:00:00.040 INFO  migration - MIGRATION_APPLIED name=2024_01_15_093000_create_posts_table batch=3 duration_ms=40
 * 12:00:00.090 ERROR migration - MIGRATION_FAILED name=2024_01_16_100000_add_slug error="..." retryable=false
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    /**
     * Get the current alert level.
     *
     * @return the current alert level
     */
    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    /**
     * Log when a runner operation starts.
     *
     * @param operation migrate, rollback, reset, run or revert
     * @param pending number of migrations the operation will touch
     * @param pretend true for a dry run
     */
    public static void runStarted(String operation, int pending, boolean pretend) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED op={} pending={} pretend={}", operation, pending, pretend);
        }
    }

    /**
     * Log when a runner operation finishes without error.
     */
    public static void runCompleted(String operation, List<String> names, long durationMs, boolean pretend) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED op={} count={} duration_ms={} pretend={} names={}",
                    operation, names.size(), durationMs, pretend, names);
        }
    }

    public static void migrationApplied(String name, int batch, long durationMs) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_APPLIED name={} batch={} duration_ms={}", name, batch, durationMs);
        }
    }

    public static void migrationRolledBack(String name, int batch, long durationMs) {
        if (shouldLogInfo()) {
            log.info("ROLLBACK_APPLIED name={} batch={} duration_ms={}", name, batch, durationMs);
        }
    }

    /**
     * Log when a bookkeeping row has no registered migration and is left alone.
     */
    public static void migrationSkipped(String name, String reason) {
        if (shouldLogWarn()) {
            log.warn("MIGRATION_SKIPPED name={} reason=\"{}\"", name, reason);
        }
    }

    /**
     * Log when applying a migration fails. Always logged.
     */
    public static void migrationFailed(String name, MigrationException error) {
        log.error("MIGRATION_FAILED name={} error=\"{}\" retryable={}",
                name, error.getMessage(), error.isRetryable());
    }

    /**
     * Log when reverting a migration fails. Always logged.
     */
    public static void rollbackFailed(String name, MigrationException error) {
        log.error("ROLLBACK_FAILED name={} error=\"{}\" retryable={}",
                name, error.getMessage(), error.isRetryable());
    }

    public static void lockAcquired(String owner, long waitedMs) {
        if (shouldLogInfo()) {
            log.info("LOCK_ACQUIRED owner={} waited_ms={}", owner, waitedMs);
        } else if (waitedMs > 0 && shouldLogWarn()) {
            log.warn("LOCK_ACQUIRED owner={} waited_ms={}", owner, waitedMs);
        }
    }

    public static void lockReleased(String owner) {
        if (shouldLogInfo()) {
            log.info("LOCK_RELEASED owner={}", owner);
        }
    }
}
