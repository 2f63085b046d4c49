package schemamigrator.runner;

import java.time.Instant;

/**
 * Status of one registered migration as reported by {@link MigrationRunner#status()}.
 *
 * @param name migration name
 * @param batch batch it was applied in, null while pending
 * @param ran true if a bookkeeping row exists
 * @param ranAt when it was applied, null while pending
 */
public record MigrationStatus(String name, Integer batch, boolean ran, Instant ranAt) {

    static MigrationStatus pending(String name) {
        return new MigrationStatus(name, null, false, null);
    }

    static MigrationStatus applied(MigrationRecord record) {
        return new MigrationStatus(record.migration(), record.batch(), true, record.createdAt());
    }
}
