package schemamigrator.runner;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * One row of the bookkeeping table: a migration that has been applied.
 *
 * @param id auto-increment id, reflects insertion order
 * @param migration migration name
 * @param batch batch number shared by everything applied in one run
 * @param createdAt when the row was written, null if the store did not record it
 */
public record MigrationRecord(long id, String migration, int batch, Instant createdAt) {

    static MigrationRecord fromRow(Map<String, Object> row) {
        return new MigrationRecord(
                ((Number) row.get("id")).longValue(),
                (String) row.get("migration"),
                ((Number) row.get("batch")).intValue(),
                toInstant(row.get("created_at")));
    }

    private static Instant toInstant(Object value) {
        if (value == null) return null;
        if (value instanceof Instant) return (Instant) value;
        if (value instanceof Timestamp) return ((Timestamp) value).toInstant();
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toInstant();
        if (value instanceof LocalDateTime) return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        if (value instanceof java.util.Date) return ((java.util.Date) value).toInstant();
        throw new IllegalArgumentException("Unsupported created_at value: " + value.getClass().getName());
    }
}
