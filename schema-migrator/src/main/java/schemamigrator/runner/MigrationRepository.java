package schemamigrator.runner;

import schemamigrator.port.QueryBuilder.Direction;
import schemamigrator.port.SchemaPort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the bookkeeping table through the port.
 *
 * <p>Read methods treat a missing table as an empty history; only
 * {@link #createIfMissing()} creates it.
 */
final class MigrationRepository {

    private static final Logger log = LoggerFactory.getLogger(MigrationRepository.class);

    static final String TABLE = "migrations";

    static final String COLUMNS =
            "id INT UNSIGNED AUTO_INCREMENT PRIMARY KEY, "
                    + "migration VARCHAR(255) NOT NULL, "
                    + "batch INT UNSIGNED NOT NULL, "
                    + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                    + "UNIQUE KEY uk_migration (migration)";

    private final SchemaPort port;

    MigrationRepository(SchemaPort port) {
        this.port = port;
    }

    boolean exists() {
        return port.schema().tableExists(TABLE);
    }

    void createIfMissing() {
        if (exists()) return;
        port.schema().createTable(TABLE, COLUMNS);
        log.info("Created bookkeeping table {}", port.tableName(TABLE));
    }

    List<String> completedNames() {
        if (!exists()) return List.of();
        List<String> names = new ArrayList<>();
        for (Object value : port.query().from(TABLE).orderBy("id", Direction.ASC).pluck("migration")) {
            names.add((String) value);
        }
        return names;
    }

    Map<String, MigrationRecord> completedByName() {
        Map<String, MigrationRecord> result = new LinkedHashMap<>();
        if (!exists()) return result;
        for (Map<String, Object> row : port.query().from(TABLE).orderBy("id", Direction.ASC).get()) {
            MigrationRecord record = MigrationRecord.fromRow(row);
            result.put(record.migration(), record);
        }
        return result;
    }

    Optional<MigrationRecord> find(String name) {
        if (!exists()) return Optional.empty();
        return port.query().from(TABLE).where("migration", "=", name).first().map(MigrationRecord::fromRow);
    }

    /** Every row, most recently applied first: batch DESC, id DESC. */
    List<MigrationRecord> newestFirst() {
        if (!exists()) return List.of();
        return toRecords(newestFirstQuery().get());
    }

    /**
     * Rows of the {@code steps} most recent batches, most recently applied first.
     */
    List<MigrationRecord> lastBatches(int steps) {
        int maxBatch = maxBatch();
        if (maxBatch == 0) return List.of();
        int minBatch = Math.max(1, maxBatch - steps + 1);
        return toRecords(port.query().from(TABLE)
                .where("batch", ">=", minBatch)
                .orderBy("batch", Direction.DESC)
                .orderBy("id", Direction.DESC)
                .get());
    }

    Optional<MigrationRecord> latest() {
        if (!exists()) return Optional.empty();
        return newestFirstQuery().first().map(MigrationRecord::fromRow);
    }

    int maxBatch() {
        if (!exists()) return 0;
        Object max = port.query().from(TABLE).max("batch");
        return max == null ? 0 : ((Number) max).intValue();
    }

    int nextBatchNumber() {
        return maxBatch() + 1;
    }

    void log(String name, int batch) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("migration", name);
        row.put("batch", batch);
        port.query().table(TABLE).insert(row);
    }

    int delete(String name) {
        return port.query().table(TABLE).where("migration", "=", name).delete();
    }

    private schemamigrator.port.QueryBuilder newestFirstQuery() {
        return port.query().from(TABLE)
                .orderBy("batch", Direction.DESC)
                .orderBy("id", Direction.DESC);
    }

    private static List<MigrationRecord> toRecords(List<Map<String, Object>> rows) {
        List<MigrationRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(MigrationRecord.fromRow(row));
        }
        return records;
    }
}
