package schemamigrator.port.memory;

import schemamigrator.exceptions.QueryException;
import schemamigrator.port.QueryBuilder;
import schemamigrator.port.SchemaManager;
import schemamigrator.port.SchemaPort;
import schemamigrator.port.TransactionManager;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link SchemaPort} that keeps every table in memory.
 *
 * <p>Meant for tests and demos. It behaves like a small relational store:
 * <ul>
 *   <li>unique and primary keys are enforced, violations raise
 *       {@link QueryException#duplicateKey(String, String)}</li>
 *   <li>auto-increment columns and {@code DEFAULT CURRENT_TIMESTAMP} are honoured</li>
 *   <li>unknown tables raise {@link QueryException#tableNotFound(String)}</li>
 *   <li>transactions snapshot the whole store; DDL is transactional too</li>
 * </ul>
 *
 * <p>Instances are not thread-safe.
 */
public final class InMemorySchemaPort implements SchemaPort {

    private final String tablePrefix;
    private final Clock clock;

    private Map<String, InMemoryTable> tables = new LinkedHashMap<>();
    private final Deque<Map<String, InMemoryTable>> snapshots = new ArrayDeque<>();

    private final InMemoryTransactionManager transactionManager = new InMemoryTransactionManager(this);
    private final InMemorySchemaManager schemaManager = new InMemorySchemaManager(this);

    public InMemorySchemaPort() {
        this("", Clock.systemUTC());
    }

    /**
     * @param tablePrefix prefix added to every logical table name, may be empty
     * @param clock source for {@code DEFAULT CURRENT_TIMESTAMP} values
     */
    public InMemorySchemaPort(String tablePrefix, Clock clock) {
        this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public QueryBuilder query() {
        return new InMemoryQueryBuilder(this);
    }

    @Override
    public TransactionManager transaction() {
        return transactionManager;
    }

    @Override
    public SchemaManager schema() {
        return schemaManager;
    }

    @Override
    public String tableName(String table) {
        return tablePrefix + table;
    }

    /**
     * Physical names of all tables currently present.
     */
    public Set<String> tableNames() {
        return Set.copyOf(tables.keySet());
    }

    /**
     * Copy of the rows of a table, for assertions.
     *
     * @param table logical table name
     */
    public List<Map<String, Object>> rows(String table) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, Object> row : requireTable(tableName(table)).rows()) {
            copy.add(new LinkedHashMap<>(row));
        }
        return copy;
    }

    // ---------------- package internals ----------------

    Clock clock() {
        return clock;
    }

    Map<String, InMemoryTable> tables() {
        return tables;
    }

    InMemoryTable requireTable(String physicalName) {
        InMemoryTable table = tables.get(physicalName);
        if (table == null) {
            throw QueryException.tableNotFound(physicalName);
        }
        return table;
    }

    void pushSnapshot() {
        Map<String, InMemoryTable> copy = new LinkedHashMap<>();
        for (var entry : tables.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().copy());
        }
        snapshots.push(copy);
    }

    void discardSnapshot() {
        snapshots.pop();
    }

    void restoreSnapshot() {
        tables = snapshots.pop();
    }

    int snapshotDepth() {
        return snapshots.size();
    }
}
