package schemamigrator.port.memory;

import schemamigrator.exceptions.QueryException;
import schemamigrator.exceptions.SchemaException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rows and shape of one in-memory table. Not thread-safe; the owning
 * {@link InMemorySchemaPort} serializes access.
 */
final class InMemoryTable {

    private final String name;
    private final Map<String, InMemoryColumn> columns;
    private final Map<String, List<String>> uniqueKeys;
    private final List<Map<String, Object>> rows;
    private long nextId;

    InMemoryTable(String name, ColumnDefinitionParser.Definition definition) {
        this.name = name;
        this.columns = new LinkedHashMap<>();
        for (InMemoryColumn c : definition.columns()) {
            columns.put(c.name(), c);
        }
        this.uniqueKeys = new LinkedHashMap<>(definition.uniqueKeys());
        this.rows = new ArrayList<>();
        this.nextId = 1;
    }

    private InMemoryTable(InMemoryTable other) {
        this.name = other.name;
        this.columns = new LinkedHashMap<>(other.columns);
        this.uniqueKeys = new LinkedHashMap<>(other.uniqueKeys);
        this.rows = new ArrayList<>(other.rows.size());
        for (Map<String, Object> row : other.rows) {
            rows.add(new LinkedHashMap<>(row));
        }
        this.nextId = other.nextId;
    }

    /** Deep copy used for transaction snapshots. */
    InMemoryTable copy() {
        return new InMemoryTable(this);
    }

    String name() {
        return name;
    }

    boolean hasColumn(String column) {
        return columns.containsKey(column);
    }

    void requireColumn(String column) {
        if (!columns.containsKey(column)) {
            throw QueryException.columnNotFound(column);
        }
    }

    /** Live row list; callers must not keep references across operations. */
    List<Map<String, Object>> rows() {
        return rows;
    }

    long insert(Map<String, ?> values, Clock clock) {
        for (String column : values.keySet()) {
            requireColumn(column);
        }

        Map<String, Object> row = new LinkedHashMap<>();
        long generated = 0;
        for (InMemoryColumn c : columns.values()) {
            Object value = values.get(c.name());
            if (value == null && c.autoIncrement()) {
                generated = nextId;
                value = generated;
            } else if (value == null && !values.containsKey(c.name())) {
                value = c.defaultNow() ? clock.instant() : c.defaultValue();
            }
            if (c.autoIncrement() && value instanceof Number) {
                nextId = Math.max(nextId, ((Number) value).longValue() + 1);
            }
            row.put(c.name(), value);
        }

        checkUnique(row);
        rows.add(row);
        return generated;
    }

    private void checkUnique(Map<String, Object> candidate) {
        for (var key : uniqueKeys.entrySet()) {
            List<String> keyCols = key.getValue();
            if (keyCols.stream().anyMatch(c -> candidate.get(c) == null)) continue;

            for (Map<String, Object> existing : rows) {
                boolean same = true;
                for (String col : keyCols) {
                    if (!valuesEqual(existing.get(col), candidate.get(col))) {
                        same = false;
                        break;
                    }
                }
                if (same) {
                    throw QueryException.duplicateKey("INSERT INTO " + name, key.getKey());
                }
            }
        }
    }

    void addColumn(InMemoryColumn column) {
        if (columns.containsKey(column.name())) {
            throw SchemaException.columnAlreadyExists(name, column.name());
        }
        columns.put(column.name(), column);
        for (Map<String, Object> row : rows) {
            row.put(column.name(), column.defaultValue());
        }
    }

    void dropColumn(String column) {
        if (!columns.containsKey(column)) {
            throw SchemaException.columnNotFound(name, column);
        }
        columns.remove(column);
        uniqueKeys.values().removeIf(cols -> cols.contains(column));
        for (Map<String, Object> row : rows) {
            row.remove(column);
        }
    }

    Map<String, List<String>> uniqueKeys() {
        return Collections.unmodifiableMap(uniqueKeys);
    }

    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ValueComparator.INSTANCE.compare(a, b) == 0;
        }
        return Objects.equals(a, b);
    }
}
