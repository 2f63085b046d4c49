package schemamigrator.port.memory;

import schemamigrator.port.QueryBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

final class InMemoryQueryBuilder implements QueryBuilder {

    private record Condition(String column, String operator, Object value) {}

    private record Order(String column, Direction direction) {}

    private final InMemorySchemaPort port;
    private String table;
    private final List<Condition> conditions = new ArrayList<>();
    private final List<Order> orders = new ArrayList<>();

    InMemoryQueryBuilder(InMemorySchemaPort port) {
        this.port = port;
    }

    @Override
    public QueryBuilder from(String table) {
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    @Override
    public QueryBuilder where(String column, String operator, Object value) {
        if (!isSupported(operator)) {
            throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
        conditions.add(new Condition(column, operator, value));
        return this;
    }

    @Override
    public QueryBuilder orderBy(String column, Direction direction) {
        orders.add(new Order(column, direction));
        return this;
    }

    @Override
    public List<Map<String, Object>> get() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : matching(target())) {
            result.add(new LinkedHashMap<>(row));
        }
        return result;
    }

    @Override
    public Optional<Map<String, Object>> first() {
        List<Map<String, Object>> rows = get();
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Object> pluck(String column) {
        InMemoryTable t = target();
        t.requireColumn(column);
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : matching(t)) {
            values.add(row.get(column));
        }
        return values;
    }

    @Override
    public Object max(String column) {
        InMemoryTable t = target();
        t.requireColumn(column);
        Object max = null;
        for (Map<String, Object> row : matching(t)) {
            Object value = row.get(column);
            if (value != null && (max == null || ValueComparator.INSTANCE.compare(value, max) > 0)) {
                max = value;
            }
        }
        return max;
    }

    @Override
    public long count() {
        return matching(target()).size();
    }

    @Override
    public long insert(Map<String, ?> row) {
        return target().insert(row, port.clock());
    }

    @Override
    public int delete() {
        InMemoryTable t = target();
        validateColumns(t);
        int deleted = 0;
        Iterator<Map<String, Object>> it = t.rows().iterator();
        while (it.hasNext()) {
            if (matches(it.next())) {
                it.remove();
                deleted++;
            }
        }
        return deleted;
    }

    // ---------------- evaluation ----------------

    private InMemoryTable target() {
        if (table == null) {
            throw new IllegalStateException("No table selected, call from() first");
        }
        return port.requireTable(port.tableName(table));
    }

    private List<Map<String, Object>> matching(InMemoryTable t) {
        validateColumns(t);
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : t.rows()) {
            if (matches(row)) result.add(row);
        }
        if (!orders.isEmpty()) {
            result.sort(rowComparator());
        }
        return result;
    }

    private void validateColumns(InMemoryTable t) {
        for (Condition c : conditions) t.requireColumn(c.column());
        for (Order o : orders) t.requireColumn(o.column());
    }

    private boolean matches(Map<String, Object> row) {
        for (Condition c : conditions) {
            if (!test(row.get(c.column()), c.operator(), c.value())) return false;
        }
        return true;
    }

    private static boolean test(Object actual, String operator, Object expected) {
        switch (operator) {
            case "=":
                return InMemoryTable.valuesEqual(actual, expected);
            case "!=":
            case "<>":
                return !InMemoryTable.valuesEqual(actual, expected);
            default:
                break;
        }
        // SQL semantics: ordering comparisons against NULL are never true
        if (actual == null || expected == null) return false;
        int cmp = ValueComparator.INSTANCE.compare(actual, expected);
        switch (operator) {
            case "<": return cmp < 0;
            case "<=": return cmp <= 0;
            case ">": return cmp > 0;
            case ">=": return cmp >= 0;
            default: throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
    }

    private Comparator<Map<String, Object>> rowComparator() {
        Comparator<Map<String, Object>> comparator = null;
        for (Order o : orders) {
            Comparator<Map<String, Object>> next =
                    (a, b) -> ValueComparator.INSTANCE.compare(a.get(o.column()), b.get(o.column()));
            if (o.direction() == Direction.DESC) next = next.reversed();
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    static boolean isSupported(String operator) {
        switch (operator) {
            case "=": case "!=": case "<>": case "<": case "<=": case ">": case ">=":
                return true;
            default:
                return false;
        }
    }
}
