package schemamigrator.port.jdbc;

import schemamigrator.exceptions.QueryException;
import schemamigrator.port.QueryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds parameterised SQL for one statement. Column labels in results are
 * lower-cased so rows read the same across drivers.
 */
final class JdbcQueryBuilder implements QueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryBuilder.class);

    private static final Set<String> OPERATORS = Set.of("=", "!=", "<>", "<", "<=", ">", ">=");

    private record Condition(String column, String operator, Object value) {}

    private final JdbcSchemaPort port;
    private final List<Condition> conditions = new ArrayList<>();
    private final List<String> orders = new ArrayList<>();
    private String table;

    JdbcQueryBuilder(JdbcSchemaPort port) {
        this.port = port;
    }

    @Override
    public QueryBuilder from(String table) {
        this.table = port.tableName(table);
        return this;
    }

    @Override
    public QueryBuilder where(String column, String operator, Object value) {
        if (!OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
        conditions.add(new Condition(JdbcSchemaPort.identifier(column), operator, value));
        return this;
    }

    @Override
    public QueryBuilder orderBy(String column, Direction direction) {
        orders.add(JdbcSchemaPort.identifier(column) + " " + direction.name());
        return this;
    }

    @Override
    public List<Map<String, Object>> get() {
        return select("*", 0);
    }

    @Override
    public Optional<Map<String, Object>> first() {
        List<Map<String, Object>> rows = select("*", 1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Object> pluck(String column) {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : select(JdbcSchemaPort.identifier(column), 0)) {
            values.add(row.values().iterator().next());
        }
        return values;
    }

    @Override
    public Object max(String column) {
        List<Map<String, Object>> rows = select("MAX(" + JdbcSchemaPort.identifier(column) + ")", 0);
        return rows.isEmpty() ? null : rows.get(0).values().iterator().next();
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = select("COUNT(*)", 0);
        Object value = rows.get(0).values().iterator().next();
        return ((Number) value).longValue();
    }

    @Override
    public long insert(Map<String, ?> row) {
        requireTable();
        List<String> columns = new ArrayList<>();
        List<Object> bindings = new ArrayList<>();
        for (Map.Entry<String, ?> e : row.entrySet()) {
            columns.add(JdbcSchemaPort.identifier(e.getKey()));
            bindings.add(e.getValue());
        }
        String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        log.debug("{}", sql);
        Connection connection = port.connection();
        try (PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, bindings);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys != null && keys.next() ? keys.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw QueryException.fromSqlException(e, sql, bindings);
        }
    }

    @Override
    public int delete() {
        requireTable();
        List<Object> bindings = new ArrayList<>();
        String sql = "DELETE FROM " + table + whereClause(bindings);

        log.debug("{}", sql);
        try (PreparedStatement ps = port.connection().prepareStatement(sql)) {
            bind(ps, bindings);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw QueryException.fromSqlException(e, sql, bindings);
        }
    }

    private List<Map<String, Object>> select(String projection, int maxRows) {
        requireTable();
        List<Object> bindings = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(table);
        sql.append(whereClause(bindings));
        if (!orders.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orders));
        }

        log.debug("{}", sql);
        try (PreparedStatement ps = port.connection().prepareStatement(sql.toString())) {
            if (maxRows > 0) {
                ps.setMaxRows(maxRows);
            }
            bind(ps, bindings);
            try (ResultSet rs = ps.executeQuery()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw QueryException.fromSqlException(e, sql.toString(), bindings);
        }
    }

    private String whereClause(List<Object> bindings) {
        if (conditions.isEmpty()) return "";
        List<String> parts = new ArrayList<>();
        for (Condition c : conditions) {
            if (c.value() == null && c.operator().equals("=")) {
                parts.add(c.column() + " IS NULL");
            } else if (c.value() == null && (c.operator().equals("!=") || c.operator().equals("<>"))) {
                parts.add(c.column() + " IS NOT NULL");
            } else {
                parts.add(c.column() + " " + c.operator() + " ?");
                bindings.add(c.value());
            }
        }
        return " WHERE " + String.join(" AND ", parts);
    }

    private static void bind(PreparedStatement ps, List<Object> bindings) throws SQLException {
        for (int i = 0; i < bindings.size(); i++) {
            Object value = bindings.get(i);
            if (value instanceof Instant) {
                value = Timestamp.from((Instant) value);
            }
            ps.setObject(i + 1, value);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private void requireTable() {
        if (table == null) {
            throw new IllegalStateException("No table selected; call from() first");
        }
    }
}
