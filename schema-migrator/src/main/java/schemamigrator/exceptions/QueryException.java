package schemamigrator.exceptions;

import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exception thrown when a read or write statement fails.
 *
 * <p>Carries enough context to log the failure and to decide whether it is worth
 * retrying:
 * <ul>
 *   <li>the statement text, truncated to {@value #MAX_SQL_LENGTH} characters</li>
 *   <li>the parameter bindings, with sensitive values redacted</li>
 *   <li>the vendor error code (MySQL numbering) and the SQL state</li>
 * </ul>
 *
 * <p>Classification predicates ({@link #isDuplicateKey()}, {@link #isDeadlock()}, ...)
 * look only at those two codes, so adapters must fill them in for the
 * predicates to work.
 */
public class QueryException extends DatabaseException {

    public static final int MAX_SQL_LENGTH = 500;
    public static final int MAX_BINDING_LENGTH = 100;
    public static final String TRUNCATED_MARKER = "... [TRUNCATED]";
    public static final String REDACTED_MARKER = "[REDACTED]";

    public static final int ER_DUP_ENTRY = 1062;
    public static final int ER_ROW_IS_REFERENCED = 1451;
    public static final int ER_NO_REFERENCED_ROW = 1452;
    public static final int ER_LOCK_DEADLOCK = 1213;
    public static final int ER_LOCK_WAIT_TIMEOUT = 1205;
    public static final int ER_PARSE_ERROR = 1064;
    public static final int ER_NO_SUCH_TABLE = 1146;
    public static final int ER_BAD_FIELD_ERROR = 1054;

    private static final List<String> SENSITIVE_KEYS = List.of("password", "secret", "token", "key", "auth");

    private final String sql;
    private final Map<String, Object> bindings;
    private final String sqlState;
    private final Integer vendorCode;

    /**
     * Creates a new query exception.
     *
     * @param message the error message
     * @param sql the failing statement, may be null
     * @param bindings parameter bindings by name (or position), may be null
     * @param sqlState SQL state code, may be null
     * @param vendorCode driver specific error code, may be null
     * @param cause the underlying cause, may be null
     */
    public QueryException(String message,
                          String sql,
                          Map<String, ?> bindings,
                          String sqlState,
                          Integer vendorCode,
                          Throwable cause) {
        super(message, cause);
        this.sql = sanitizeSql(sql);
        this.bindings = sanitizeBindings(bindings);
        this.sqlState = sqlState;
        this.vendorCode = vendorCode;
    }

    public QueryException(String message, String sql, Map<String, ?> bindings, String sqlState, Integer vendorCode) {
        this(message, sql, bindings, sqlState, vendorCode, null);
    }

    // ---------------- named constructors ----------------

    public static QueryException syntaxError(String sql, String error) {
        return new QueryException("SQL syntax error: " + error, sql, null, "42000", ER_PARSE_ERROR);
    }

    public static QueryException tableNotFound(String table) {
        return new QueryException("Table '" + table + "' doesn't exist", null, null, "42S02", ER_NO_SUCH_TABLE);
    }

    public static QueryException columnNotFound(String column) {
        return new QueryException("Unknown column '" + column + "'", null, null, "42S22", ER_BAD_FIELD_ERROR);
    }

    public static QueryException duplicateKey(String sql, String key) {
        return new QueryException("Duplicate entry for key '" + key + "'", sql, null, "23000", ER_DUP_ENTRY);
    }

    public static QueryException foreignKeyViolation(String sql, String constraint) {
        return new QueryException("Foreign key constraint fails: " + constraint, sql, null, "23000", ER_NO_REFERENCED_ROW);
    }

    public static QueryException deadlock(String sql) {
        return new QueryException("Deadlock found when trying to get lock", sql, null, "40001", ER_LOCK_DEADLOCK);
    }

    public static QueryException lockTimeout(String sql) {
        return new QueryException("Lock wait timeout exceeded", sql, null, "HY000", ER_LOCK_WAIT_TIMEOUT);
    }

    /**
     * Translates a JDBC failure, keeping its SQL state and vendor code.
     *
     * @param e the driver exception
     * @param sql the statement that failed
     * @param bindings positional parameters, keyed by 1-based index
     * @return the translated exception, with {@code e} as its cause
     */
    public static QueryException fromSqlException(SQLException e, String sql, List<?> bindings) {
        Map<String, Object> byIndex = new LinkedHashMap<>();
        if (bindings != null) {
            for (int i = 0; i < bindings.size(); i++) {
                byIndex.put(String.valueOf(i + 1), bindings.get(i));
            }
        }
        Integer code = e.getErrorCode() != 0 ? e.getErrorCode() : null;
        return new QueryException("Query failed: " + e.getMessage(), sql, byIndex, e.getSQLState(), code, e);
    }

    // ---------------- classification ----------------

    /**
     * True for vendor code 1062 or any SQL state of the integrity constraint
     * class {@code 23}, which covers drivers that report their own vendor code
     * for unique violations (SQL Server 2627, Oracle 1).
     */
    public boolean isDuplicateKey() {
        return isVendorCode(ER_DUP_ENTRY) || (sqlState != null && sqlState.startsWith("23"));
    }

    public boolean isForeignKeyViolation() {
        return isVendorCode(ER_ROW_IS_REFERENCED) || isVendorCode(ER_NO_REFERENCED_ROW) || "23503".equals(sqlState);
    }

    public boolean isDeadlock() {
        return isVendorCode(ER_LOCK_DEADLOCK) || "40001".equals(sqlState);
    }

    public boolean isLockTimeout() {
        return isVendorCode(ER_LOCK_WAIT_TIMEOUT);
    }

    @Override
    public boolean isRetryable() {
        return isDeadlock() || isLockTimeout();
    }

    private boolean isVendorCode(int code) {
        return vendorCode != null && vendorCode == code;
    }

    // ---------------- getters ----------------

    /** Returns the sanitized statement text, or an empty string if none was given. */
    public String getSql() {
        return sql;
    }

    /** Returns an unmodifiable view of the sanitized bindings. */
    public Map<String, Object> getBindings() {
        return bindings;
    }

    public String getSqlState() {
        return sqlState;
    }

    public Integer getVendorCode() {
        return vendorCode;
    }

    // ---------------- sanitizing ----------------

    private static String sanitizeSql(String sql) {
        if (sql == null) return "";
        if (sql.length() > MAX_SQL_LENGTH) {
            return sql.substring(0, MAX_SQL_LENGTH) + TRUNCATED_MARKER;
        }
        return sql;
    }

    private static Map<String, Object> sanitizeBindings(Map<String, ?> bindings) {
        if (bindings == null || bindings.isEmpty()) return Collections.emptyMap();

        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (var entry : bindings.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                sanitized.put(key, REDACTED_MARKER);
            } else if (value instanceof String && ((String) value).length() > MAX_BINDING_LENGTH) {
                sanitized.put(key, ((String) value).substring(0, MAX_BINDING_LENGTH) + TRUNCATED_MARKER);
            } else {
                sanitized.put(key, value);
            }
        }
        return Collections.unmodifiableMap(sanitized);
    }

    private static boolean isSensitive(String key) {
        if (key == null) return false;
        String lower = key.toLowerCase(Locale.ROOT);
        for (String sensitive : SENSITIVE_KEYS) {
            if (lower.contains(sensitive)) return true;
        }
        return false;
    }
}
