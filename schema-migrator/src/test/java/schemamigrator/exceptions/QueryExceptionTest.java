package schemamigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryException")
class QueryExceptionTest {

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("deadlock should be retryable")
        void deadlockShouldBeRetryable() {
            QueryException e = QueryException.deadlock("UPDATE t SET x = 1");

            assertThat(e.isDeadlock()).isTrue();
            assertThat(e.isRetryable()).isTrue();
            assertThat(e.isDuplicateKey()).isFalse();
        }

        @Test
        @DisplayName("lock timeout should be retryable")
        void lockTimeoutShouldBeRetryable() {
            QueryException e = QueryException.lockTimeout("UPDATE t SET x = 1");

            assertThat(e.isLockTimeout()).isTrue();
            assertThat(e.isRetryable()).isTrue();
        }

        @Test
        @DisplayName("duplicate key should not be retryable")
        void duplicateKeyShouldNotBeRetryable() {
            QueryException e = QueryException.duplicateKey("INSERT INTO migrations", "uk_migration");

            assertThat(e.isDuplicateKey()).isTrue();
            assertThat(e.isRetryable()).isFalse();
            assertThat(e.getSqlState()).isEqualTo("23000");
            assertThat(e.getVendorCode()).isEqualTo(QueryException.ER_DUP_ENTRY);
        }

        @Test
        @DisplayName("foreign key violation should be classified by vendor code")
        void foreignKeyViolationByVendorCode() {
            QueryException e = QueryException.foreignKeyViolation("DELETE FROM users", "fk_posts_user");

            assertThat(e.isForeignKeyViolation()).isTrue();
            assertThat(e.isRetryable()).isFalse();
        }

        @Test
        @DisplayName("any integrity constraint state should count as duplicate key")
        void integrityStateClassIsDuplicateKey() {
            assertThat(new QueryException("dup", "INSERT", null, "23000", 2627).isDuplicateKey()).isTrue();
            assertThat(new QueryException("dup", "INSERT", null, "23000", 1).isDuplicateKey()).isTrue();
            assertThat(new QueryException("dup", "INSERT", null, "23505", 0).isDuplicateKey()).isTrue();
            assertThat(new QueryException("check", "INSERT", null, "23514", null).isDuplicateKey()).isTrue();
            assertThat(new QueryException("gone", "SELECT", null, "42S02", 1146).isDuplicateKey()).isFalse();
            assertThat(new QueryException("dup", "INSERT", null, null, 1062).isDuplicateKey()).isTrue();
        }

        @Test
        @DisplayName("syntax, table and column errors should be permanent")
        void lookupErrorsArePermanent() {
            assertThat(QueryException.syntaxError("SELEC 1", "near SELEC").isRetryable()).isFalse();
            assertThat(QueryException.tableNotFound("posts").getVendorCode()).isEqualTo(QueryException.ER_NO_SUCH_TABLE);
            assertThat(QueryException.columnNotFound("slug").getSqlState()).isEqualTo("42S22");
        }
    }

    @Nested
    @DisplayName("sanitizing")
    class Sanitizing {

        @Test
        @DisplayName("should truncate long SQL")
        void shouldTruncateLongSql() {
            String sql = "SELECT " + "x".repeat(600);

            QueryException e = new QueryException("failed", sql, null, null, null);

            assertThat(e.getSql())
                    .hasSize(QueryException.MAX_SQL_LENGTH + QueryException.TRUNCATED_MARKER.length())
                    .endsWith(QueryException.TRUNCATED_MARKER);
        }

        @Test
        @DisplayName("should return empty SQL when none was given")
        void shouldDefaultSqlToEmpty() {
            assertThat(QueryException.tableNotFound("posts").getSql()).isEmpty();
        }

        @Test
        @DisplayName("should redact sensitive bindings and truncate long strings")
        void shouldSanitizeBindings() {
            Map<String, Object> bindings = new LinkedHashMap<>();
            bindings.put("email", "a@b.c");
            bindings.put("user_password", "hunter2");
            bindings.put("API_TOKEN", "abc");
            bindings.put("bio", "y".repeat(150));

            QueryException e = new QueryException("failed", "INSERT", bindings, null, null);

            assertThat(e.getBindings())
                    .containsEntry("email", "a@b.c")
                    .containsEntry("user_password", QueryException.REDACTED_MARKER)
                    .containsEntry("API_TOKEN", QueryException.REDACTED_MARKER);
            assertThat((String) e.getBindings().get("bio"))
                    .startsWith("y".repeat(QueryException.MAX_BINDING_LENGTH))
                    .endsWith(QueryException.TRUNCATED_MARKER);
        }
    }

    @Nested
    @DisplayName("fromSqlException")
    class FromSqlException {

        @Test
        @DisplayName("should keep state, vendor code and positional bindings")
        void shouldTranslate() {
            SQLException cause = new SQLException("Duplicate entry 'x' for key 'uk_migration'", "23000", 1062);

            QueryException e = QueryException.fromSqlException(cause, "INSERT INTO migrations (migration) VALUES (?)",
                    List.of("x"));

            assertThat(e).hasCause(cause).hasMessageContaining("Duplicate entry");
            assertThat(e.isDuplicateKey()).isTrue();
            assertThat(e.getBindings()).containsEntry("1", "x");
        }

        @Test
        @DisplayName("should recognise serialization failures as deadlocks")
        void shouldRecogniseSerializationFailure() {
            SQLException cause = new SQLException("could not serialize access", "40001");

            assertThat(QueryException.fromSqlException(cause, "UPDATE t", null).isRetryable()).isTrue();
        }
    }
}
