package schemamigrator.port.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ColumnDefinitionParser")
class ColumnDefinitionParserTest {

    @Test
    @DisplayName("should read columns, keys and defaults")
    void shouldReadDefinition() {
        ColumnDefinitionParser.Definition d = ColumnDefinitionParser.parse(
                "id BIGINT UNSIGNED AUTO_INCREMENT PRIMARY KEY, "
                        + "`email` VARCHAR(255) NOT NULL UNIQUE, "
                        + "score DECIMAL(5,2) DEFAULT 1.5, "
                        + "status VARCHAR(20) DEFAULT 'new', "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                        + "KEY idx_status (status)");

        assertThat(d.columns()).containsExactly(
                new InMemoryColumn("id", true, false, null),
                new InMemoryColumn("email", false, false, null),
                new InMemoryColumn("score", false, false, 1.5),
                new InMemoryColumn("status", false, false, "new"),
                new InMemoryColumn("created_at", false, true, null));
        assertThat(d.uniqueKeys())
                .containsEntry(ColumnDefinitionParser.PRIMARY, List.of("id"))
                .containsEntry("email", List.of("email"))
                .hasSize(2);
    }

    @Test
    @DisplayName("should read named and composite unique keys")
    void shouldReadCompositeKeys() {
        ColumnDefinitionParser.Definition d = ColumnDefinitionParser.parse(
                "post_id INT, tag_id INT, PRIMARY KEY (post_id, tag_id), UNIQUE KEY uk_tag (tag_id), UNIQUE (post_id)");

        assertThat(d.uniqueKeys())
                .containsEntry(ColumnDefinitionParser.PRIMARY, List.of("post_id", "tag_id"))
                .containsEntry("uk_tag", List.of("tag_id"))
                .containsEntry("uk_post_id", List.of("post_id"));
    }

    @Test
    @DisplayName("should read columns whose names start with unique as plain columns")
    void shouldNotMistakeUniquePrefixedColumnForKey() {
        ColumnDefinitionParser.Definition d = ColumnDefinitionParser.parse(
                "id INT AUTO_INCREMENT PRIMARY KEY, unique_code VARCHAR(32) NOT NULL, uniqueness INT DEFAULT 3");

        assertThat(d.columns()).extracting(InMemoryColumn::name).containsExactly("id", "unique_code", "uniqueness");
        assertThat(d.columns().get(2).defaultValue()).isEqualTo(3L);
        assertThat(d.uniqueKeys()).containsOnlyKeys(ColumnDefinitionParser.PRIMARY);
    }

    @Test
    @DisplayName("should keep integer and decimal defaults apart")
    void shouldKeepNumericDefaultTypes() {
        assertThat(ColumnDefinitionParser.parseColumn("views", "INT DEFAULT 0").defaultValue())
                .isInstanceOf(Long.class).isEqualTo(0L);
        assertThat(ColumnDefinitionParser.parseColumn("ratio", "DOUBLE DEFAULT -0.5").defaultValue())
                .isInstanceOf(Double.class).isEqualTo(-0.5);
    }

    @Test
    @DisplayName("should treat SERIAL columns as auto-increment")
    void shouldTreatSerialAsAutoIncrement() {
        assertThat(ColumnDefinitionParser.parse("id BIGSERIAL PRIMARY KEY").columns().get(0).autoIncrement())
                .isTrue();
    }

    @Test
    @DisplayName("should reject malformed definitions")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> ColumnDefinitionParser.parse(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnDefinitionParser.parse("id INT, UNIQUE KEY uk ()"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnDefinitionParser.parse("name VARCHAR(20"))
                .hasMessage("unbalanced parentheses");
        assertThatThrownBy(() -> ColumnDefinitionParser.parse("PRIMARY KEY (id)"))
                .hasMessage("no columns declared");
    }

    @Test
    @DisplayName("should parse a single added column")
    void shouldParseSingleColumn() {
        assertThat(ColumnDefinitionParser.parseColumn("views", "INT NOT NULL DEFAULT 0"))
                .isEqualTo(new InMemoryColumn("views", false, false, 0L));
    }
}
