package schemamigrator.generate;

import schemamigrator.exceptions.MigrationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Writes new migration source files from a template.
 *
 * <p>For name {@code create_posts_table} generated at 2024-01-15 09:30:00 the file
 * is {@code <root>/<package dirs>/V2024_01_15_093000__CreatePostsTable.java} and
 * the class passes {@code 2024_01_15_093000_create_posts_table} to
 * {@code AbstractMigration}. Existing files are never overwritten.
 */
public final class MigrationGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigrationGenerator.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy_MM_dd_HHmmss", Locale.ROOT);

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Pattern VALID_TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private static final String HEADER = """
            %s\
            import schemamigrator.AbstractMigration;
            import schemamigrator.port.SchemaPort;

            public class %s extends AbstractMigration {

                public %s() {
                    super("%s");
                }

            """;

    private static final String CREATE_BODY = """
                @Override
                public void up(SchemaPort port) {
                    port.schema().createTable("%1$s",
                            "id INT UNSIGNED AUTO_INCREMENT PRIMARY KEY, "
                                    + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
                }

                @Override
                public void down(SchemaPort port) {
                    port.schema().dropTableIfExists("%1$s");
                }
            }
            """;

    private static final String ALTER_BODY = """
                @Override
                public void up(SchemaPort port) {
                    // Add migration logic here, e.g.
                    // port.schema().addColumn("%1$s", "title", "VARCHAR(255) NOT NULL");
                }

                @Override
                public void down(SchemaPort port) {
                    // Reverse the changes made in up(), e.g.
                    // port.schema().dropColumn("%1$s", "title");
                }
            }
            """;

    private static final String EMPTY_BODY = """
                @Override
                public void up(SchemaPort port) {
                    // Add migration logic here
                }

                @Override
                public void down(SchemaPort port) {
                    // Reverse the changes made in up()
                }
            }
            """;

    private final Clock clock;

    public MigrationGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generate a migration source file.
     *
     * @param sourceRoot source root the package directories are created under
     * @param packageName package of the generated class, empty for the default package
     * @param name migration name in snake or camel case
     * @param table table for the stubs, or null
     * @param create true for create/drop table stubs; ignored without a table
     * @return path of the written file
     * @throws MigrationException generate-failed on an invalid name, an existing file or an I/O error
     */
    public Path generate(Path sourceRoot, String packageName, String name, String table, boolean create)
            throws MigrationException {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw MigrationException.generateFailed(String.valueOf(name),
                    "name must start with a letter and contain only letters, digits and underscores");
        }
        if (table != null && !VALID_TABLE.matcher(table).matches()) {
            throw MigrationException.generateFailed(name, "invalid table name: " + table);
        }
        String pkg = packageName == null ? "" : packageName;
        if (!pkg.isEmpty() && !SourceVersion.isName(pkg)) {
            throw MigrationException.generateFailed(name, "invalid package name: " + pkg);
        }

        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        String className = className(timestamp, name);
        String migrationName = timestamp + "_" + snakeCase(name);

        Path directory = pkg.isEmpty() ? sourceRoot : sourceRoot.resolve(pkg.replace('.', '/'));
        Path file = directory.resolve(className + ".java");

        try {
            Files.createDirectories(directory);
            Files.writeString(file, render(pkg, className, migrationName, table, create),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (FileAlreadyExistsException e) {
            throw MigrationException.generateFailed(name, "file already exists: " + file, e);
        } catch (IOException e) {
            throw MigrationException.generateFailed(name, "cannot write " + file + ": " + e.getMessage(), e);
        }

        log.info("Generated migration {} at {}", migrationName, file);
        return file;
    }

    static String render(String packageName, String className, String migrationName, String table, boolean create) {
        String packageLine = packageName.isEmpty() ? "" : "package " + packageName + ";\n\n";
        String body;
        if (table == null) {
            body = EMPTY_BODY;
        } else {
            body = String.format(create ? CREATE_BODY : ALTER_BODY, table);
        }
        return String.format(HEADER, packageLine, className, className, migrationName) + body;
    }

    static String className(String timestamp, String name) {
        return "V" + timestamp + "__" + pascalCase(name);
    }

    static String snakeCase(String name) {
        return CAMEL_BOUNDARY.matcher(name).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    static String pascalCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (String part : snakeCase(name).split("_")) {
            if (part.isEmpty()) continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }
}
