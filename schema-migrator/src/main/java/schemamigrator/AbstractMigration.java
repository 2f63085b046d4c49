package schemamigrator;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for migrations that carry their name explicitly.
 *
 * <p>The version is taken from the leading {@code yyyy_MM_dd_HHmmss} token of
 * the name, so {@code "2024_01_15_093000_create_posts_table"} has version
 * {@code "2024_01_15_093000"}. A name without that token is rejected unless the
 * version is passed explicitly.
 */
public abstract class AbstractMigration implements Migration {

    static final Pattern TIMESTAMP_PREFIX = Pattern.compile("^(\\d{4}_\\d{2}_\\d{2}_\\d{6})(?:_(.*))?$");

    private final String name;
    private final String version;

    /**
     * @param name timestamp prefixed migration name
     * @throws IllegalArgumentException if the name has no {@code yyyy_MM_dd_HHmmss} prefix
     */
    protected AbstractMigration(String name) {
        this(name, versionOf(name));
    }

    /**
     * @param name migration name
     * @param version sortable version token
     */
    protected AbstractMigration(String name, String version) {
        this.name = requireText(name, "name");
        this.version = requireText(version, "version");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String version() {
        return version;
    }

    /**
     * Humanized form of the name without its timestamp, e.g. "Create posts table".
     */
    @Override
    public String description() {
        Matcher m = TIMESTAMP_PREFIX.matcher(name);
        String base = m.matches() ? m.group(2) : name;
        if (base == null) return name;
        String words = base.replace('_', ' ').trim();
        if (words.isEmpty()) return name;
        return words.substring(0, 1).toUpperCase(Locale.ROOT) + words.substring(1);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }

    /**
     * Extracts the {@code yyyy_MM_dd_HHmmss} prefix of a migration name.
     *
     * @throws IllegalArgumentException if the name has no such prefix
     */
    public static String versionOf(String name) {
        Objects.requireNonNull(name, "name");
        Matcher m = TIMESTAMP_PREFIX.matcher(name);
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "Migration name must start with a yyyy_MM_dd_HHmmss timestamp: " + name);
        }
        return m.group(1);
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Migration " + what + " must not be blank");
        }
        return value;
    }
}
