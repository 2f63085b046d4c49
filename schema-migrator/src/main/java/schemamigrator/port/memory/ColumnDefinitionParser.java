package schemamigrator.port.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the subset of MySQL column definition syntax the in-memory port needs:
 * column names, {@code AUTO_INCREMENT}, {@code PRIMARY KEY}, {@code UNIQUE},
 * {@code UNIQUE KEY name (cols)} and simple {@code DEFAULT} values. Types and
 * other modifiers are accepted and ignored.
 */
final class ColumnDefinitionParser {

    static final String PRIMARY = "PRIMARY";

    private static final Pattern KEY_COLUMNS = Pattern.compile("\\(([^)]*)\\)");
    private static final Pattern UNIQUE_KEY = Pattern.compile("UNIQUE(\\s+(KEY|INDEX))?(\\s+\\S+)?\\s*\\(");
    private static final Pattern UNIQUE_WORD = Pattern.compile("\\bUNIQUE\\b");
    private static final Pattern SERIAL_TYPE = Pattern.compile("^\\S+\\s+(BIG)?SERIAL\\b");
    private static final Pattern DEFAULT_VALUE = Pattern.compile(
            "\\bDEFAULT\\s+('(?:[^']*)'|-?\\d+(?:\\.\\d+)?|NULL|CURRENT_TIMESTAMP(?:\\(\\))?)",
            Pattern.CASE_INSENSITIVE);

    private ColumnDefinitionParser() {}

    /**
     * Parsed table shape: columns in declaration order and unique keys by name
     * (the primary key is stored under {@value #PRIMARY}).
     */
    record Definition(List<InMemoryColumn> columns, Map<String, List<String>> uniqueKeys) {}

    /**
     * @throws IllegalArgumentException if the definition declares no columns or is malformed
     */
    static Definition parse(String definitions) {
        if (definitions == null || definitions.isBlank()) {
            throw new IllegalArgumentException("no column definitions");
        }

        List<InMemoryColumn> columns = new ArrayList<>();
        Map<String, List<String>> uniqueKeys = new LinkedHashMap<>();

        for (String part : splitTopLevel(definitions)) {
            String def = part.trim();
            if (def.isEmpty()) continue;
            String upper = def.toUpperCase(Locale.ROOT);

            if (upper.startsWith("PRIMARY KEY")) {
                uniqueKeys.put(PRIMARY, keyColumns(def));
            } else if (UNIQUE_KEY.matcher(upper).lookingAt()) {
                uniqueKeys.put(uniqueKeyName(def), keyColumns(def));
            } else if (upper.startsWith("KEY ") || upper.startsWith("INDEX ")
                    || upper.startsWith("CONSTRAINT ") || upper.startsWith("FOREIGN KEY")) {
                // plain indexes and foreign keys are not enforced
            } else {
                InMemoryColumn column = parseColumnDef(def, upper);
                columns.add(column);
                if (upper.contains("PRIMARY KEY")) {
                    uniqueKeys.put(PRIMARY, List.of(column.name()));
                } else if (UNIQUE_WORD.matcher(upper).find()) {
                    uniqueKeys.put(column.name(), List.of(column.name()));
                }
            }
        }

        if (columns.isEmpty()) {
            throw new IllegalArgumentException("no columns declared");
        }
        for (List<String> keyCols : uniqueKeys.values()) {
            for (String col : keyCols) {
                if (columns.stream().noneMatch(c -> c.name().equals(col))) {
                    throw new IllegalArgumentException("key refers to unknown column " + col);
                }
            }
        }
        return new Definition(columns, uniqueKeys);
    }

    /**
     * Parses a single column definition such as {@code "VARCHAR(64) NULL"} for {@code name}.
     */
    static InMemoryColumn parseColumn(String name, String definition) {
        String def = name + " " + (definition == null ? "" : definition);
        return parseColumnDef(def.trim(), def.trim().toUpperCase(Locale.ROOT));
    }

    private static InMemoryColumn parseColumnDef(String def, String upper) {
        String name = unquote(def.split("\\s+", 2)[0]);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("column without a name: " + def);
        }
        boolean autoIncrement = upper.contains("AUTO_INCREMENT") || upper.contains("AUTOINCREMENT")
                || SERIAL_TYPE.matcher(upper).find();

        boolean defaultNow = false;
        Object defaultValue = null;
        Matcher m = DEFAULT_VALUE.matcher(def);
        if (m.find()) {
            String literal = m.group(1);
            String literalUpper = literal.toUpperCase(Locale.ROOT);
            if (literalUpper.startsWith("CURRENT_TIMESTAMP")) {
                defaultNow = true;
            } else if (literal.startsWith("'")) {
                defaultValue = literal.substring(1, literal.length() - 1);
            } else if (!literalUpper.equals("NULL")) {
                if (literal.contains(".")) {
                    defaultValue = Double.valueOf(literal);
                } else {
                    defaultValue = Long.valueOf(literal);
                }
            }
        }
        return new InMemoryColumn(name, autoIncrement, defaultNow, defaultValue);
    }

    private static List<String> keyColumns(String def) {
        Matcher m = KEY_COLUMNS.matcher(def);
        if (!m.find()) {
            throw new IllegalArgumentException("key without columns: " + def);
        }
        List<String> cols = new ArrayList<>();
        for (String c : m.group(1).split(",")) {
            String col = unquote(c.trim());
            if (!col.isEmpty()) cols.add(col);
        }
        if (cols.isEmpty()) {
            throw new IllegalArgumentException("key without columns: " + def);
        }
        return List.copyOf(cols);
    }

    private static String uniqueKeyName(String def) {
        String head = def.substring(0, def.indexOf('(') < 0 ? def.length() : def.indexOf('(')).trim();
        String[] tokens = head.split("\\s+");
        String last = tokens[tokens.length - 1];
        String upperLast = last.toUpperCase(Locale.ROOT);
        if (tokens.length > 1 && !upperLast.equals("KEY") && !upperLast.equals("INDEX")) {
            return unquote(last);
        }
        return "uk_" + String.join("_", keyColumns(def));
    }

    private static List<String> splitTopLevel(String definitions) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < definitions.length(); i++) {
            char c = definitions.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(definitions.substring(start, i));
                start = i + 1;
            }
            if (depth < 0) {
                throw new IllegalArgumentException("unbalanced parentheses");
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("unbalanced parentheses");
        }
        parts.add(definitions.substring(start));
        return parts;
    }

    private static String unquote(String identifier) {
        return identifier.replace("`", "").replace("\"", "");
    }
}
