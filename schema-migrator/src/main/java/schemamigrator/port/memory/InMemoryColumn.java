package schemamigrator.port.memory;

/**
 * Column of an in-memory table as understood from its SQL definition.
 *
 * @param name column name
 * @param autoIncrement true if inserts without a value get the next sequence number
 * @param defaultNow true for {@code DEFAULT CURRENT_TIMESTAMP}
 * @param defaultValue literal default, or null
 */
record InMemoryColumn(String name, boolean autoIncrement, boolean defaultNow, Object defaultValue) {
}
