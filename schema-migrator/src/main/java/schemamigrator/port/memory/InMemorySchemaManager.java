package schemamigrator.port.memory;

import schemamigrator.exceptions.SchemaException;
import schemamigrator.port.SchemaManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class InMemorySchemaManager implements SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(InMemorySchemaManager.class);

    private final InMemorySchemaPort port;

    InMemorySchemaManager(InMemorySchemaPort port) {
        this.port = port;
    }

    @Override
    public void createTable(String table, String columnDefinitions) {
        String physical = port.tableName(table);
        if (port.tables().containsKey(physical)) {
            throw SchemaException.tableAlreadyExists(physical);
        }
        ColumnDefinitionParser.Definition definition;
        try {
            definition = ColumnDefinitionParser.parse(columnDefinitions);
        } catch (IllegalArgumentException e) {
            throw SchemaException.tableCreationFailed(physical, e.getMessage(), e);
        }
        port.tables().put(physical, new InMemoryTable(physical, definition));
        log.debug("Created table {}", physical);
    }

    @Override
    public void dropTable(String table) {
        String physical = port.tableName(table);
        if (port.tables().remove(physical) == null) {
            throw SchemaException.tableNotFound(physical);
        }
        log.debug("Dropped table {}", physical);
    }

    @Override
    public void dropTableIfExists(String table) {
        port.tables().remove(port.tableName(table));
    }

    @Override
    public boolean tableExists(String table) {
        return port.tables().containsKey(port.tableName(table));
    }

    @Override
    public void addColumn(String table, String column, String definition) {
        InMemoryTable t = existing(table);
        InMemoryColumn parsed;
        try {
            parsed = ColumnDefinitionParser.parseColumn(column, definition);
        } catch (IllegalArgumentException e) {
            throw SchemaException.columnAddFailed(t.name(), column, e.getMessage(), e);
        }
        t.addColumn(parsed);
    }

    @Override
    public void dropColumn(String table, String column) {
        existing(table).dropColumn(column);
    }

    @Override
    public boolean hasColumn(String table, String column) {
        InMemoryTable t = port.tables().get(port.tableName(table));
        return t != null && t.hasColumn(column);
    }

    private InMemoryTable existing(String table) {
        InMemoryTable t = port.tables().get(port.tableName(table));
        if (t == null) {
            throw SchemaException.tableNotFound(port.tableName(table));
        }
        return t;
    }
}
