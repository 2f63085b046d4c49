package schemamigrator.runner;

import schemamigrator.Migration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered migrations keyed by name, kept in ascending version order.
 *
 * <p>The sort is stable: equal versions keep registration order. Registering a
 * name again replaces the earlier instance in place.
 */
final class MigrationRegistry {

    private static final Comparator<Migration> BY_VERSION =
            Comparator.comparing(Migration::version, VersionComparator.INSTANCE);

    private final Map<String, Migration> byName = new LinkedHashMap<>();
    private List<Migration> ordered = List.of();

    void register(Migration migration) {
        byName.put(migration.name(), migration);
        List<Migration> sorted = new ArrayList<>(byName.values());
        sorted.sort(BY_VERSION);
        ordered = List.copyOf(sorted);
    }

    Optional<Migration> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** Oldest first. */
    List<Migration> ordered() {
        return ordered;
    }

    Optional<Migration> latest() {
        return ordered.isEmpty() ? Optional.empty() : Optional.of(ordered.get(ordered.size() - 1));
    }
}
