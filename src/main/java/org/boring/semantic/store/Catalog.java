package org.boring.semantic.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A mapping from table name to the external relation that backs it.
 */
public interface Catalog {

    /**
     * @param name The table name
     * @return The table, if the catalog knows it
     */
    Optional<Table> find(String name);

    /**
     * @return The names of every table in the catalog
     */
    Set<String> tableNames();

    /**
     * @throws IllegalArgumentException if the catalog has no such table
     */
    default Table table(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Table '" + name + "' not found in catalog. Available tables: " + tableNames()));
    }

    /**
     * Creates an in-memory catalog over the given tables, keyed by table name.
     */
    static Catalog of(Table... tables) {
        return of(List.of(tables));
    }

    static Catalog of(List<Table> tables) {
        Map<String, Table> byName = new LinkedHashMap<>();
        for (Table table : tables) {
            byName.put(table.name(), table);
        }
        return new Catalog() {
            @Override
            public Optional<Table> find(String name) {
                return Optional.ofNullable(byName.get(name));
            }

            @Override
            public Set<String> tableNames() {
                return byName.keySet();
            }
        };
    }
}
