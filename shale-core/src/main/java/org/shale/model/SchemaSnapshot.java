package org.shale.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The complete set of tables and indexes as they exist at one declared version. Tables and
 * indexes live in separate namespaces. Instances are immutable.
 */
public final class SchemaSnapshot {
    public static final SchemaSnapshot EMPTY = new SchemaSnapshot(Map.of(), Map.of());

    private final Map<String, TableModel> tables;
    private final Map<String, IndexModel> indexes;

    public SchemaSnapshot(Map<String, TableModel> tables, Map<String, IndexModel> indexes) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        this.indexes = Collections.unmodifiableMap(new LinkedHashMap<>(indexes));
    }

    public Map<String, TableModel> getTables() {
        return tables;
    }

    public Map<String, IndexModel> getIndexes() {
        return indexes;
    }

    public List<String> tableNames() {
        return List.copyOf(tables.keySet());
    }

    public List<String> indexNames() {
        return List.copyOf(indexes.keySet());
    }

    public Optional<TableModel> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public Optional<IndexModel> index(String name) {
        return Optional.ofNullable(indexes.get(name));
    }

    public List<IndexModel> indexesOn(String tableName) {
        return indexes.values().stream()
                .filter(i -> i.getTableName().equals(tableName))
                .toList();
    }

    public boolean isEmpty() {
        return tables.isEmpty() && indexes.isEmpty();
    }

    @Override
    public String toString() {
        return "SchemaSnapshot{tables=" + tables.keySet() + ", indexes=" + indexes.keySet() + "}";
    }
}
