package org.shale.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class IndexModel {
    String name;
    String tableName;
    @Singular List<String> columns;
    boolean unique;
    String where; // partial index predicate, never rewritten on column renames

    public IndexModel withTableName(String newTableName) {
        return toBuilder().tableName(newTableName).build();
    }

    public IndexModel renamedTo(String newName) {
        return toBuilder().name(newName).build();
    }

    public boolean covers(String columnName) {
        return columns.contains(columnName);
    }

    /**
     * Rewrites the indexed columns through {@code columnMapping} (old name to new name).
     *
     * @return the rewritten index, or empty when a covered column has no mapping (it was dropped)
     */
    public Optional<IndexModel> remapColumns(Map<String, String> columnMapping) {
        List<String> remapped = new ArrayList<>(columns.size());
        for (String column : columns) {
            String target = columnMapping.get(column);
            if (target == null) {
                return Optional.empty();
            }
            remapped.add(target);
        }
        return Optional.of(toBuilder().clearColumns().columns(remapped).build());
    }
}
