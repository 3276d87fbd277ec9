package org.shale.migration.compiler;

import lombok.extern.slf4j.Slf4j;
import org.shale.model.IndexModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-points indexes at a rebuilt or renamed table. Covered columns are rewritten through the
 * column mapping; an index that covers a column without a mapping is dropped. Partial index
 * predicates are carried over verbatim.
 */
@Slf4j
public class IndexRemapper {

    public record Result(List<IndexModel> kept, List<IndexModel> dropped) {
    }

    public Result remap(Collection<IndexModel> indexes, String tableName, Map<String, String> columnMapping) {
        List<IndexModel> kept = new ArrayList<>();
        List<IndexModel> dropped = new ArrayList<>();
        for (IndexModel index : indexes) {
            Optional<IndexModel> remapped = index.remapColumns(columnMapping);
            if (remapped.isPresent()) {
                kept.add(remapped.get().withTableName(tableName));
            } else {
                log.debug("Dropping index '{}' on '{}': a covered column no longer exists", index.getName(), tableName);
                dropped.add(index);
            }
        }
        return new Result(kept, dropped);
    }

    /**
     * Re-points indexes at a renamed table; columns are unchanged.
     */
    public List<IndexModel> retarget(Collection<IndexModel> indexes, String newTableName) {
        return indexes.stream().map(i -> i.withTableName(newTableName)).toList();
    }
}
