package org.shale.migration.compiler;

import org.shale.migration.operation.MigrationOperation;
import org.shale.model.IndexModel;
import org.shale.model.TableModel;

import java.util.List;

/**
 * Outcome of compiling one {@code alterTable} block.
 *
 * @param table          the table after every edit
 * @param indexes        indexes on the table that still exist, columns rewritten
 * @param droppedIndexes indexes removed because a covered column was dropped
 * @param operations     what to run against the database, in order
 */
public record AlterTableResult(TableModel table,
                               List<IndexModel> indexes,
                               List<IndexModel> droppedIndexes,
                               List<MigrationOperation> operations) {

    public AlterTableResult {
        indexes = List.copyOf(indexes);
        droppedIndexes = List.copyOf(droppedIndexes);
        operations = List.copyOf(operations);
    }
}
