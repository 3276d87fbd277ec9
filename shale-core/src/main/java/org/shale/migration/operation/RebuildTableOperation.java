package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;
import org.shale.model.IndexModel;
import org.shale.model.TableModel;

import java.util.List;

/**
 * Rebuilds a table: create {@code temporaryName} with the final structure, copy the rows through
 * {@code columnPlan}, drop the original, rename the copy into place, then recreate
 * {@code indexesToRecreate}. Applied as one unit.
 */
public record RebuildTableOperation(String originalName,
                                    String temporaryName,
                                    TableModel finalTable,
                                    List<ColumnSource> columnPlan,
                                    List<IndexModel> indexesToRecreate) implements MigrationOperation {

    public RebuildTableOperation {
        columnPlan = List.copyOf(columnPlan);
        indexesToRecreate = List.copyOf(indexesToRecreate);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.REBUILD_TABLE;
    }

    @Override
    public String target() {
        return originalName;
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitRebuildTable(this);
    }
}
