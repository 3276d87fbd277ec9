package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;
import org.shale.model.ColumnModel;

/**
 * Native {@code ALTER TABLE ... ADD COLUMN}, used when an alteration only appends columns.
 */
public record AddColumnOperation(String tableName, ColumnModel column) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.ADD_COLUMN;
    }

    @Override
    public String target() {
        return tableName + "." + column.getName();
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitAddColumn(this);
    }
}
