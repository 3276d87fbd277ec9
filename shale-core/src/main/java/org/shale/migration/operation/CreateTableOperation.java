package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;
import org.shale.model.TableModel;

public record CreateTableOperation(TableModel table) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.CREATE_TABLE;
    }

    @Override
    public String target() {
        return table.getName();
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitCreateTable(this);
    }
}
