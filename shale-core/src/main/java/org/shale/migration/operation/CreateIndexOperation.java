package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;
import org.shale.model.IndexModel;

public record CreateIndexOperation(IndexModel index, boolean ifNotExists) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.CREATE_INDEX;
    }

    @Override
    public String target() {
        return index.getName();
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitCreateIndex(this);
    }
}
