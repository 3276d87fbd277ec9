package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;

public record DropIndexOperation(String indexName, boolean ifExists) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.DROP_INDEX;
    }

    @Override
    public String target() {
        return indexName;
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitDropIndex(this);
    }
}
