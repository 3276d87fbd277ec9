package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;

public record ExecuteOperation(String description, ExecuteBlock block) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.EXECUTE;
    }

    @Override
    public String target() {
        return description;
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitExecute(this);
    }
}
