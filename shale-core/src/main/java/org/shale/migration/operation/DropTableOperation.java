package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;

public record DropTableOperation(String tableName, boolean ifExists) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.DROP_TABLE;
    }

    @Override
    public String target() {
        return tableName;
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitDropTable(this);
    }
}
