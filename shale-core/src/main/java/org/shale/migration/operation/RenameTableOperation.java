package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;

public record RenameTableOperation(String from, String to) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.RENAME_TABLE;
    }

    @Override
    public String target() {
        return from;
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitRenameTable(this);
    }
}
