package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;
import org.shale.model.IndexModel;

/**
 * SQLite cannot rename an index; the old one is dropped and {@code renamed} is created.
 */
public record RenameIndexOperation(String from, IndexModel renamed) implements MigrationOperation {
    @Override
    public OperationKind kind() {
        return OperationKind.RENAME_INDEX;
    }

    @Override
    public String target() {
        return from;
    }

    @Override
    public void accept(MigrationVisitor visitor) {
        visitor.visitRenameIndex(this);
    }
}
