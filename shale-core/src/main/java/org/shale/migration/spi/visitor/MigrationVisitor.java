package org.shale.migration.spi.visitor;

import org.shale.migration.operation.AddColumnOperation;
import org.shale.migration.operation.CreateIndexOperation;
import org.shale.migration.operation.CreateTableOperation;
import org.shale.migration.operation.DropIndexOperation;
import org.shale.migration.operation.DropTableOperation;
import org.shale.migration.operation.ExecuteOperation;
import org.shale.migration.operation.RebuildTableOperation;
import org.shale.migration.operation.RenameIndexOperation;
import org.shale.migration.operation.RenameTableOperation;

public interface MigrationVisitor {
    void visitCreateTable(CreateTableOperation op);
    void visitDropTable(DropTableOperation op);
    void visitRenameTable(RenameTableOperation op);
    void visitAddColumn(AddColumnOperation op);
    void visitRebuildTable(RebuildTableOperation op);
    void visitCreateIndex(CreateIndexOperation op);
    void visitDropIndex(DropIndexOperation op);
    void visitRenameIndex(RenameIndexOperation op);
    void visitExecute(ExecuteOperation op);
}
