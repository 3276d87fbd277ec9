package org.shale.migration.dialect.sqlite;

import lombok.Getter;
import org.shale.migration.RebuildTableBuilder;
import org.shale.migration.operation.AddColumnOperation;
import org.shale.migration.operation.CreateIndexOperation;
import org.shale.migration.operation.CreateTableOperation;
import org.shale.migration.operation.DropIndexOperation;
import org.shale.migration.operation.DropTableOperation;
import org.shale.migration.operation.ExecuteOperation;
import org.shale.migration.operation.RebuildTableOperation;
import org.shale.migration.operation.RenameIndexOperation;
import org.shale.migration.operation.RenameTableOperation;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.migration.spi.visitor.SqlGeneratingVisitor;

import java.util.ArrayList;
import java.util.List;

public class SqliteMigrationVisitor implements SqlGeneratingVisitor {
    private final DdlDialect dialect;
    @Getter
    private final List<String> statements = new ArrayList<>();

    public SqliteMigrationVisitor(DdlDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public void visitCreateTable(CreateTableOperation op) {
        statements.add(dialect.getCreateTableSql(op.table()));
    }

    @Override
    public void visitDropTable(DropTableOperation op) {
        statements.add(dialect.getDropTableSql(op.tableName(), op.ifExists()));
    }

    @Override
    public void visitRenameTable(RenameTableOperation op) {
        // 인덱스는 테이블을 따라가므로 별도 SQL 불필요
        statements.add(dialect.getRenameTableSql(op.from(), op.to()));
    }

    @Override
    public void visitAddColumn(AddColumnOperation op) {
        statements.add(dialect.getAddColumnSql(op.tableName(), op.column()));
    }

    @Override
    public void visitRebuildTable(RebuildTableOperation op) {
        statements.addAll(new RebuildTableBuilder(op.originalName(), dialect)
                .defaultsFrom(op)
                .build());
    }

    @Override
    public void visitCreateIndex(CreateIndexOperation op) {
        statements.add(dialect.indexStatement(op.index(), op.ifNotExists()));
    }

    @Override
    public void visitDropIndex(DropIndexOperation op) {
        statements.add(dialect.getDropIndexSql(op.indexName(), op.ifExists()));
    }

    @Override
    public void visitRenameIndex(RenameIndexOperation op) {
        statements.add(dialect.getDropIndexSql(op.from(), false));
        statements.add(dialect.indexStatement(op.renamed(), false));
    }

    @Override
    public void visitExecute(ExecuteOperation op) {
        // opaque: 실행 시점에 블록이 직접 데이터베이스를 다룬다
    }
}
