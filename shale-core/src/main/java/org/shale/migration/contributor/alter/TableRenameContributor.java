package org.shale.migration.contributor.alter;

import org.shale.migration.contributor.StatementContributor;
import org.shale.migration.spi.dialect.DdlDialect;

import java.util.List;

public record TableRenameContributor(String oldTableName, String newTableName) implements StatementContributor {
    @Override
    public int priority() {
        return 40; // 원본 DROP 이후
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getRenameTableSql(oldTableName, newTableName));
    }
}
